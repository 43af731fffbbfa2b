package ca.gc.nrc.pyxis.config;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.Yaml;

/**
 * Ensures a working directory carries a {@code pyxis.yaml}, writing one with default values when absent.
 */
public final class ConfigFileBootstrap {
  private static final Logger log = LoggerFactory.getLogger(ConfigFileBootstrap.class);

  private ConfigFileBootstrap() {}

  /**
   * Returns the configuration file of {@code workDir}, creating it from {@link ConfigDefaults#fileTemplate()}
   * when it does not exist.
   *
   * @param workDir working directory
   * @return path of {@code pyxis.yaml}
   * @throws IOException when the directory or file cannot be written
   */
  public static Path ensureConfigFile(Path workDir) throws IOException {
    Objects.requireNonNull(workDir, "workDir");
    Path file = workDir.resolve(PipelineConfig.CONFIG_FILE_NAME);
    if (Files.exists(file)) {
      return file;
    }
    Files.createDirectories(workDir);
    DumperOptions options = new DumperOptions();
    options.setDefaultFlowStyle(DumperOptions.FlowStyle.BLOCK);
    options.setIndent(2);
    try (Writer writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8,
        StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE)) {
      writer.write("# PYXIS configuration, created with default values\n");
      new Yaml(options).dump(ConfigDefaults.fileTemplate(), writer);
    }
    log.warn("Configuration file {} was missing; created it with default values", file);
    return file;
  }
}
