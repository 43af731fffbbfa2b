package ca.gc.nrc.pyxis.api;

import ca.gc.nrc.pyxis.application.port.DataStoragePort;
import ca.gc.nrc.pyxis.config.CompositionRoot;
import ca.gc.nrc.pyxis.config.ConfigDefaults;
import ca.gc.nrc.pyxis.config.ConfigMerger;
import ca.gc.nrc.pyxis.config.PipelineConfig;
import ca.gc.nrc.pyxis.config.YamlConfigLoader;
import ca.gc.nrc.pyxis.domain.attribute.AttributeArray;
import ca.gc.nrc.pyxis.domain.attribute.AttributeValue;
import ca.gc.nrc.pyxis.domain.error.PyxisException;
import ca.gc.nrc.pyxis.domain.error.StorageException;
import ca.gc.nrc.pyxis.infrastructure.metrics.NoOpMetricsAdapter;
import ca.gc.nrc.pyxis.logging.LoggingConfigurator;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@code pyxis inspect}: lists the datasets of a container, or the attributes of one dataset.
 */
public final class InspectCli {
  private static final Logger log = LoggerFactory.getLogger(InspectCli.class);
  private static final String COMMAND = "inspect";
  private static final String SUMMARY_USAGE = "usage: pyxis inspect workDir=DIR [tag=TAG] [config=FILE]";
  private static final String HELP_TEXT = """
      PYXIS container inspection

      Usage:
        pyxis inspect workDir=./reduction [tag=selected]

      Required:
        workDir=DIR      Working directory holding the storage container

      Optional:
        tag=TAG          Print static and per-frame attributes of one dataset
        config=FILE      Configuration file (default: workDir/pyxis.yaml when present)
        storageFile=NAME Container directory name (default: pyxis_database.n5)
        --verbose        Enable DEBUG logging
        --help           Show this message
      """;

  private InspectCli() {}

  public static void main(String[] args) {
    System.exit(run(args).code());
  }

  /**
   * Runs the command without terminating the JVM.
   *
   * @param args command arguments (without the {@code inspect} token)
   * @return exit code
   */
  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
    }
    Set<String> unknownFlags = input.unknownFlags(Set.of());
    if (!unknownFlags.isEmpty()) {
      log.error("Unknown flags: {}", unknownFlags);
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    Map<String, String> kv;
    Path workDir;
    try {
      kv = new LinkedHashMap<>(CliArgsParser.toMap(input.keyValueArgs()));
      workDir = ConfigCliUtils.requirePath("workDir", kv.get("workDir")).toAbsolutePath().normalize();
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }
    kv.put("workDir", workDir.toString());
    String tag = kv.remove("tag");

    String configArg = ConfigCliUtils.extractConfigPath(kv);
    Path configPath = configArg == null
        ? workDir.resolve(PipelineConfig.CONFIG_FILE_NAME)
        : Path.of(configArg);
    if (configArg != null && !Files.exists(configPath)) {
      log.error("Configuration file does not exist: {}", configPath);
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    PipelineConfig config;
    try {
      Optional<Map<String, String>> yaml = YamlConfigLoader.load(configPath, COMMAND);
      Map<String, String> effective = ConfigMerger.buildEffectiveConfig(
          COMMAND, yaml, kv, ConfigDefaults.asFlatMap(COMMAND), log::warn);
      config = PipelineConfig.fromMap(effective);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid configuration: {}", ex.getMessage());
      return ExitCode.CONFIG_ERROR;
    } catch (IOException ex) {
      log.error("Unable to read configuration {}", configPath, ex);
      return ExitCode.IO_ERROR;
    }

    if (!Files.isDirectory(config.storagePath())) {
      log.error("No storage container at {}", config.storagePath());
      return ExitCode.IO_ERROR;
    }
    try (CompositionRoot root = new CompositionRoot(config, new NoOpMetricsAdapter());
        DataStoragePort storage = root.storage()) {
      if (tag == null) {
        printSummary(storage);
        return ExitCode.SUCCESS;
      }
      if (!storage.hasDataset(tag)) {
        log.error("No dataset '{}' in {}", tag, storage.path());
        return ExitCode.INVALID_ARGS;
      }
      printDataset(storage, tag);
      return ExitCode.SUCCESS;
    } catch (StorageException ex) {
      log.error("Unable to open {}: {}", config.storagePath(), ex.getMessage(), ex);
      return ExitCode.IO_ERROR;
    } catch (PyxisException ex) {
      log.error("Container {} is inconsistent: {}", config.storagePath(), ex.getMessage());
      return ExitCode.RUNTIME_FAILURE;
    } catch (Exception ex) {
      log.error("Unexpected failure while inspecting {}", config.storagePath(), ex);
      return ExitCode.RUNTIME_FAILURE;
    }
  }

  private static void printSummary(DataStoragePort storage) {
    CliPrinter.println("Container " + storage.path());
    Map<String, AttributeValue> settings = storage.settings();
    if (!settings.isEmpty()) {
      CliPrinter.println("Settings:");
      settings.forEach((key, value) -> CliPrinter.printf("  %-20s %s", key, value.asText()));
    }
    CliPrinter.println("Datasets:");
    for (String tag : storage.tags()) {
      CliPrinter.printf("  %-24s %-8s %s", tag, storage.dataType(tag), storage.shape(tag));
    }
  }

  private static void printDataset(DataStoragePort storage, String tag) {
    CliPrinter.printf("Dataset %s %s %s", tag, storage.dataType(tag), storage.shape(tag));
    CliPrinter.println("Static attributes:");
    for (String key : storage.staticAttributeKeys(tag)) {
      storage.staticAttribute(tag, key)
          .ifPresent(value -> CliPrinter.printf("  %-24s %s", key, value.asText()));
    }
    CliPrinter.println("Per-frame attributes:");
    for (String key : storage.nonStaticAttributeKeys(tag)) {
      Optional<AttributeArray> values = storage.nonStaticAttribute(tag, key);
      values.ifPresent(array -> CliPrinter.printf("  %-24s %s[%d]", key, array.kind(), array.length()));
    }
  }
}
