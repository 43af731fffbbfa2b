package ca.gc.nrc.pyxis.infrastructure.modules;

import ca.gc.nrc.pyxis.application.module.FrameStreamer;
import ca.gc.nrc.pyxis.application.module.InputPort;
import ca.gc.nrc.pyxis.application.module.ModuleContext;
import ca.gc.nrc.pyxis.application.module.WritingModule;
import ca.gc.nrc.pyxis.domain.attribute.AttributeArray;
import ca.gc.nrc.pyxis.domain.attribute.AttributeValue;
import ca.gc.nrc.pyxis.domain.error.ModuleParameterException;
import ca.gc.nrc.pyxis.validation.Paths;
import ca.gc.nrc.pyxis.validation.Strings;
import java.io.BufferedOutputStream;
import java.io.DataOutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Exports a dataset to the output directory as {@code <name>.raw} plus {@code <name>.json}.
 *
 * <p>Existing files with the same name are replaced. Storage is left untouched.</p>
 */
public final class RawStackWritingModule implements WritingModule {
  private static final Logger log = LoggerFactory.getLogger(RawStackWritingModule.class);
  static final String INPUT_ROLE = "in";

  private final String name;
  private final String inputTag;
  private final String baseName;

  /**
   * Creates a writer.
   *
   * @param name module name
   * @param inputTag dataset to export
   * @param baseName file name without extension, resolved against the configured output directory
   */
  public RawStackWritingModule(String name, String inputTag, String baseName) {
    this.name = Objects.requireNonNull(name, "name");
    this.inputTag = Objects.requireNonNull(inputTag, "inputTag");
    try {
      this.baseName = Strings.requireFileName("file", baseName);
    } catch (IllegalArgumentException ex) {
      throw new ModuleParameterException("Module '" + name + "': " + ex.getMessage());
    }
  }

  @Override
  public String name() {
    return name;
  }

  @Override
  public Map<String, String> inputs() {
    return Map.of(INPUT_ROLE, inputTag);
  }

  @Override
  public void run(ModuleContext context) throws Exception {
    InputPort in = context.input(INPUT_ROLE);
    Path directory = Paths.validateWritableDir(context.config().outputDir(), true);
    Path rawFile = RawStackFiles.rawPath(directory, baseName);

    long frames;
    try (DataOutputStream out = new DataOutputStream(
        new BufferedOutputStream(Files.newOutputStream(rawFile), 1 << 16))) {
      FrameStreamer streamer = new FrameStreamer(in, context.framesPerChunk(in));
      frames = streamer.forEachBlock((range, block) -> {
        for (int i = 0; i < block.size(); i++) {
          out.writeDouble(block.getFlat(i));
        }
      });
    }

    Map<String, AttributeValue> statics = new LinkedHashMap<>();
    for (String key : in.staticAttributeKeys()) {
      in.staticAttribute(key).ifPresent(value -> statics.put(key, value));
    }
    Map<String, AttributeArray> nonStatics = new LinkedHashMap<>();
    for (String key : in.nonStaticAttributeKeys()) {
      in.nonStaticAttribute(key).ifPresent(values -> nonStatics.put(key, values));
    }
    RawStackFiles.writeHeader(RawStackFiles.sidecarPath(directory, baseName),
        new RawStackFiles.Header(in.shape(), statics, nonStatics));
    log.info("Exported {} frames of '{}' to {}", frames, in.tag(), rawFile);
  }
}
