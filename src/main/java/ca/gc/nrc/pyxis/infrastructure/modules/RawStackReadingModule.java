package ca.gc.nrc.pyxis.infrastructure.modules;

import ca.gc.nrc.pyxis.application.module.FrameChunks;
import ca.gc.nrc.pyxis.application.module.ModuleContext;
import ca.gc.nrc.pyxis.application.module.OutputPort;
import ca.gc.nrc.pyxis.application.module.ReadingModule;
import ca.gc.nrc.pyxis.domain.dataset.DataType;
import ca.gc.nrc.pyxis.domain.dataset.FrameRange;
import ca.gc.nrc.pyxis.domain.dataset.NdArray;
import ca.gc.nrc.pyxis.domain.dataset.Shape;
import ca.gc.nrc.pyxis.domain.error.ModuleParameterException;
import ca.gc.nrc.pyxis.validation.Paths;
import ca.gc.nrc.pyxis.validation.Strings;
import java.io.BufferedInputStream;
import java.io.DataInputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Imports a raw stack ({@code <name>.raw} plus {@code <name>.json}) from the input directory into storage.
 *
 * <p>Frames are streamed chunk by chunk; attributes from the sidecar are copied onto the output dataset.</p>
 */
public final class RawStackReadingModule implements ReadingModule {
  private static final Logger log = LoggerFactory.getLogger(RawStackReadingModule.class);
  static final String OUTPUT_ROLE = "out";

  private final String name;
  private final String outputTag;
  private final String baseName;
  private final DataType dataType;

  /**
   * Creates a reader storing {@code FLOAT64} data.
   *
   * @param name module name
   * @param outputTag tag of the imported dataset
   * @param baseName file name without extension, resolved against the configured input directory
   */
  public RawStackReadingModule(String name, String outputTag, String baseName) {
    this(name, outputTag, baseName, DataType.FLOAT64);
  }

  /**
   * Creates a reader.
   *
   * @param name module name
   * @param outputTag tag of the imported dataset
   * @param baseName file name without extension, resolved against the configured input directory
   * @param dataType element type of the stored dataset
   */
  public RawStackReadingModule(String name, String outputTag, String baseName, DataType dataType) {
    this.name = Objects.requireNonNull(name, "name");
    this.outputTag = Objects.requireNonNull(outputTag, "outputTag");
    try {
      this.baseName = Strings.requireFileName("file", baseName);
    } catch (IllegalArgumentException ex) {
      throw new ModuleParameterException("Module '" + name + "': " + ex.getMessage());
    }
    this.dataType = Objects.requireNonNull(dataType, "dataType");
  }

  @Override
  public String name() {
    return name;
  }

  @Override
  public Map<String, String> outputs() {
    return Map.of(OUTPUT_ROLE, outputTag);
  }

  @Override
  public DataType outputType(String role) {
    return dataType;
  }

  @Override
  public void run(ModuleContext context) throws IOException {
    Path directory = context.config().inputDir();
    Path rawFile = Paths.validateReadableFile(RawStackFiles.rawPath(directory, baseName));
    Path sidecar = Paths.validateReadableFile(RawStackFiles.sidecarPath(directory, baseName));
    RawStackFiles.Header header = RawStackFiles.readHeader(sidecar);
    Shape shape = header.shape();
    long expectedBytes = shape.elementCount() * Double.BYTES;
    long actualBytes = Files.size(rawFile);
    if (actualBytes != expectedBytes) {
      throw new IOException(rawFile + " holds " + actualBytes + " bytes but shape " + shape + " needs "
          + expectedBytes);
    }

    OutputPort out = context.output(OUTPUT_ROLE);
    int perChunk = context.framesPerChunk(shape.frameSize() * Double.BYTES);
    int frameSize = Math.toIntExact(shape.frameSize());
    try (DataInputStream in = new DataInputStream(new BufferedInputStream(Files.newInputStream(rawFile), 1 << 16))) {
      for (FrameRange range : FrameChunks.plan(shape.frames(), perChunk)) {
        double[] values = new double[Math.toIntExact(range.length() * frameSize)];
        for (int i = 0; i < values.length; i++) {
          values[i] = in.readDouble();
        }
        out.append(NdArray.wrap(shape.withFrames(range.length()), values));
      }
    }
    if (!out.exists()) {
      // zero frames: create the empty dataset so its shape is known downstream
      out.append(NdArray.zeros(shape.withFrames(0)));
    }
    header.statics().forEach(out::setStaticAttribute);
    header.nonStatics().forEach(out::setNonStaticAttribute);
    out.addHistory("imported " + rawFile.getFileName());
    log.info("Imported {} frames of {} from {}", shape.frames(), shape.frameShapeText(), rawFile);
  }
}
