package ca.gc.nrc.pyxis.infrastructure.modules;

import ca.gc.nrc.pyxis.application.module.FrameChunks;
import ca.gc.nrc.pyxis.application.module.ModuleContext;
import ca.gc.nrc.pyxis.application.module.OutputPort;
import ca.gc.nrc.pyxis.application.module.ReadingModule;
import ca.gc.nrc.pyxis.domain.attribute.AttributeArray;
import ca.gc.nrc.pyxis.domain.attribute.AttributeValue;
import ca.gc.nrc.pyxis.domain.dataset.DataType;
import ca.gc.nrc.pyxis.domain.dataset.FrameRange;
import ca.gc.nrc.pyxis.domain.dataset.NdArray;
import ca.gc.nrc.pyxis.domain.dataset.Shape;
import ca.gc.nrc.pyxis.domain.error.ModuleParameterException;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Generates a stack of frames without touching the file system.
 *
 * <p>Every pixel of frame {@code i} holds {@code value + i * step}. Optional static attributes are stamped on the
 * output, and an optional index attribute stores each frame's index as a per-frame {@code REAL} value.</p>
 */
public final class SyntheticFramesReadingModule implements ReadingModule {
  static final String OUTPUT_ROLE = "out";

  private final String name;
  private final String outputTag;
  private final long frames;
  private final long[] frameDims;
  private final double value;
  private final double step;
  private final DataType dataType;
  private final Map<String, AttributeValue> staticAttributes;
  private final String indexAttribute;

  /**
   * Creates a generator of constant frames.
   *
   * @param name module name
   * @param outputTag tag of the generated dataset
   * @param frames number of frames, at least one
   * @param frameDims dimensions of one frame
   */
  public SyntheticFramesReadingModule(String name, String outputTag, long frames, long... frameDims) {
    this(name, outputTag, frames, frameDims, 0.0, 0.0, DataType.FLOAT64, Map.of(), null);
  }

  /**
   * Creates a fully parameterized generator.
   *
   * @param name module name
   * @param outputTag tag of the generated dataset
   * @param frames number of frames, at least one
   * @param frameDims dimensions of one frame
   * @param value pixel value of the first frame
   * @param step increment applied per frame index
   * @param dataType element type of the output dataset
   * @param staticAttributes static attributes to set on the output
   * @param indexAttribute name of the per-frame index attribute, or {@code null} for none
   * @throws ModuleParameterException when the frame count or shape is invalid
   */
  public SyntheticFramesReadingModule(
      String name,
      String outputTag,
      long frames,
      long[] frameDims,
      double value,
      double step,
      DataType dataType,
      Map<String, AttributeValue> staticAttributes,
      String indexAttribute) {
    this.name = Objects.requireNonNull(name, "name");
    this.outputTag = Objects.requireNonNull(outputTag, "outputTag");
    if (frames < 1) {
      throw new ModuleParameterException("Module '" + name + "': frames must be at least 1 (was " + frames + ")");
    }
    Objects.requireNonNull(frameDims, "frameDims");
    for (long dim : frameDims) {
      if (dim < 1) {
        throw new ModuleParameterException(
            "Module '" + name + "': frame dimensions must be positive (was " + Arrays.toString(frameDims) + ")");
      }
    }
    this.frames = frames;
    this.frameDims = frameDims.clone();
    this.value = value;
    this.step = step;
    this.dataType = Objects.requireNonNull(dataType, "dataType");
    this.staticAttributes = Collections.unmodifiableMap(new LinkedHashMap<>(
        staticAttributes == null ? Map.of() : staticAttributes));
    this.indexAttribute = indexAttribute == null || indexAttribute.isBlank() ? null : indexAttribute;
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
  public void run(ModuleContext context) {
    OutputPort out = context.output(OUTPUT_ROLE);
    Shape frameShape = Shape.ofFrames(1, frameDims);
    int perChunk = context.framesPerChunk(frameShape.frameSize() * Double.BYTES);
    for (FrameRange range : FrameChunks.plan(frames, perChunk)) {
      NdArray block = NdArray.zeros(frameShape.withFrames(range.length()));
      for (long i = 0; i < range.length(); i++) {
        double pixel = value + (range.start() + i) * step;
        for (int offset = 0; offset < block.frameSize(); offset++) {
          block.set(i, offset, pixel);
        }
      }
      out.append(block);
    }
    staticAttributes.forEach(out::setStaticAttribute);
    if (indexAttribute != null) {
      double[] index = new double[Math.toIntExact(frames)];
      for (int i = 0; i < index.length; i++) {
        index[i] = i;
      }
      out.setNonStaticAttribute(indexAttribute, AttributeArray.reals(index));
    }
    out.addHistory("synthetic " + frames + " frames of " + frameShape.frameShapeText());
  }
}
