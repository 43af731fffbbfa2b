package ca.gc.nrc.pyxis.infrastructure.modules;

import ca.gc.nrc.pyxis.application.module.DatasetPort;
import ca.gc.nrc.pyxis.application.module.FrameStreamer;
import ca.gc.nrc.pyxis.application.module.InputPort;
import ca.gc.nrc.pyxis.application.module.ModuleContext;
import ca.gc.nrc.pyxis.application.module.OutputPort;
import ca.gc.nrc.pyxis.application.module.ProcessingModule;
import ca.gc.nrc.pyxis.domain.error.ModuleParameterException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Subtracts a mean background frame from every frame of the science stack.
 *
 * <p>The background is the pixel-wise mean of the optional {@code background} input, or of the science stack
 * itself when that input is not declared or absent from storage. Both passes stream chunk by chunk.</p>
 */
public final class BackgroundSubtractionModule implements ProcessingModule {
  private static final Logger log = LoggerFactory.getLogger(BackgroundSubtractionModule.class);
  static final String INPUT_ROLE = "in";
  static final String BACKGROUND_ROLE = "background";
  static final String OUTPUT_ROLE = "out";

  private final String name;
  private final String inputTag;
  private final String backgroundTag;
  private final String outputTag;

  /**
   * Creates a subtraction step.
   *
   * @param name module name
   * @param inputTag science stack
   * @param backgroundTag stack whose mean frame is subtracted, or {@code null} to use the science stack
   * @param outputTag dataset receiving the subtracted frames
   */
  public BackgroundSubtractionModule(String name, String inputTag, String backgroundTag, String outputTag) {
    this.name = Objects.requireNonNull(name, "name");
    this.inputTag = Objects.requireNonNull(inputTag, "inputTag");
    this.backgroundTag = backgroundTag == null || backgroundTag.isBlank() ? null : backgroundTag;
    this.outputTag = Objects.requireNonNull(outputTag, "outputTag");
  }

  @Override
  public String name() {
    return name;
  }

  @Override
  public Map<String, String> inputs() {
    Map<String, String> inputs = new LinkedHashMap<>();
    inputs.put(INPUT_ROLE, inputTag);
    if (backgroundTag != null) {
      inputs.put(BACKGROUND_ROLE, backgroundTag);
    }
    return inputs;
  }

  @Override
  public Set<String> optionalInputRoles() {
    return Set.of(BACKGROUND_ROLE);
  }

  @Override
  public Map<String, String> outputs() {
    return Map.of(OUTPUT_ROLE, outputTag);
  }

  @Override
  public void run(ModuleContext context) throws Exception {
    InputPort in = context.input(INPUT_ROLE);
    DatasetPort background = context.optionalInput(BACKGROUND_ROLE).orElse(null);
    if (background == null) {
      if (backgroundTag != null) {
        log.warn("Background '{}' not in storage; using the mean of '{}'", backgroundTag, in.tag());
      }
      background = in;
    }
    if (!background.shape().sameFrameShape(in.shape())) {
      throw new ModuleParameterException("Module '" + name + "': background '" + background.tag()
          + "' has frame shape " + background.shape().frameShapeText() + " but '" + in.tag() + "' has "
          + in.shape().frameShapeText());
    }
    double[] mean = meanFrame(background, context.framesPerChunk(background));

    OutputPort out = context.output(OUTPUT_ROLE);
    FrameStreamer streamer = new FrameStreamer(in, context.framesPerChunk(in));
    streamer.mapBlocks(out, (range, block) -> {
      int frameSize = block.frameSize();
      for (long f = 0; f < block.frames(); f++) {
        for (int offset = 0; offset < frameSize; offset++) {
          block.set(f, offset, block.get(f, offset) - mean[offset]);
        }
      }
      return block;
    });
    out.addHistory("subtracted mean of '" + background.tag() + "'");
  }

  static double[] meanFrame(DatasetPort source, int framesPerChunk) throws Exception {
    long frames = source.frameCount();
    if (frames == 0) {
      throw new IllegalStateException("cannot compute a mean frame of empty dataset '" + source.tag() + "'");
    }
    double[] sum = new double[Math.toIntExact(source.shape().frameSize())];
    new FrameStreamer(source, framesPerChunk).forEachBlock((range, block) -> {
      for (long f = 0; f < block.frames(); f++) {
        for (int offset = 0; offset < sum.length; offset++) {
          sum[offset] += block.get(f, offset);
        }
      }
    });
    for (int i = 0; i < sum.length; i++) {
      sum[i] /= frames;
    }
    return sum;
  }
}
