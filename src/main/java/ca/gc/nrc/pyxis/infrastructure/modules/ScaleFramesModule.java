package ca.gc.nrc.pyxis.infrastructure.modules;

import ca.gc.nrc.pyxis.application.module.FrameStreamer;
import ca.gc.nrc.pyxis.application.module.InputPort;
import ca.gc.nrc.pyxis.application.module.ModuleContext;
import ca.gc.nrc.pyxis.application.module.OutputPort;
import ca.gc.nrc.pyxis.application.module.ProcessingModule;
import ca.gc.nrc.pyxis.domain.error.ModuleParameterException;
import java.util.Map;
import java.util.Objects;

/**
 * Applies {@code value * factor + offset} to every pixel, chunk by chunk. Input and output may be the same tag,
 * in which case frames are rewritten in place.
 */
public final class ScaleFramesModule implements ProcessingModule {
  static final String INPUT_ROLE = "in";
  static final String OUTPUT_ROLE = "out";

  private final String name;
  private final String inputTag;
  private final String outputTag;
  private final double factor;
  private final double offset;

  /**
   * Creates a scaling step.
   *
   * @param name module name
   * @param inputTag dataset to scale
   * @param outputTag dataset receiving the scaled frames
   * @param factor multiplicative factor, finite
   * @param offset additive offset, finite
   */
  public ScaleFramesModule(String name, String inputTag, String outputTag, double factor, double offset) {
    this.name = Objects.requireNonNull(name, "name");
    this.inputTag = Objects.requireNonNull(inputTag, "inputTag");
    this.outputTag = Objects.requireNonNull(outputTag, "outputTag");
    if (!Double.isFinite(factor) || !Double.isFinite(offset)) {
      throw new ModuleParameterException("Module '" + name + "': factor and offset must be finite");
    }
    this.factor = factor;
    this.offset = offset;
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
  public Map<String, String> outputs() {
    return Map.of(OUTPUT_ROLE, outputTag);
  }

  @Override
  public void run(ModuleContext context) throws Exception {
    InputPort in = context.input(INPUT_ROLE);
    OutputPort out = context.output(OUTPUT_ROLE);
    FrameStreamer streamer = new FrameStreamer(in, context.framesPerChunk(in));
    streamer.mapBlocks(out, (range, block) -> block.map(v -> v * factor + offset));
    out.addHistory("scaled '" + in.tag() + "' by " + factor + " with offset " + offset);
  }
}
