package ca.gc.nrc.pyxis.infrastructure.modules;

import ca.gc.nrc.pyxis.application.module.InputPort;
import ca.gc.nrc.pyxis.application.module.ModuleContext;
import ca.gc.nrc.pyxis.application.module.OutputPort;
import ca.gc.nrc.pyxis.application.module.ProcessingModule;
import ca.gc.nrc.pyxis.domain.dataset.NdArray;
import ca.gc.nrc.pyxis.domain.error.ModuleParameterException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Copies a subset of frames, in the given order, into a new dataset or back into the input itself. Per-frame
 * attributes of the input are restricted to the same indices.
 *
 * <p>An in-place selection holds the selected frames in memory until the input is replaced.</p>
 */
public final class FrameSelectionModule implements ProcessingModule {
  static final String INPUT_ROLE = "in";
  static final String OUTPUT_ROLE = "out";

  private final String name;
  private final String inputTag;
  private final String outputTag;
  private final int[] indices;

  /**
   * Creates a selection.
   *
   * @param name module name
   * @param inputTag dataset to select from
   * @param outputTag dataset to create, or {@code inputTag} to select in place
   * @param indices frame indices to keep, at least one
   * @throws ModuleParameterException when no index is given or an index is negative
   */
  public FrameSelectionModule(String name, String inputTag, String outputTag, int... indices) {
    this.name = Objects.requireNonNull(name, "name");
    this.inputTag = Objects.requireNonNull(inputTag, "inputTag");
    this.outputTag = Objects.requireNonNull(outputTag, "outputTag");
    if (indices == null || indices.length == 0) {
      throw new ModuleParameterException("Module '" + name + "': at least one frame index is required");
    }
    for (int index : indices) {
      if (index < 0) {
        throw new ModuleParameterException("Module '" + name + "': frame index must not be negative (was "
            + index + ")");
      }
    }
    this.indices = indices.clone();
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

  int[] indices() {
    return indices.clone();
  }

  @Override
  public void run(ModuleContext context) {
    InputPort in = context.input(INPUT_ROLE);
    OutputPort out = context.output(OUTPUT_ROLE);
    long available = in.frameCount();
    for (int index : indices) {
      if (index >= available) {
        throw new ModuleParameterException("Module '" + name + "': frame index " + index + " is out of range for '"
            + in.tag() + "' with " + available + " frames");
      }
    }
    if (out.alsoInput()) {
      List<NdArray> frames = new ArrayList<>(indices.length);
      for (int index : indices) {
        frames.add(in.readFrame(index));
      }
      out.set(NdArray.concat(frames));
    } else {
      int perChunk = context.framesPerChunk(in);
      int batch = perChunk == 0 ? indices.length : perChunk;
      for (int from = 0; from < indices.length; from += batch) {
        int to = Math.min(indices.length, from + batch);
        List<NdArray> frames = new ArrayList<>(to - from);
        for (int i = from; i < to; i++) {
          frames.add(in.readFrame(indices[i]));
        }
        out.append(NdArray.concat(frames));
      }
    }
    context.recordSelection(OUTPUT_ROLE, indices);
    out.addHistory("selected frames " + Arrays.toString(indices) + " of '" + in.tag() + "'");
  }
}
