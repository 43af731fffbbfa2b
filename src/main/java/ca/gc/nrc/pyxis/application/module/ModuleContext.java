package ca.gc.nrc.pyxis.application.module;

import ca.gc.nrc.pyxis.config.PipelineConfig;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * <strong>What:</strong> Everything a module may touch while it runs: bound ports, configuration and chunk sizing.
 * <p><strong>Why:</strong> Modules never see storage directly; the context limits them to their declared datasets
 * and records the bookkeeping requests the pipeline applies after the run.</p>
 * <p><strong>Role:</strong> Built by the pipeline immediately before a module runs and discarded afterwards.</p>
 * <p><strong>Thread-safety:</strong> Not thread-safe.</p>
 *
 * @since 0.1.0
 */
public final class ModuleContext {
  private final String moduleName;
  private final Map<String, InputPort> inputs;
  private final Map<String, OutputPort> outputs;
  private final PipelineConfig config;
  private final boolean readOnly;
  private final Map<String, int[]> selections = new LinkedHashMap<>();
  private final Set<String> droppedNonStatic = new LinkedHashSet<>();

  /**
   * Creates a context.
   *
   * @param moduleName running module
   * @param inputs bound inputs by role; optional roles whose dataset is missing are absent
   * @param outputs output ports by role
   * @param config pipeline configuration
   * @param readOnly whether output handles are refused
   */
  public ModuleContext(String moduleName, Map<String, InputPort> inputs, Map<String, OutputPort> outputs,
      PipelineConfig config, boolean readOnly) {
    this.moduleName = Objects.requireNonNull(moduleName, "moduleName");
    this.inputs = Collections.unmodifiableMap(new LinkedHashMap<>(inputs));
    this.outputs = Collections.unmodifiableMap(new LinkedHashMap<>(outputs));
    this.config = Objects.requireNonNull(config, "config");
    this.readOnly = readOnly;
  }

  public String moduleName() {
    return moduleName;
  }

  public PipelineConfig config() {
    return config;
  }

  /**
   * Bound input for a role.
   *
   * @param role input role
   * @return bound port
   * @throws IllegalArgumentException when the role is unknown or its optional dataset is missing
   */
  public InputPort input(String role) {
    InputPort port = inputs.get(role);
    if (port == null) {
      throw new IllegalArgumentException("Module '" + moduleName + "' has no bound input '" + role + "'");
    }
    return port;
  }

  /**
   * Input for an optional role.
   *
   * @param role input role
   * @return bound port, empty when the dataset was missing
   */
  public Optional<InputPort> optionalInput(String role) {
    return Optional.ofNullable(inputs.get(role));
  }

  /**
   * Output handle for a role.
   *
   * @param role output role
   * @return output port
   * @throws IllegalStateException when the module runs with a read-only context
   * @throws IllegalArgumentException when the role is unknown
   */
  public OutputPort output(String role) {
    if (readOnly) {
      throw new IllegalStateException("Module '" + moduleName + "' has read-only access to storage");
    }
    OutputPort port = outputs.get(role);
    if (port == null) {
      throw new IllegalArgumentException("Module '" + moduleName + "' has no output '" + role + "'");
    }
    return port;
  }

  public Collection<InputPort> inputPorts() {
    return inputs.values();
  }

  public Collection<OutputPort> outputPorts() {
    return outputs.values();
  }

  public boolean isReadOnly() {
    return readOnly;
  }

  /**
   * Frames to process per chunk for the given port.
   *
   * @param port dataset whose frame size bounds the chunk
   * @return frames per chunk; {@code 0} means all frames at once
   */
  public int framesPerChunk(DatasetPort port) {
    return config.framesPerChunk(port.frameBytesInMemory());
  }

  /**
   * Frames to process per chunk for frames of the given in-memory size.
   *
   * @param frameBytes bytes per frame in memory
   * @return frames per chunk; {@code 0} means all frames at once
   */
  public int framesPerChunk(long frameBytes) {
    return config.framesPerChunk(frameBytes);
  }

  /**
   * Records that an output holds the primary input's frames at {@code indices}, so per-frame attributes are
   * subset with the same indices.
   *
   * @param outputRole output role
   * @param indices primary input frame indices, in output order
   */
  public void recordSelection(String outputRole, int[] indices) {
    requireOutputRole(outputRole);
    selections.put(outputRole, Objects.requireNonNull(indices, "indices").clone());
  }

  /**
   * Requests that per-frame attributes are not propagated to an output whose frame count changed without a
   * frame selection.
   *
   * @param outputRole output role
   */
  public void dropNonStatic(String outputRole) {
    requireOutputRole(outputRole);
    droppedNonStatic.add(outputRole);
  }

  public Optional<int[]> selection(String outputRole) {
    int[] indices = selections.get(outputRole);
    return indices == null ? Optional.empty() : Optional.of(indices.clone());
  }

  public boolean nonStaticDropped(String outputRole) {
    return droppedNonStatic.contains(outputRole);
  }

  private void requireOutputRole(String role) {
    if (readOnly || !outputs.containsKey(role)) {
      throw new IllegalArgumentException("Module '" + moduleName + "' has no output '" + role + "'");
    }
  }
}
