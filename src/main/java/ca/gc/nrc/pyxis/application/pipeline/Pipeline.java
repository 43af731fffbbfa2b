package ca.gc.nrc.pyxis.application.pipeline;

import ca.gc.nrc.pyxis.application.module.AttributePolicy;
import ca.gc.nrc.pyxis.application.module.AttributePropagation;
import ca.gc.nrc.pyxis.application.module.AttributeSnapshot;
import ca.gc.nrc.pyxis.application.module.InputPort;
import ca.gc.nrc.pyxis.application.module.ModuleContext;
import ca.gc.nrc.pyxis.application.module.ModuleKind;
import ca.gc.nrc.pyxis.application.module.OutputPort;
import ca.gc.nrc.pyxis.application.module.PipelineModule;
import ca.gc.nrc.pyxis.application.port.ClockPort;
import ca.gc.nrc.pyxis.application.port.DataStoragePort;
import ca.gc.nrc.pyxis.application.port.MetricsPort;
import ca.gc.nrc.pyxis.application.port.PipelineListener;
import ca.gc.nrc.pyxis.config.PipelineConfig;
import ca.gc.nrc.pyxis.domain.attribute.AttributeArray;
import ca.gc.nrc.pyxis.domain.attribute.AttributeValue;
import ca.gc.nrc.pyxis.domain.attribute.StandardAttributes;
import ca.gc.nrc.pyxis.domain.dataset.DatasetTags;
import ca.gc.nrc.pyxis.domain.dataset.NdArray;
import ca.gc.nrc.pyxis.domain.dataset.Shape;
import ca.gc.nrc.pyxis.domain.error.DuplicateNameException;
import ca.gc.nrc.pyxis.domain.error.MissingInputException;
import ca.gc.nrc.pyxis.domain.error.ModuleExecutionException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * <strong>What:</strong> Ordered registry of modules run against one central storage container.
 * <p><strong>Why:</strong> Data reduction is a fixed sequence of steps whose intermediate products must persist;
 * the pipeline validates the whole chain before touching data and accounts for every step.</p>
 * <p><strong>Role:</strong> Application-layer orchestrator owning the storage handle; modules only see ports.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Register, remove and look up modules by unique name, keeping insertion order.</li>
 *   <li>Validate that every required input exists in storage or is produced by an earlier module.</li>
 *   <li>Run modules in insertion order, binding ports, propagating attributes and stamping
 *       {@code NFRAMES}/{@code FRAME_SHAPE} on outputs.</li>
 *   <li>Record timing and size per module, emit metrics and notify the listener.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Not thread-safe; one pipeline per container, enforced by the storage file
 * lock.</p>
 * <p><strong>Observability:</strong> MDC key {@code module} while a module runs; metrics
 * {@code pipeline.module.completed}, {@code pipeline.module.failed}, {@code pipeline.module.durationMillis}.</p>
 *
 * @since 0.1.0
 */
public final class Pipeline implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(Pipeline.class);
  static final String MDC_MODULE = "module";

  private final PipelineConfig config;
  private final DataStoragePort storage;
  private final MetricsPort metrics;
  private final ClockPort clock;
  private final PipelineListener listener;
  private final Map<String, PipelineModule> modules = new LinkedHashMap<>();
  private final List<ModuleRunRecord> lastRun = new ArrayList<>();
  private PipelineState state = PipelineState.IDLE;
  private boolean settingsWritten;
  private boolean closed;

  /**
   * Creates a pipeline without metrics or listener.
   *
   * @param config pipeline configuration
   * @param storage central storage, owned by the pipeline from now on
   */
  public Pipeline(PipelineConfig config, DataStoragePort storage) {
    this(config, storage, MetricsPort.NO_OP, ClockPort.SYSTEM, PipelineListener.NO_OP);
  }

  /**
   * Creates a pipeline with explicit collaborators.
   *
   * @param config pipeline configuration
   * @param storage central storage, owned by the pipeline from now on
   * @param metrics metrics sink
   * @param clock time source for run records
   * @param listener lifecycle listener
   */
  public Pipeline(
      PipelineConfig config,
      DataStoragePort storage,
      MetricsPort metrics,
      ClockPort clock,
      PipelineListener listener) {
    this.config = Objects.requireNonNull(config, "config");
    this.storage = Objects.requireNonNull(storage, "storage");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.listener = Objects.requireNonNull(listener, "listener");
  }

  public PipelineConfig config() {
    return config;
  }

  public PipelineState state() {
    return state;
  }

  /**
   * Registers a module at the end of the execution order.
   *
   * @param module module to add
   * @throws DuplicateNameException when a module with the same name is registered
   * @throws IllegalArgumentException when the name or a declared tag is invalid, or the declared ports do not
   *     match the module's capability
   */
  public void addModule(PipelineModule module) {
    Objects.requireNonNull(module, "module");
    ensureOpen();
    String name = DatasetTags.requireValidName("module name", module.name());
    if (modules.containsKey(name)) {
      throw new DuplicateNameException(name);
    }
    checkDeclaration(module);
    modules.put(name, module);
    log.debug("Added module '{}' ({})", name, module.kind());
  }

  /**
   * Removes a module.
   *
   * @param name module name
   * @return {@code true} when the module was registered
   */
  public boolean removeModule(String name) {
    boolean removed = modules.remove(name) != null;
    if (removed) {
      log.debug("Removed module '{}'", name);
    }
    return removed;
  }

  /**
   * Registered module names in execution order.
   *
   * @return ordered names
   */
  public List<String> moduleNames() {
    return List.copyOf(modules.keySet());
  }

  public Optional<PipelineModule> module(String name) {
    return Optional.ofNullable(modules.get(name));
  }

  /**
   * Checks that every required input of every module exists in storage or is an output of an earlier module.
   *
   * @throws MissingInputException naming the first module and tag that cannot be satisfied
   */
  public void validate() {
    ensureOpen();
    requireCanStart();
    state = PipelineState.VALIDATING;
    try {
      Set<String> known = new LinkedHashSet<>(storage.tags());
      for (PipelineModule module : modules.values()) {
        checkInputs(module, known);
        known.addAll(module.outputs().values());
      }
      log.info("Validated {} modules against {}", modules.size(), storage.path());
      state = PipelineState.IDLE;
    } catch (RuntimeException ex) {
      state = PipelineState.FAILED;
      throw ex;
    }
  }

  /**
   * Checks a single module against the datasets currently in storage.
   *
   * @param name module name
   * @throws MissingInputException when a required input is not in storage
   * @throws IllegalArgumentException when no such module is registered
   */
  public void validateModule(String name) {
    ensureOpen();
    checkInputs(requireModule(name), new LinkedHashSet<>(storage.tags()));
  }

  /**
   * Validates, then runs every module in insertion order. The first failure aborts the run; outputs written
   * so far stay in storage.
   *
   * @return records of the executed modules
   * @throws MissingInputException when validation fails; no module runs
   * @throws ModuleExecutionException when a module fails
   */
  public RunReport runAll() {
    validate();
    long start = clock.nanoTime();
    state = PipelineState.RUNNING;
    lastRun.clear();
    writeSettings();
    log.info("Running {} modules", modules.size());
    for (PipelineModule module : modules.values()) {
      lastRun.add(execute(module));
    }
    state = PipelineState.COMPLETED;
    long durationMillis = (clock.nanoTime() - start) / 1_000_000L;
    log.info("Pipeline completed {} modules in {} ms", lastRun.size(), durationMillis);
    return new RunReport(lastRun, durationMillis);
  }

  /**
   * Runs one module against the current storage contents.
   *
   * @param name module name
   * @return run record
   * @throws MissingInputException when a required input is not in storage
   * @throws ModuleExecutionException when the module fails
   */
  public ModuleRunRecord runModule(String name) {
    ensureOpen();
    requireCanStart();
    PipelineModule module = requireModule(name);
    state = PipelineState.VALIDATING;
    try {
      checkInputs(module, new LinkedHashSet<>(storage.tags()));
    } catch (RuntimeException ex) {
      state = PipelineState.FAILED;
      throw ex;
    }
    state = PipelineState.RUNNING;
    writeSettings();
    ModuleRunRecord record = execute(module);
    lastRun.clear();
    lastRun.add(record);
    state = PipelineState.COMPLETED;
    return record;
  }

  /**
   * Records of the most recent run.
   *
   * @return completed module records in execution order
   */
  public List<ModuleRunRecord> lastRun() {
    return List.copyOf(lastRun);
  }

  /**
   * Reads a whole dataset into memory.
   *
   * @param tag dataset tag
   * @return every frame
   */
  public NdArray getData(String tag) {
    ensureOpen();
    return storage.readAll(tag);
  }

  public Shape getShape(String tag) {
    ensureOpen();
    return storage.shape(tag);
  }

  public Optional<AttributeValue> getStaticAttribute(String tag, String key) {
    ensureOpen();
    return storage.staticAttribute(tag, key);
  }

  public Optional<AttributeArray> getNonStaticAttribute(String tag, String key) {
    ensureOpen();
    return storage.nonStaticAttribute(tag, key);
  }

  /**
   * Dataset tags currently in storage.
   *
   * @return tags in creation order
   */
  public List<String> storageTags() {
    ensureOpen();
    return storage.tags();
  }

  /**
   * Flushes storage and releases its lock. Idempotent.
   */
  @Override
  public void close() {
    if (closed) {
      return;
    }
    closed = true;
    storage.close();
    log.debug("Pipeline closed");
  }

  private ModuleRunRecord execute(PipelineModule module) {
    String name = module.name();
    String previousModule = MDC.get(MDC_MODULE);
    MDC.put(MDC_MODULE, name);
    long startedAt = clock.nowMillis();
    long start = clock.nanoTime();
    try {
      listener.moduleStarted(name);
      log.info("Running module '{}' ({})", name, module.kind());
      Map<String, OutputPort> outputs = new LinkedHashMap<>();
      ModuleContext context = bind(module, outputs);
      module.run(context);
      applyBookkeeping(module, context, outputs.values());
      storage.flush();

      long durationMillis = (clock.nanoTime() - start) / 1_000_000L;
      Map<String, ModuleRunRecord.OutputStats> stats = new LinkedHashMap<>();
      for (OutputPort port : outputs.values()) {
        long total = port.exists() ? port.frameCount() : 0;
        stats.put(port.tag(), new ModuleRunRecord.OutputStats(port.framesWritten(), port.bytesWritten(), total));
      }
      ModuleRunRecord record = new ModuleRunRecord(name, module.kind(), startedAt, durationMillis, stats);
      metrics.increment("pipeline.module.completed");
      metrics.observe("pipeline.module.durationMillis", durationMillis);
      listener.moduleCompleted(record);
      log.info("Module '{}' finished in {} ms ({} frames written)", name, durationMillis, record.framesWritten());
      return record;
    } catch (Exception ex) {
      state = PipelineState.FAILED;
      metrics.increment("pipeline.module.failed");
      log.error("Module '{}' failed; skipping remaining modules", name, ex);
      flushAfterFailure(ex);
      listener.moduleFailed(name, ex);
      if (ex instanceof ModuleExecutionException mee) {
        throw mee;
      }
      throw new ModuleExecutionException(name, ex);
    } finally {
      if (previousModule == null) {
        MDC.remove(MDC_MODULE);
      } else {
        MDC.put(MDC_MODULE, previousModule);
      }
    }
  }

  private ModuleContext bind(PipelineModule module, Map<String, OutputPort> outputs) {
    String name = module.name();
    Map<String, InputPort> inputs = new LinkedHashMap<>();
    for (Map.Entry<String, String> entry : module.inputs().entrySet()) {
      String role = entry.getKey();
      String tag = entry.getValue();
      if (module.optionalInputRoles().contains(role) && !storage.hasDataset(tag)) {
        log.debug("Optional input '{}' ({}) of module '{}' is absent", role, tag, name);
        continue;
      }
      inputs.put(role, InputPort.bind(name, role, tag, storage));
    }
    Collection<String> inputTags = module.inputs().values();
    for (Map.Entry<String, String> entry : module.outputs().entrySet()) {
      String role = entry.getKey();
      String tag = entry.getValue();
      outputs.put(role, new OutputPort(name, role, tag, storage, module.outputType(role), inputTags.contains(tag)));
    }
    return new ModuleContext(name, inputs, outputs, config, module.kind() == ModuleKind.WRITING);
  }

  private void applyBookkeeping(PipelineModule module, ModuleContext context, Collection<OutputPort> outputs) {
    if (module.kind() == ModuleKind.READING) {
      for (OutputPort port : outputs) {
        if (!port.exists()) {
          throw new ModuleExecutionException(module.name(),
              "reading module did not create its output '" + port.tag() + "'");
        }
      }
    }
    if (module.kind() == ModuleKind.PROCESSING && module.propagation() == AttributePolicy.COPY) {
      Optional<InputPort> primary = context.inputPorts().stream().findFirst();
      if (primary.isPresent()) {
        String src = primary.get().tag();
        for (OutputPort port : outputs) {
          if (!port.exists()) {
            continue;
          }
          Optional<int[]> selection = context.selection(port.role());
          if (selection.isPresent()) {
            AttributeSnapshot source = src.equals(port.tag())
                ? port.inputSnapshot().orElseGet(() -> AttributeSnapshot.capture(storage, src))
                : AttributeSnapshot.capture(storage, src);
            AttributePropagation.restrict(storage, module.name(), source, port.tag(), selection.get(),
                port.staticKeysSet(), port.nonStaticKeysSet());
          } else if (context.nonStaticDropped(port.role())) {
            AttributePropagation.copyStaticDropNonStatic(storage, src, port.tag(),
                port.staticKeysSet(), port.nonStaticKeysSet());
          } else {
            AttributePropagation.copy(storage, module.name(), src, port.tag(), port.staticKeysSet(),
                port.nonStaticKeysSet());
          }
        }
      }
    }
    for (OutputPort port : outputs) {
      if (port.exists()) {
        Shape shape = port.shape();
        storage.setStaticAttribute(port.tag(), StandardAttributes.NFRAMES, AttributeValue.integer(shape.frames()));
        storage.setStaticAttribute(port.tag(), StandardAttributes.FRAME_SHAPE,
            AttributeValue.text(shape.frameShapeText()));
      }
    }
  }

  private void checkInputs(PipelineModule module, Set<String> known) {
    for (Map.Entry<String, String> entry : module.inputs().entrySet()) {
      if (module.optionalInputRoles().contains(entry.getKey())) {
        continue;
      }
      if (!known.contains(entry.getValue())) {
        throw new MissingInputException(module.name(), entry.getValue());
      }
    }
  }

  private static void checkDeclaration(PipelineModule module) {
    Map<String, String> inputs = Objects.requireNonNull(module.inputs(), "inputs");
    Map<String, String> outputs = Objects.requireNonNull(module.outputs(), "outputs");
    ModuleKind kind = Objects.requireNonNull(module.kind(), "kind");
    inputs.values().forEach(DatasetTags::requireValidTag);
    outputs.values().forEach(DatasetTags::requireValidTag);
    switch (kind) {
      case READING -> {
        if (!inputs.isEmpty() || outputs.isEmpty()) {
          throw new IllegalArgumentException(
              "Reading module '" + module.name() + "' must declare outputs and no inputs");
        }
      }
      case WRITING -> {
        if (inputs.isEmpty() || !outputs.isEmpty()) {
          throw new IllegalArgumentException(
              "Writing module '" + module.name() + "' must declare inputs and no outputs");
        }
      }
      case PROCESSING -> {
        if (inputs.isEmpty() || outputs.isEmpty()) {
          throw new IllegalArgumentException(
              "Processing module '" + module.name() + "' must declare inputs and outputs");
        }
      }
      default -> throw new IllegalStateException("Unhandled module kind " + kind);
    }
  }

  private void writeSettings() {
    if (settingsWritten) {
      return;
    }
    Map<String, AttributeValue> merged = new LinkedHashMap<>(storage.settings());
    merged.putAll(config.settingsSnapshot());
    storage.writeSettings(merged);
    settingsWritten = true;
  }

  private void flushAfterFailure(Exception failure) {
    try {
      storage.flush();
    } catch (RuntimeException flushFailure) {
      log.error("Failed to flush storage after module failure", flushFailure);
      failure.addSuppressed(flushFailure);
    }
  }

  private PipelineModule requireModule(String name) {
    PipelineModule module = modules.get(name);
    if (module == null) {
      throw new IllegalArgumentException("No module named '" + name + "'");
    }
    return module;
  }

  private void requireCanStart() {
    if (!state.canStart()) {
      throw new IllegalStateException("Pipeline is " + state);
    }
  }

  private void ensureOpen() {
    if (closed) {
      throw new IllegalStateException("Pipeline is closed");
    }
  }
}
