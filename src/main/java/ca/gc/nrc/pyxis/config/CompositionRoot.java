package ca.gc.nrc.pyxis.config;

import ca.gc.nrc.pyxis.application.pipeline.Pipeline;
import ca.gc.nrc.pyxis.application.port.ClockPort;
import ca.gc.nrc.pyxis.application.port.DataStoragePort;
import ca.gc.nrc.pyxis.application.port.MetricsPort;
import ca.gc.nrc.pyxis.application.port.PipelineListener;
import ca.gc.nrc.pyxis.infrastructure.metrics.NoOpMetricsAdapter;
import ca.gc.nrc.pyxis.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import ca.gc.nrc.pyxis.infrastructure.recipe.ModuleFactory;
import ca.gc.nrc.pyxis.infrastructure.storage.N5ContainerStorage;
import ca.gc.nrc.pyxis.infrastructure.time.SystemClockAdapter;
import java.util.Objects;

/**
 * <strong>What:</strong> Composition root that wires a {@link Pipeline} to its storage, metrics and clock adapters.
 * <p><strong>Why:</strong> Keeps adapter selection in one place so the CLI and embedding code share the same
 * wiring.</p>
 * <p><strong>Role:</strong> Adapter composition root between configuration and the application layer.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Open the container storage at {@link PipelineConfig#storagePath()} with the configured memory budget and
 *       protected attributes.</li>
 *   <li>Select the OpenTelemetry or no-op metrics adapter.</li>
 *   <li>Expose the module factory used for recipes.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Not thread-safe; create one per run.</p>
 * <p><strong>Observability:</strong> {@link #close()} flushes and shuts down the metrics exporter.</p>
 *
 * @since 0.1.0
 */
public final class CompositionRoot implements AutoCloseable {
  private final PipelineConfig config;
  private final MetricsPort metrics;
  private final ClockPort clock = new SystemClockAdapter();

  /**
   * Creates a root with metrics export enabled or disabled.
   *
   * @param config pipeline configuration
   * @param exportMetrics {@code true} to export through OpenTelemetry
   */
  public CompositionRoot(PipelineConfig config, boolean exportMetrics) {
    this(config, exportMetrics ? new OpenTelemetryMetricsAdapter() : new NoOpMetricsAdapter());
  }

  /**
   * Creates a root with an explicit metrics adapter.
   *
   * @param config pipeline configuration
   * @param metrics metrics adapter
   */
  public CompositionRoot(PipelineConfig config, MetricsPort metrics) {
    this.config = Objects.requireNonNull(config, "config");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  public PipelineConfig config() {
    return config;
  }

  public MetricsPort metrics() {
    return metrics;
  }

  public ClockPort clock() {
    return clock;
  }

  /**
   * Creates the storage adapter for the configured container. The file is opened lazily on first access.
   *
   * @return storage owned by the caller
   */
  public DataStoragePort storage() {
    return new N5ContainerStorage(config.storagePath(), config.memoryBudgetBytes(), config.protectedAttributes());
  }

  /**
   * Creates a pipeline owning a fresh storage adapter.
   *
   * @param listener lifecycle listener
   * @return pipeline; close it to release the container lock
   */
  public Pipeline pipeline(PipelineListener listener) {
    return new Pipeline(config, storage(), metrics, clock, listener);
  }

  public ModuleFactory moduleFactory() {
    return new ModuleFactory();
  }

  @Override
  public void close() {
    if (metrics instanceof OpenTelemetryMetricsAdapter otel) {
      otel.forceFlush();
      otel.close();
    }
  }
}
