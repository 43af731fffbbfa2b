package ca.gc.nrc.pyxis.application.port;

/**
 * <strong>What:</strong> Port abstracting PYXIS metrics emission.
 * <p><strong>Why:</strong> Lets the pipeline record module outcomes and durations without binding to a vendor SDK.</p>
 * <p><strong>Role:</strong> Port implemented by adapters such as {@code OpenTelemetryMetricsAdapter}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Expose counter increments for events like module completion or failure.</li>
 *   <li>Record numeric observations for durations and byte counts.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Implementations must tolerate calls from any thread even though the pipeline
 * itself runs on one.</p>
 * <p><strong>Observability:</strong> Defines the metric name contract (e.g., {@code pipeline.module.durationMillis}).</p>
 *
 * @implNote Consumers must not pass {@code null} metric keys; adapters may normalize names.
 * @since 0.1.0
 */
public interface MetricsPort {
  /**
   * Increments the named counter by one.
   *
   * @param key metric identifier using dotted naming (e.g., {@code pipeline.module.completed}); must not be {@code null}
   */
  void increment(String key);

  /**
   * Records an observation for a histogram style metric.
   *
   * @param key metric identifier using dotted naming; must not be {@code null}
   * @param value observed value (e.g., milliseconds, bytes); semantics defined by the caller
   */
  void observe(String key, long value);

  /**
   * Metrics implementation that ignores all updates.
   */
  MetricsPort NO_OP = new MetricsPort() {
    @Override public void increment(String key) {}

    @Override public void observe(String key, long value) {}
  };
}
