package ca.gc.nrc.pyxis.infrastructure.metrics;

import ca.gc.nrc.pyxis.application.port.MetricsPort;

/**
 * Metrics adapter that discards all observations; used when {@code metricsExporter=none}.
 */
public final class NoOpMetricsAdapter implements MetricsPort {

  @Override
  public void increment(String key) {}

  @Override
  public void observe(String key, long value) {}
}
