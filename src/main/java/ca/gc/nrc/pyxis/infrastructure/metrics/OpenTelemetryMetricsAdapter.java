package ca.gc.nrc.pyxis.infrastructure.metrics;

import ca.gc.nrc.pyxis.application.port.MetricsPort;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.LongHistogram;
import io.opentelemetry.api.metrics.Meter;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Metrics adapter that forwards PYXIS counters and histograms to OpenTelemetry.
 *
 * <p>Instruments are created on first use; keys ending in {@code Millis} get the unit {@code ms}.</p>
 */
public final class OpenTelemetryMetricsAdapter implements MetricsPort, AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(OpenTelemetryMetricsAdapter.class);
  private static final AttributeKey<String> METRIC_KEY_ATTRIBUTE = AttributeKey.stringKey("pyxis.metric.key");

  private final OpenTelemetryBootstrap.BootstrapResult bootstrap;
  private final Meter meter;
  private final ConcurrentMap<String, LongCounter> counters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, LongHistogram> histograms = new ConcurrentHashMap<>();

  /**
   * Creates an adapter wired to the exporter configured through system properties or environment.
   */
  public OpenTelemetryMetricsAdapter() {
    this(OpenTelemetryBootstrap.initialize());
  }

  OpenTelemetryMetricsAdapter(OpenTelemetryBootstrap.BootstrapResult bootstrap) {
    this.bootstrap = Objects.requireNonNull(bootstrap, "bootstrap");
    this.meter = bootstrap.meter();
    if (bootstrap.isNoop()) {
      log.debug("OpenTelemetry metrics adapter running in noop mode");
    }
  }

  @Override
  public void increment(String key) {
    String effectiveKey = Objects.requireNonNull(key, "key");
    counters.computeIfAbsent(effectiveKey, this::createCounter)
        .add(1, Attributes.of(METRIC_KEY_ATTRIBUTE, effectiveKey));
  }

  @Override
  public void observe(String key, long value) {
    String effectiveKey = Objects.requireNonNull(key, "key");
    histograms.computeIfAbsent(effectiveKey, this::createHistogram)
        .record(value, Attributes.of(METRIC_KEY_ATTRIBUTE, effectiveKey));
  }

  /**
   * Pushes pending measurements to the exporter.
   */
  public void forceFlush() {
    bootstrap.forceFlush();
  }

  @Override
  public void close() {
    bootstrap.close();
  }

  private LongCounter createCounter(String key) {
    return meter.counterBuilder(sanitizeName(key))
        .setUnit("1")
        .setDescription("PYXIS counter for " + key)
        .build();
  }

  private LongHistogram createHistogram(String key) {
    return meter.histogramBuilder(sanitizeName(key))
        .ofLongs()
        .setUnit(key.endsWith("Millis") ? "ms" : "1")
        .setDescription("PYXIS observation for " + key)
        .build();
  }

  static String sanitizeName(String key) {
    String lower = key.trim().toLowerCase(Locale.ROOT);
    if (lower.isEmpty()) {
      return "pyxis.metric";
    }
    StringBuilder result = new StringBuilder(lower.length() + 1);
    if (!Character.isLetter(lower.charAt(0))) {
      result.append('m');
    }
    for (int i = 0; i < lower.length(); i++) {
      char c = lower.charAt(i);
      result.append(Character.isLetterOrDigit(c) || c == '_' || c == '-' || c == '.' ? c : '_');
    }
    return result.toString();
  }
}
