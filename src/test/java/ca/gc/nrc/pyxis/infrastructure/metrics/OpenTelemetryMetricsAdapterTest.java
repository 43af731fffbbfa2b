package ca.gc.nrc.pyxis.infrastructure.metrics;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.sdk.metrics.data.HistogramPointData;
import io.opentelemetry.sdk.metrics.data.LongPointData;
import io.opentelemetry.sdk.metrics.data.MetricData;
import io.opentelemetry.sdk.metrics.data.MetricDataType;
import io.opentelemetry.sdk.testing.exporter.InMemoryMetricReader;
import java.util.Collection;
import java.util.Optional;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class OpenTelemetryMetricsAdapterTest {
  private static final AttributeKey<String> KEY_ATTRIBUTE = AttributeKey.stringKey("pyxis.metric.key");

  private InMemoryMetricReader reader;
  private OpenTelemetryMetricsAdapter adapter;

  @BeforeEach
  void setUp() {
    reader = InMemoryMetricReader.create();
    adapter = new OpenTelemetryMetricsAdapter(OpenTelemetryBootstrap.forTesting(reader));
  }

  @AfterEach
  void tearDown() {
    if (adapter != null) {
      adapter.close();
    }
  }

  private Optional<MetricData> find(String name) {
    Collection<MetricData> metrics = reader.collectAllMetrics();
    return metrics.stream().filter(metric -> metric.getName().equals(name)).findFirst();
  }

  @Test
  void incrementRecordsCounterWithAttributes() {
    adapter.increment("pipeline.module.completed");
    adapter.increment("pipeline.module.completed");
    adapter.forceFlush();

    MetricData counter = find("pipeline.module.completed").orElseThrow();
    assertEquals(MetricDataType.LONG_SUM, counter.getType());
    LongPointData point = counter.getLongSumData().getPoints().iterator().next();
    assertEquals(2L, point.getValue());
    assertEquals("pipeline.module.completed", point.getAttributes().get(KEY_ATTRIBUTE));
    assertEquals("pyxis", counter.getResource().getAttribute(AttributeKey.stringKey("service.name")));
    assertEquals("ca.gc.nrc", counter.getResource().getAttribute(AttributeKey.stringKey("service.namespace")));
  }

  @Test
  void observeRecordsMillisecondHistogram() {
    adapter.observe("pipeline.module.durationMillis", 10L);
    adapter.observe("pipeline.module.durationMillis", 30L);
    adapter.forceFlush();

    Optional<MetricData> maybeHistogram = find("pipeline.module.durationmillis");
    assertTrue(maybeHistogram.isPresent(), "Expected histogram metric to be exported");
    MetricData histogram = maybeHistogram.orElseThrow();
    assertEquals(MetricDataType.HISTOGRAM, histogram.getType());
    assertEquals("ms", histogram.getUnit());
    HistogramPointData point = histogram.getHistogramData().getPoints().iterator().next();
    assertEquals(2L, point.getCount());
    assertEquals(40.0, point.getSum());
    assertEquals("pipeline.module.durationMillis", point.getAttributes().get(KEY_ATTRIBUTE));
  }

  @Test
  void sanitizeNameProducesValidInstrumentNames() {
    assertEquals("storage.bytes_written", OpenTelemetryMetricsAdapter.sanitizeName(" Storage.Bytes Written "));
    assertEquals("m9lives", OpenTelemetryMetricsAdapter.sanitizeName("9lives"));
    assertEquals("pyxis.metric", OpenTelemetryMetricsAdapter.sanitizeName("  "));
  }
}
