package ca.gc.nrc.pyxis.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class TelemetryConfiguratorTest {
  private static final String[] PROPERTIES = {
      "otel.metrics.exporter", "otel.exporter.otlp.endpoint", "otel.resource.attributes"};

  private final Map<String, String> previous = new HashMap<>();

  @BeforeEach
  void saveProperties() {
    for (String key : PROPERTIES) {
      previous.put(key, System.getProperty(key));
    }
  }

  @AfterEach
  void restoreProperties() {
    for (String key : PROPERTIES) {
      String value = previous.get(key);
      if (value == null) {
        System.clearProperty(key);
      } else {
        System.setProperty(key, value);
      }
    }
  }

  @Test
  void otlpExporterSetsPropertiesAndConsumesKeys() {
    Map<String, String> config = new HashMap<>(Map.of(
        "metricsExporter", "OTLP",
        "otelEndpoint", "http://collector:4317",
        "otelResourceAttributes", "site=lab",
        "chunkFrames", "10"));

    assertTrue(TelemetryConfigurator.configureMetrics(config));

    assertEquals("otlp", System.getProperty("otel.metrics.exporter"));
    assertEquals("http://collector:4317", System.getProperty("otel.exporter.otlp.endpoint"));
    assertEquals("site=lab", System.getProperty("otel.resource.attributes"));
    assertEquals(Map.of("chunkFrames", "10"), config);
  }

  @Test
  void blankExporterMeansNone() {
    Map<String, String> config = new HashMap<>(Map.of("metricsExporter", " ", "chunkFrames", "10"));

    assertFalse(TelemetryConfigurator.configureMetrics(config));
    assertEquals("none", System.getProperty("otel.metrics.exporter"));
  }

  @Test
  void rejectsInvalidValues() {
    assertThrows(IllegalArgumentException.class,
        () -> TelemetryConfigurator.configureMetrics(new HashMap<>(Map.of("metricsExporter", "prometheus"))));
    assertThrows(IllegalArgumentException.class, () -> TelemetryConfigurator.configureMetrics(
        new HashMap<>(Map.of("metricsExporter", "otlp", "otelEndpoint", "ftp://collector"))));
    assertThrows(IllegalArgumentException.class, () -> TelemetryConfigurator.configureMetrics(
        new HashMap<>(Map.of("metricsExporter", "otlp", "otelResourceAttributes", "site=été"))));
  }
}
