package ca.gc.nrc.pyxis.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class ConfigMergerTest {

  @Test
  void cliOverridesYamlAndEmitsWarning() {
    Map<String, String> defaults = Map.of("chunkFrames", "1000", "metricsExporter", "none");
    Map<String, String> yaml = Map.of("chunkFrames", "200", "settings.PIXSCALE", "0.01");
    Map<String, String> cli = Map.of("chunkFrames", "50", "workDir", "/data/run1");
    List<String> warnings = new ArrayList<>();

    Map<String, String> merged = ConfigMerger.buildEffectiveConfig(
        "run",
        Optional.of(yaml),
        cli,
        defaults,
        warnings::add);

    assertEquals("50", merged.get("chunkFrames"));
    assertEquals("0.01", merged.get("settings.PIXSCALE"));
    assertEquals("/data/run1", merged.get("workDir"));
    assertEquals("none", merged.get("metricsExporter"));
    assertEquals(List.of("CLI overrides YAML for key: chunkFrames"), warnings);
  }

  @Test
  void yamlOverridesDefaultsSilently() {
    List<String> warnings = new ArrayList<>();

    Map<String, String> merged = ConfigMerger.buildEffectiveConfig(
        "run",
        Optional.of(Map.of("memoryBudgetMiB", "64")),
        Map.of(),
        Map.of("memoryBudgetMiB", "512"),
        warnings::add);

    assertEquals("64", merged.get("memoryBudgetMiB"));
    assertTrue(warnings.isEmpty());
  }

  @Test
  void rejectsUnknownExporter() {
    assertThrows(
        IllegalArgumentException.class,
        () -> ConfigMerger.buildEffectiveConfig(
            "run",
            Optional.empty(),
            Map.of("metricsExporter", "prometheus"),
            Map.of(),
            msg -> {}));
  }

  @Test
  void rejectsNegativeChunkFrames() {
    assertThrows(
        IllegalArgumentException.class,
        () -> ConfigMerger.buildEffectiveConfig(
            "run",
            Optional.of(Map.of("chunkFrames", "-5")),
            Map.of(),
            Map.of(),
            msg -> {}));
  }
}
