package ca.gc.nrc.pyxis.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class YamlConfigLoaderTest {

  @TempDir Path tempDir;

  @Test
  void loadMergesCommonAndCommandSections() throws IOException {
    Path yaml = tempDir.resolve("pyxis.yaml");
    Files.writeString(yaml, """
        common:
          chunkFrames: 1000
          metricsExporter: none
        run:
          chunkFrames: 250
        inspect:
          chunkFrames: 1
        """);

    Map<String, String> map = YamlConfigLoader.load(yaml, "run").orElseThrow();

    assertEquals("250", map.get("chunkFrames"));
    assertEquals("none", map.get("metricsExporter"));
  }

  @Test
  void loadFlattensSettingsAndJoinsLists() throws IOException {
    Path yaml = tempDir.resolve("pyxis.yaml");
    Files.writeString(yaml, """
        common:
          protectedAttributes: [INSTRUMENT, TELESCOPE]
          settings:
            PIXSCALE: 0.01
            INSTRUMENT: NACO
        """);

    Map<String, String> map = YamlConfigLoader.load(yaml, "run").orElseThrow();

    assertEquals("INSTRUMENT,TELESCOPE", map.get("protectedAttributes"));
    assertEquals("0.01", map.get("settings.PIXSCALE"));
    assertEquals("NACO", map.get("settings.INSTRUMENT"));
  }

  @Test
  void missingFileReturnsEmptyOptional() throws IOException {
    Optional<Map<String, String>> result = YamlConfigLoader.load(tempDir.resolve("absent.yaml"), "run");

    assertTrue(result.isEmpty());
  }

  @Test
  void emptyFileYieldsEmptyMap() throws IOException {
    Path yaml = tempDir.resolve("empty.yaml");
    Files.writeString(yaml, "");

    assertEquals(Map.of(), YamlConfigLoader.load(yaml, "run").orElseThrow());
  }

  @Test
  void malformedYamlIsRejected() throws IOException {
    Path yaml = tempDir.resolve("broken.yaml");
    Files.writeString(yaml, "common: [unclosed\n");

    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(yaml, "run"));
  }

  @Test
  void nonMappingRootIsRejected() throws IOException {
    Path yaml = tempDir.resolve("list.yaml");
    Files.writeString(yaml, "- a\n- b\n");

    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(yaml, "run"));
  }

  @Test
  void topLevelSettingsApplyToEveryCommandBelowSections() throws IOException {
    Path yaml = tempDir.resolve("pyxis.yaml");
    Files.writeString(yaml, """
        settings:
          PIXSCALE: 0.027
          MEMORY: 1000
        Common:
          settings:
            PIXSCALE: 0.01
        RUN:
          settings:
            MEMORY: 50
        """);

    Map<String, String> run = YamlConfigLoader.load(yaml, "run").orElseThrow();
    Map<String, String> inspect = YamlConfigLoader.load(yaml, "inspect").orElseThrow();

    assertEquals("0.01", run.get("settings.PIXSCALE"));
    assertEquals("50", run.get("settings.MEMORY"));
    assertEquals("1000", inspect.get("settings.MEMORY"));
  }

  @Test
  void settingsMustBeSingleValues() throws IOException {
    Path yaml = tempDir.resolve("pyxis.yaml");
    Files.writeString(yaml, """
        common:
          settings:
            PIXSCALE: [0.01, 0.02]
        """);

    IllegalArgumentException ex =
        assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(yaml, "run"));
    assertTrue(ex.getMessage().contains("setting 'PIXSCALE' must be a single value"));

    Files.writeString(yaml, """
        settings:
          MEMORY:
        """);
    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(yaml, "run"));
  }

  @Test
  void topLevelOptionOutsideSectionIsRejected() throws IOException {
    Path yaml = tempDir.resolve("pyxis.yaml");
    Files.writeString(yaml, "chunkFrames: 10\n");

    IllegalArgumentException ex =
        assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(yaml, "run"));
    assertTrue(ex.getMessage().contains("top-level key 'chunkFrames' must be a section"));
  }

  @Test
  void emptySectionsAreIgnored() throws IOException {
    Path yaml = tempDir.resolve("pyxis.yaml");
    Files.writeString(yaml, """
        common:
          chunkFrames: 5
        run:
        """);

    assertEquals(Map.of("chunkFrames", "5"), YamlConfigLoader.load(yaml, "run").orElseThrow());
  }
}
