package ca.gc.nrc.pyxis.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class YamlFlattenerTest {

  @Test
  void flattensMappingsListsAndNulls() {
    Map<String, Object> source = new LinkedHashMap<>();
    source.put("settings", Map.of("PIXSCALE", 0.027));
    source.put("indices", List.of(0, 2, 4));
    source.put("name", null);
    Map<String, String> target = new LinkedHashMap<>();

    YamlFlattener.flatten(source, "", target, "test");

    assertEquals(Map.of("settings.PIXSCALE", "0.027", "indices", "0,2,4", "name", ""), target);
  }

  @Test
  void rejectsNestedListsAndBlankKeys() {
    Map<String, String> target = new LinkedHashMap<>();

    IllegalArgumentException nested = assertThrows(IllegalArgumentException.class,
        () -> YamlFlattener.put(target, "pairs", List.of(List.of(1, 2)), "Recipe entry #1"));
    assertTrue(nested.getMessage().startsWith("Recipe entry #1: nested lists"));

    Map<String, Object> blank = new LinkedHashMap<>();
    blank.put(" ", 1);
    assertThrows(IllegalArgumentException.class, () -> YamlFlattener.flatten(blank, "", target, "test"));
  }
}
