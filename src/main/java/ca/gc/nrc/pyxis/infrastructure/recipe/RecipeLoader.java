package ca.gc.nrc.pyxis.infrastructure.recipe;

import ca.gc.nrc.pyxis.config.YamlFlattener;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Reads a recipe YAML file into an ordered list of {@link ModuleSpec}s.
 *
 * <pre>
 * modules:
 *   - type: synthetic
 *     name: gen
 *     output: raw
 *     frames: 100
 *     frameShape: 64x64
 *   - type: select
 *     name: sel
 *     params:
 *       input: raw
 *       output: selected
 *       indices: [0, 2, 4]
 * </pre>
 *
 * <p>Parameters may sit beside {@code type} and {@code name} or inside a nested {@code params} mapping. Nested
 * mappings flatten with dots and lists join with commas.</p>
 */
public final class RecipeLoader {

  private RecipeLoader() {}

  /**
   * Loads a recipe file.
   *
   * @param path recipe location
   * @return module entries in file order
   * @throws IOException when the file cannot be read
   * @throws IllegalArgumentException when the YAML is malformed or an entry lacks {@code type} or {@code name}
   */
  public static List<ModuleSpec> load(Path path) throws IOException {
    Objects.requireNonNull(path, "path");
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      return parse(new Yaml(new SafeConstructor(new LoaderOptions())).load(reader), path.toString());
    } catch (YAMLException ex) {
      throw new IllegalArgumentException("Failed to parse recipe " + path, ex);
    }
  }

  static List<ModuleSpec> parse(Object document, String source) {
    if (!(document instanceof Map<?, ?> root)) {
      throw new IllegalArgumentException("Recipe " + source + " must be a mapping with a 'modules' list");
    }
    Object modules = root.get("modules");
    if (!(modules instanceof List<?> entries) || entries.isEmpty()) {
      throw new IllegalArgumentException("Recipe " + source + " must contain a non-empty 'modules' list");
    }
    List<ModuleSpec> specs = new ArrayList<>(entries.size());
    int position = 0;
    for (Object entry : entries) {
      position++;
      if (!(entry instanceof Map<?, ?> map)) {
        throw new IllegalArgumentException("Recipe entry #" + position + " must be a mapping");
      }
      String type = requireText(map.get("type"), "type", position);
      String name = requireText(map.get("name"), "name", position);
      Map<String, String> params = new LinkedHashMap<>();
      for (Map.Entry<?, ?> field : map.entrySet()) {
        String key = String.valueOf(field.getKey());
        if (key.equals("type") || key.equals("name")) {
          continue;
        }
        String context = "Recipe entry #" + position;
        if (key.equals("params") && field.getValue() instanceof Map<?, ?> nested) {
          YamlFlattener.flatten(nested, "", params, context);
        } else {
          YamlFlattener.put(params, key, field.getValue(), context);
        }
      }
      specs.add(new ModuleSpec(type, name, params));
    }
    return specs;
  }

  private static String requireText(Object value, String field, int position) {
    if (value == null || value.toString().isBlank()) {
      throw new IllegalArgumentException("Recipe entry #" + position + " is missing '" + field + "'");
    }
    return value.toString().trim();
  }
}
