package ca.gc.nrc.pyxis.config;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Reads {@code pyxis.yaml} into the flat option map {@link PipelineConfig#fromMap(Map)} understands.
 *
 * <pre>
 * settings:
 *   PIXSCALE: 0.027
 *   MEMORY: 1000
 * common:
 *   chunkFrames: 100
 *   protectedAttributes: [INSTRUMENT, TELESCOPE]
 * run:
 *   dryRun: false
 * </pre>
 *
 * <p>Sections apply lowest first: the top-level {@code settings} section, then {@code common}, then the section
 * named after the command. Section names match case-insensitively. Settings become {@code settings.<KEY>}
 * options and must be scalars, since each one is stored as a single static attribute.</p>
 */
public final class YamlConfigLoader {
  /** Options shared by every command. */
  static final String COMMON_SECTION = "common";
  /** Pipeline-wide settings, at the top level or inside a command section. */
  static final String SETTINGS_SECTION = "settings";

  private YamlConfigLoader() {}

  /**
   * Loads {@code path} and merges its sections for {@code command}.
   *
   * @param path location of the YAML configuration
   * @param command CLI command whose section overrides {@code common}
   * @return flat options; empty when the file does not exist
   * @throws IOException when the file cannot be read
   * @throws IllegalArgumentException when the YAML is malformed or a section or setting has the wrong shape
   */
  public static Optional<Map<String, String>> load(Path path, String command) throws IOException {
    Objects.requireNonNull(path, "path");
    Objects.requireNonNull(command, "command");
    if (!Files.exists(path)) {
      return Optional.empty();
    }
    Object document;
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      document = new Yaml(new SafeConstructor(new LoaderOptions())).load(reader);
    } catch (YAMLException ex) {
      throw new IllegalArgumentException("Failed to parse configuration " + path, ex);
    }
    if (document == null) {
      return Optional.of(Map.of());
    }
    if (!(document instanceof Map<?, ?> root)) {
      throw new IllegalArgumentException("Configuration " + path + " must be a mapping of sections");
    }
    Map<String, Object> sections = sections(root, path);

    Map<String, String> options = new LinkedHashMap<>();
    Map<?, ?> topSettings = section(sections.get(SETTINGS_SECTION));
    requireScalarSettings(topSettings, path + " section '" + SETTINGS_SECTION + "'");
    YamlFlattener.flatten(topSettings, SETTINGS_SECTION, options, path + " section '" + SETTINGS_SECTION + "'");
    for (String name : List.of(COMMON_SECTION, command.trim().toLowerCase(Locale.ROOT))) {
      String context = path + " section '" + name + "'";
      Map<?, ?> body = section(sections.get(name));
      Object nested = body.get(SETTINGS_SECTION);
      if (nested != null) {
        if (!(nested instanceof Map<?, ?> nestedSettings)) {
          throw new IllegalArgumentException(context + ": '" + SETTINGS_SECTION + "' must be a mapping");
        }
        requireScalarSettings(nestedSettings, context);
      }
      YamlFlattener.flatten(body, "", options, context);
    }
    return Optional.of(Map.copyOf(options));
  }

  private static Map<String, Object> sections(Map<?, ?> root, Path path) {
    Map<String, Object> sections = new LinkedHashMap<>();
    for (Map.Entry<?, ?> entry : root.entrySet()) {
      String name = String.valueOf(entry.getKey()).trim().toLowerCase(Locale.ROOT);
      Object body = entry.getValue();
      if (body != null && !(body instanceof Map<?, ?>)) {
        throw new IllegalArgumentException("Configuration " + path + ": top-level key '" + entry.getKey()
            + "' must be a section; put options under '" + COMMON_SECTION + "' or a command section");
      }
      if (sections.containsKey(name)) {
        throw new IllegalArgumentException("Configuration " + path + " declares section '" + name + "' twice");
      }
      sections.put(name, body);
    }
    return sections;
  }

  private static Map<?, ?> section(Object body) {
    return body instanceof Map<?, ?> map ? map : Map.of();
  }

  private static void requireScalarSettings(Map<?, ?> settings, String context) {
    for (Map.Entry<?, ?> entry : settings.entrySet()) {
      Object value = entry.getValue();
      if (value == null || value instanceof Map<?, ?> || value instanceof Iterable<?>) {
        throw new IllegalArgumentException(context + ": setting '" + entry.getKey() + "' must be a single value");
      }
    }
  }
}
