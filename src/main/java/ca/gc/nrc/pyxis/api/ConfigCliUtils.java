package ca.gc.nrc.pyxis.api;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.Map;

/**
 * Helpers shared by the commands for mixing CLI arguments with {@code pyxis.yaml}.
 */
final class ConfigCliUtils {

  private ConfigCliUtils() {}

  /**
   * Removes and returns the {@code config} argument.
   *
   * @param args mutable CLI map
   * @return configured path, or {@code null}
   */
  static String extractConfigPath(Map<String, String> args) {
    if (args == null || args.isEmpty()) {
      return null;
    }
    String value = args.remove("config");
    return value == null || value.isBlank() ? null : value.trim();
  }

  /**
   * Parses a path argument.
   *
   * @param key argument name for diagnostics
   * @param raw argument value
   * @return path
   * @throws IllegalArgumentException when missing or not a valid path
   */
  static Path requirePath(String key, String raw) {
    if (raw == null || raw.isBlank()) {
      throw new IllegalArgumentException(key + " is required");
    }
    try {
      return Path.of(raw.trim());
    } catch (InvalidPathException ex) {
      throw new IllegalArgumentException(key + " is not a valid path: " + raw, ex);
    }
  }

  static boolean parseBoolean(Map<String, String> map, String key) {
    if (map == null) {
      return false;
    }
    String value = map.get(key);
    return value != null && Boolean.parseBoolean(value.trim());
  }
}
