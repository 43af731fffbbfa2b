package ca.gc.nrc.pyxis.api;

import ca.gc.nrc.pyxis.validation.Strings;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Turns {@code key=value} CLI arguments into a lookup map. Values may contain further {@code '='}
 * (e.g. {@code otelResourceAttributes=env=prod}).
 * <p>Stateless and thread-safe.</p>
 */
public final class CliArgsParser {
  private static final Pattern KEY_PATTERN = Pattern.compile("^[A-Za-z0-9._-]+$");

  private CliArgsParser() {}

  /**
   * Splits every argument on its first {@code '='}.
   *
   * @param args raw arguments; {@code null} returns an empty map
   * @return mutable map in argument order
   * @throws IllegalArgumentException when an argument is not {@code key=value}, a key is malformed or repeated,
   *     or a value contains control characters
   */
  public static Map<String, String> toMap(String[] args) {
    Map<String, String> map = new LinkedHashMap<>();
    if (args == null) {
      return map;
    }
    for (String raw : args) {
      if (raw == null || raw.isBlank()) {
        continue;
      }
      String arg = raw.trim();
      int idx = arg.indexOf('=');
      if (idx <= 0) {
        throw new IllegalArgumentException("argument must be key=value (was '" + raw + "')");
      }
      String key = arg.substring(0, idx).trim();
      String value = arg.substring(idx + 1).trim();
      if (!KEY_PATTERN.matcher(key).matches()) {
        throw new IllegalArgumentException("invalid argument name: " + key);
      }
      if (containsControl(value)) {
        throw new IllegalArgumentException("argument " + key + " must not contain control characters");
      }
      if (value.isEmpty()) {
        throw new IllegalArgumentException("argument " + key + " must have a value");
      }
      if (map.containsKey(key)) {
        throw new IllegalArgumentException("argument " + key + " given more than once");
      }
      map.put(key, Strings.requireNonBlank(key, value));
    }
    return map;
  }

  private static boolean containsControl(CharSequence value) {
    for (int i = 0; i < value.length(); i++) {
      if (Character.isISOControl(value.charAt(i))) {
        return true;
      }
    }
    return false;
  }
}
