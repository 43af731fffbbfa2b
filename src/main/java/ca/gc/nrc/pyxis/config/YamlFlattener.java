package ca.gc.nrc.pyxis.config;

import java.util.Map;

/**
 * Turns parsed YAML trees into flat string maps for the configuration file and for recipe parameters.
 *
 * <p>Nested mappings flatten with dots, so {@code settings: {PIXSCALE: 0.01}} becomes
 * {@code settings.PIXSCALE=0.01}. Lists of scalars join with commas ({@code indices: [0, 2, 4]} becomes
 * {@code indices=0,2,4}) and {@code null} becomes the empty string.</p>
 */
public final class YamlFlattener {

  private YamlFlattener() {}

  /**
   * Flattens every entry of {@code source} into {@code target}.
   *
   * @param source parsed YAML mapping
   * @param prefix dotted key prefix, empty for none
   * @param target receives flattened keys; later entries overwrite earlier ones
   * @param context where the mapping came from, used in messages
   * @throws IllegalArgumentException on blank keys or lists holding mappings or lists
   */
  public static void flatten(Map<?, ?> source, String prefix, Map<String, String> target, String context) {
    for (Map.Entry<?, ?> entry : source.entrySet()) {
      String key = entry.getKey() == null ? "" : entry.getKey().toString();
      if (key.isBlank()) {
        throw new IllegalArgumentException(context + ": blank keys are not allowed");
      }
      put(target, prefix.isEmpty() ? key : prefix + '.' + key, entry.getValue(), context);
    }
  }

  /**
   * Flattens one value under {@code key}.
   *
   * @param target receives flattened keys
   * @param key full dotted key
   * @param value scalar, list of scalars, mapping or {@code null}
   * @param context where the value came from, used in messages
   * @throws IllegalArgumentException on lists holding mappings or lists
   */
  public static void put(Map<String, String> target, String key, Object value, String context) {
    if (value == null) {
      target.put(key, "");
    } else if (value instanceof Map<?, ?> nested) {
      flatten(nested, key, target, context);
    } else if (value instanceof Iterable<?> items) {
      StringBuilder joined = new StringBuilder();
      for (Object item : items) {
        if (item instanceof Map<?, ?> || item instanceof Iterable<?>) {
          throw new IllegalArgumentException(context + ": nested lists are not supported for " + key);
        }
        if (joined.length() > 0) {
          joined.append(',');
        }
        joined.append(item);
      }
      target.put(key, joined.toString());
    } else {
      target.put(key, value.toString());
    }
  }
}
