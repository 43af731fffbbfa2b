package ca.gc.nrc.pyxis.config;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Supplies flattened default configuration maps for each PYXIS CLI command.
 *
 * <p>The defaults remain the single source of truth for optional YAML keys and for the generated
 * {@code pyxis.yaml}.</p>
 */
public final class ConfigDefaults {
  static final int DEFAULT_CHUNK_FRAMES = 1000;
  static final long DEFAULT_MEMORY_BUDGET_MIB = 512;
  static final String DEFAULT_PROTECTED_ATTRIBUTE = "INSTRUMENT";
  static final String DEFAULT_PIXSCALE = "0.027";

  private static final Map<String, String> COMMON_DEFAULTS = buildCommonDefaults();

  private ConfigDefaults() {}

  /**
   * Returns a flattened map of defaults for the requested command merged with common defaults.
   *
   * @param command CLI command ({@code run} or {@code inspect})
   * @return unmodifiable map of default key/value pairs as strings
   */
  public static Map<String, String> asFlatMap(String command) {
    Objects.requireNonNull(command, "command");
    String normalized = command.trim().toLowerCase(Locale.ROOT);
    Map<String, String> defaults = new LinkedHashMap<>(COMMON_DEFAULTS);
    defaults.putAll(switch (normalized) {
      case "run" -> buildRunDefaults();
      case "inspect" -> Map.of();
      default -> throw new IllegalArgumentException("Unsupported command: " + command);
    });
    return Map.copyOf(defaults);
  }

  /**
   * Defaults written into a freshly created {@code pyxis.yaml} under its {@code common} section.
   *
   * @return ordered map of key to value; {@code settings} nests one level
   */
  public static Map<String, Object> fileTemplate() {
    Map<String, Object> common = new LinkedHashMap<>();
    common.put("storageFile", PipelineConfig.DEFAULT_STORAGE_FILE);
    common.put("chunkFrames", DEFAULT_CHUNK_FRAMES);
    common.put("memoryBudgetMiB", DEFAULT_MEMORY_BUDGET_MIB);
    common.put("cpu", defaultCpu());
    common.put("protectedAttributes", DEFAULT_PROTECTED_ATTRIBUTE);
    Map<String, Object> settings = new LinkedHashMap<>();
    settings.put("PIXSCALE", Double.parseDouble(DEFAULT_PIXSCALE));
    common.put("settings", settings);
    common.put("metricsExporter", "none");
    Map<String, Object> root = new LinkedHashMap<>();
    root.put("common", common);
    return root;
  }

  static int defaultCpu() {
    return Math.max(1, Runtime.getRuntime().availableProcessors());
  }

  private static Map<String, String> buildCommonDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("storageFile", PipelineConfig.DEFAULT_STORAGE_FILE);
    map.put("chunkFrames", Integer.toString(DEFAULT_CHUNK_FRAMES));
    map.put("memoryBudgetMiB", Long.toString(DEFAULT_MEMORY_BUDGET_MIB));
    map.put("cpu", Integer.toString(defaultCpu()));
    map.put("protectedAttributes", DEFAULT_PROTECTED_ATTRIBUTE);
    map.put("settings.PIXSCALE", DEFAULT_PIXSCALE);
    map.put("metricsExporter", "none");
    map.put("otelEndpoint", "");
    map.put("otelResourceAttributes", "");
    map.put("verbose", "false");
    return Map.copyOf(map);
  }

  private static Map<String, String> buildRunDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("dryRun", "false");
    return map;
  }
}
