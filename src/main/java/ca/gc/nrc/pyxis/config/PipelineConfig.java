package ca.gc.nrc.pyxis.config;

import ca.gc.nrc.pyxis.domain.attribute.AttributeValue;
import ca.gc.nrc.pyxis.validation.Numbers;
import ca.gc.nrc.pyxis.validation.Strings;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * <strong>What:</strong> Immutable global settings of a pipeline run.
 * <p><strong>Why:</strong> Chunk sizing, the container location and pipeline-wide attribute defaults must be fixed
 * before the first module runs so every module sees the same values.</p>
 * <p><strong>Role:</strong> Configuration aggregate read once by the pipeline and shared by reference with modules.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Locate the working, input and output directories and the storage container.</li>
 *   <li>Bound memory use through frames per chunk and a memory budget.</li>
 *   <li>Carry pipeline-wide settings used as static attribute fallbacks.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Immutable record; safe for concurrent reads.</p>
 *
 * @param workDir working directory holding the storage container and {@code pyxis.yaml}
 * @param inputDir directory reading modules resolve relative file names against
 * @param outputDir directory writing modules export into
 * @param storageFile container directory name inside {@code workDir}
 * @param chunkFrames frames per chunk; {@code 0} processes all frames at once
 * @param memoryBudgetMiB memory budget in mebibytes bounding chunks and full reads
 * @param cpu worker count hint recorded in the settings snapshot
 * @param protectedAttributes static attribute keys that may not be overwritten with a different value
 * @param settings pipeline-wide settings keyed by name, values as configured text
 * @since 0.1.0
 * @see ConfigDefaults
 */
public record PipelineConfig(
    Path workDir,
    Path inputDir,
    Path outputDir,
    String storageFile,
    int chunkFrames,
    long memoryBudgetMiB,
    int cpu,
    Set<String> protectedAttributes,
    Map<String, String> settings) {

  /** Name of the YAML configuration file looked up in the working directory. */
  public static final String CONFIG_FILE_NAME = "pyxis.yaml";
  /** Default container directory name. */
  public static final String DEFAULT_STORAGE_FILE = "pyxis_database.n5";
  /** Prefix of flattened setting keys. */
  public static final String SETTINGS_PREFIX = "settings.";

  /**
   * Normalizes paths and enforces ranges.
   *
   * @throws IllegalArgumentException when a value is out of range or a path is invalid
   */
  public PipelineConfig {
    workDir = Objects.requireNonNull(workDir, "workDir").toAbsolutePath().normalize();
    inputDir = inputDir == null ? workDir : inputDir.toAbsolutePath().normalize();
    outputDir = outputDir == null ? workDir : outputDir.toAbsolutePath().normalize();
    storageFile = Strings.requireFileName("storageFile", storageFile == null ? DEFAULT_STORAGE_FILE : storageFile);
    Numbers.requireRange("chunkFrames", chunkFrames, 0, Integer.MAX_VALUE);
    Numbers.requireRange("memoryBudgetMiB", memoryBudgetMiB, 1, 1L << 30);
    Numbers.requireRange("cpu", cpu, 1, 4096);
    protectedAttributes = Collections.unmodifiableSet(new LinkedHashSet<>(
        protectedAttributes == null ? Set.of() : protectedAttributes));
    settings = Collections.unmodifiableMap(new LinkedHashMap<>(settings == null ? Map.of() : settings));
  }

  /**
   * Baseline configuration rooted at {@code workDir}.
   *
   * @param workDir working directory
   * @return default configuration
   */
  public static PipelineConfig defaults(Path workDir) {
    return new PipelineConfig(
        workDir,
        workDir,
        workDir,
        DEFAULT_STORAGE_FILE,
        ConfigDefaults.DEFAULT_CHUNK_FRAMES,
        ConfigDefaults.DEFAULT_MEMORY_BUDGET_MIB,
        ConfigDefaults.defaultCpu(),
        Set.of(ConfigDefaults.DEFAULT_PROTECTED_ATTRIBUTE),
        Map.of("PIXSCALE", ConfigDefaults.DEFAULT_PIXSCALE));
  }

  /**
   * Creates a configuration from a flat key/value map such as the output of {@link ConfigMerger}.
   *
   * @param options keys {@code workDir}, {@code inputDir}, {@code outputDir}, {@code storageFile},
   *     {@code chunkFrames}, {@code memoryBudgetMiB}, {@code cpu}, {@code protectedAttributes} and
   *     {@code settings.<KEY>}; unknown keys are ignored
   * @return populated configuration
   * @throws IllegalArgumentException when values are invalid or {@code workDir} is missing
   */
  public static PipelineConfig fromMap(Map<String, String> options) {
    Objects.requireNonNull(options, "options");
    Path workDir = parsePath("workDir", required(options, "workDir"));
    Path inputDir = optionalPath(options, "inputDir", workDir);
    Path outputDir = optionalPath(options, "outputDir", workDir);
    String storageFile = blankToDefault(options.get("storageFile"), DEFAULT_STORAGE_FILE);
    int chunkFrames = (int) Numbers.parseLong("chunkFrames",
        blankToDefault(options.get("chunkFrames"), Integer.toString(ConfigDefaults.DEFAULT_CHUNK_FRAMES)),
        0, Integer.MAX_VALUE);
    long memoryBudgetMiB = Numbers.parseLong("memoryBudgetMiB",
        blankToDefault(options.get("memoryBudgetMiB"), Long.toString(ConfigDefaults.DEFAULT_MEMORY_BUDGET_MIB)),
        1, 1L << 30);
    int cpu = (int) Numbers.parseLong("cpu",
        blankToDefault(options.get("cpu"), Integer.toString(ConfigDefaults.defaultCpu())), 1, 4096);
    Set<String> protectedAttributes = parseList(
        options.getOrDefault("protectedAttributes", ConfigDefaults.DEFAULT_PROTECTED_ATTRIBUTE));

    Map<String, String> settings = new LinkedHashMap<>();
    for (Map.Entry<String, String> entry : options.entrySet()) {
      String key = entry.getKey();
      if (key != null && key.startsWith(SETTINGS_PREFIX) && key.length() > SETTINGS_PREFIX.length()) {
        settings.put(key.substring(SETTINGS_PREFIX.length()), entry.getValue() == null ? "" : entry.getValue());
      }
    }
    return new PipelineConfig(workDir, inputDir, outputDir, storageFile, chunkFrames, memoryBudgetMiB, cpu,
        protectedAttributes, settings);
  }

  /**
   * Location of the storage container.
   *
   * @return {@code workDir/storageFile}
   */
  public Path storagePath() {
    return workDir.resolve(storageFile);
  }

  public long memoryBudgetBytes() {
    return memoryBudgetMiB * 1024L * 1024L;
  }

  /**
   * Settings snapshot persisted into the container: configured settings plus the chunk size as {@code MEMORY}
   * and the worker hint as {@code CPU}.
   *
   * @return typed settings
   */
  public Map<String, AttributeValue> settingsSnapshot() {
    Map<String, AttributeValue> snapshot = new LinkedHashMap<>();
    for (Map.Entry<String, String> entry : settings.entrySet()) {
      snapshot.put(entry.getKey(), AttributeValue.parse(entry.getValue()));
    }
    snapshot.put("MEMORY", AttributeValue.integer(chunkFrames));
    snapshot.put("CPU", AttributeValue.integer(cpu));
    return snapshot;
  }

  /**
   * Frames a module should process at once for frames of the given in-memory size.
   *
   * @param frameBytes bytes one frame occupies in memory
   * @return frames per chunk, at least one; {@code 0} when all frames should be processed at once
   */
  public int framesPerChunk(long frameBytes) {
    if (chunkFrames == 0) {
      return 0;
    }
    long byBudget = frameBytes <= 0 ? Long.MAX_VALUE : memoryBudgetBytes() / frameBytes;
    return (int) Math.max(1L, Math.min(chunkFrames, byBudget));
  }

  /**
   * Copy with a different chunk size.
   *
   * @param frames frames per chunk
   * @return updated configuration
   */
  public PipelineConfig withChunkFrames(int frames) {
    return new PipelineConfig(workDir, inputDir, outputDir, storageFile, frames, memoryBudgetMiB, cpu,
        protectedAttributes, settings);
  }

  private static String required(Map<String, String> options, String key) {
    String value = options.get(key);
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException(key + " is required");
    }
    return value;
  }

  private static Path optionalPath(Map<String, String> options, String key, Path fallback) {
    String raw = options.get(key);
    if (raw == null || raw.isBlank()) {
      return fallback;
    }
    Path path = parsePath(key, raw);
    return path.isAbsolute() ? path : fallback.resolve(path);
  }

  private static Path parsePath(String key, String raw) {
    try {
      return Path.of(Strings.requireNonBlank(key, raw));
    } catch (InvalidPathException ex) {
      throw new IllegalArgumentException(key + " is not a valid path: " + raw, ex);
    }
  }

  private static String blankToDefault(String value, String fallback) {
    return value == null || value.isBlank() ? fallback : value.trim();
  }

  private static Set<String> parseList(String raw) {
    Set<String> values = new LinkedHashSet<>();
    if (raw == null) {
      return values;
    }
    for (String part : raw.split(",")) {
      String trimmed = part.trim();
      if (!trimmed.isEmpty()) {
        values.add(trimmed);
      }
    }
    return values;
  }
}
