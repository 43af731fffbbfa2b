package ca.gc.nrc.pyxis.infrastructure.recipe;

import ca.gc.nrc.pyxis.application.module.PipelineModule;
import ca.gc.nrc.pyxis.domain.attribute.AttributeValue;
import ca.gc.nrc.pyxis.domain.dataset.DataType;
import ca.gc.nrc.pyxis.domain.dataset.Shape;
import ca.gc.nrc.pyxis.domain.error.ModuleParameterException;
import ca.gc.nrc.pyxis.infrastructure.modules.BackgroundSubtractionModule;
import ca.gc.nrc.pyxis.infrastructure.modules.FrameSelectionModule;
import ca.gc.nrc.pyxis.infrastructure.modules.RawStackReadingModule;
import ca.gc.nrc.pyxis.infrastructure.modules.RawStackWritingModule;
import ca.gc.nrc.pyxis.infrastructure.modules.ScaleFramesModule;
import ca.gc.nrc.pyxis.infrastructure.modules.SyntheticFramesReadingModule;
import ca.gc.nrc.pyxis.validation.Numbers;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.Function;

/**
 * <strong>What:</strong> Turns recipe entries into configured reference modules.
 * <p><strong>Why:</strong> Recipes name modules by type with flat text parameters; each parameter is validated
 * here so a bad recipe fails before the pipeline opens storage.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Map type keys ({@code synthetic}, {@code rawReader}, {@code rawWriter}, {@code select}, {@code scale},
 *       {@code backgroundSubtract}) to module constructors.</li>
 *   <li>Reject unknown types, unknown parameters and malformed values with {@link ModuleParameterException}.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless after construction.</p>
 *
 * @since 0.1.0
 */
public final class ModuleFactory {
  private static final String STATIC_PREFIX = "static.";

  private final Map<String, Function<Params, PipelineModule>> factories = new LinkedHashMap<>();
  private final Map<String, Set<String>> allowedKeys = new LinkedHashMap<>();

  public ModuleFactory() {
    register("synthetic", Set.of("output", "frames", "frameShape", "value", "step", "dataType", "indexAttribute"),
        p -> new SyntheticFramesReadingModule(
            p.name,
            p.tag("output"),
            p.longValue("frames", 1, Integer.MAX_VALUE),
            p.frameShape("frameShape"),
            p.doubleValue("value", 0.0),
            p.doubleValue("step", 0.0),
            p.dataType("dataType"),
            p.staticAttributes(),
            p.optional("indexAttribute")));
    register("rawReader", Set.of("output", "file", "dataType"),
        p -> new RawStackReadingModule(p.name, p.tag("output"), p.required("file"), p.dataType("dataType")));
    register("rawWriter", Set.of("input", "file"),
        p -> new RawStackWritingModule(p.name, p.tag("input"), p.required("file")));
    register("select", Set.of("input", "output", "indices"),
        p -> new FrameSelectionModule(p.name, p.tag("input"), p.tag("output"), p.indices("indices")));
    register("scale", Set.of("input", "output", "factor", "offset"),
        p -> new ScaleFramesModule(p.name, p.tag("input"), p.tagOrDefault("output", p.tag("input")),
            p.doubleValue("factor", 1.0), p.doubleValue("offset", 0.0)));
    register("backgroundSubtract", Set.of("input", "background", "output"),
        p -> new BackgroundSubtractionModule(p.name, p.tag("input"), p.optional("background"),
            p.tagOrDefault("output", p.tag("input"))));
  }

  /**
   * Known module types.
   *
   * @return type keys in registration order
   */
  public Set<String> types() {
    return factories.keySet();
  }

  /**
   * Creates the module described by a recipe entry.
   *
   * @param spec recipe entry
   * @return configured module
   * @throws ModuleParameterException when the type is unknown or a parameter is missing or invalid
   */
  public PipelineModule create(ModuleSpec spec) {
    Objects.requireNonNull(spec, "spec");
    String type = resolveType(spec.type());
    Set<String> allowed = allowedKeys.get(type);
    Set<String> unknown = new TreeSet<>();
    for (String key : spec.params().keySet()) {
      boolean staticKey = type.equals("synthetic") && key.startsWith(STATIC_PREFIX);
      if (!allowed.contains(key) && !staticKey) {
        unknown.add(key);
      }
    }
    if (!unknown.isEmpty()) {
      throw new ModuleParameterException("Module '" + spec.name() + "' (" + type + "): unknown parameters "
          + unknown);
    }
    return factories.get(type).apply(new Params(spec.name(), type, spec.params()));
  }

  /**
   * Creates every module of a recipe.
   *
   * @param specs recipe entries in order
   * @return modules in the same order
   */
  public List<PipelineModule> createAll(List<ModuleSpec> specs) {
    List<PipelineModule> modules = new ArrayList<>(specs.size());
    for (ModuleSpec spec : specs) {
      modules.add(create(spec));
    }
    return modules;
  }

  private void register(String type, Set<String> keys, Function<Params, PipelineModule> factory) {
    factories.put(type, factory);
    allowedKeys.put(type, keys);
  }

  private String resolveType(String raw) {
    String normalized = raw.trim().toLowerCase(Locale.ROOT);
    for (String type : factories.keySet()) {
      if (type.toLowerCase(Locale.ROOT).equals(normalized)) {
        return type;
      }
    }
    throw new ModuleParameterException("Unknown module type '" + raw + "'; known types: " + factories.keySet());
  }

  /** Parameter accessors producing messages that name the module and the key. */
  private static final class Params {
    private final String name;
    private final String type;
    private final Map<String, String> values;

    Params(String name, String type, Map<String, String> values) {
      this.name = name;
      this.type = type;
      this.values = values;
    }

    String required(String key) {
      String value = values.get(key);
      if (value == null || value.isBlank()) {
        throw fail("parameter '" + key + "' is required", null);
      }
      return value.trim();
    }

    String optional(String key) {
      String value = values.get(key);
      return value == null || value.isBlank() ? null : value.trim();
    }

    String tag(String key) {
      return required(key);
    }

    String tagOrDefault(String key, String fallback) {
      String value = optional(key);
      return value == null ? fallback : value;
    }

    long longValue(String key, long min, long max) {
      try {
        return Numbers.parseLong(key, required(key), min, max);
      } catch (IllegalArgumentException ex) {
        throw fail(ex.getMessage(), ex);
      }
    }

    double doubleValue(String key, double fallback) {
      String raw = optional(key);
      if (raw == null) {
        return fallback;
      }
      try {
        return Numbers.parseFiniteDouble(key, raw);
      } catch (IllegalArgumentException ex) {
        throw fail(ex.getMessage(), ex);
      }
    }

    long[] frameShape(String key) {
      try {
        return Shape.parseFrameDims(required(key));
      } catch (IllegalArgumentException ex) {
        throw fail(ex.getMessage(), ex);
      }
    }

    DataType dataType(String key) {
      String raw = optional(key);
      if (raw == null) {
        return DataType.FLOAT64;
      }
      try {
        return DataType.fromString(raw);
      } catch (IllegalArgumentException ex) {
        throw fail("parameter '" + key + "' must be one of INT16, INT32, INT64, FLOAT32, FLOAT64", ex);
      }
    }

    int[] indices(String key) {
      String[] parts = required(key).split(",");
      int[] indices = new int[parts.length];
      for (int i = 0; i < parts.length; i++) {
        try {
          indices[i] = (int) Numbers.parseLong(key, parts[i], 0, Integer.MAX_VALUE);
        } catch (IllegalArgumentException ex) {
          throw fail(ex.getMessage(), ex);
        }
      }
      return indices;
    }

    Map<String, AttributeValue> staticAttributes() {
      Map<String, AttributeValue> attributes = new LinkedHashMap<>();
      for (Map.Entry<String, String> entry : values.entrySet()) {
        if (entry.getKey().startsWith(STATIC_PREFIX) && entry.getKey().length() > STATIC_PREFIX.length()) {
          attributes.put(entry.getKey().substring(STATIC_PREFIX.length()), AttributeValue.parse(entry.getValue()));
        }
      }
      return attributes;
    }

    private ModuleParameterException fail(String message, Exception cause) {
      String text = "Module '" + name + "' (" + type + "): " + message;
      return cause == null ? new ModuleParameterException(text) : new ModuleParameterException(text, cause);
    }
  }
}
