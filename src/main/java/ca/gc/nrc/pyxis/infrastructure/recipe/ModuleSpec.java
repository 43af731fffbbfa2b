package ca.gc.nrc.pyxis.infrastructure.recipe;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One entry of a recipe: module type, unique name and flat parameters.
 *
 * @param type factory key such as {@code select}
 * @param name module name
 * @param params parameter values as text; lists are comma-joined
 */
public record ModuleSpec(String type, String name, Map<String, String> params) {
  public ModuleSpec {
    Objects.requireNonNull(type, "type");
    Objects.requireNonNull(name, "name");
    params = Collections.unmodifiableMap(new LinkedHashMap<>(params == null ? Map.of() : params));
  }
}
