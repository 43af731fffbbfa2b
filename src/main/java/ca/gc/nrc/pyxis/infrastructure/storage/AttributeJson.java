package ca.gc.nrc.pyxis.infrastructure.storage;

import ca.gc.nrc.pyxis.domain.attribute.AttributeArray;
import ca.gc.nrc.pyxis.domain.attribute.AttributeKind;
import ca.gc.nrc.pyxis.domain.attribute.AttributeValue;
import ca.gc.nrc.pyxis.domain.error.StorageException;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Gson form of attribute maps stored as N5 group attributes.
 *
 * <p>Each entry keeps its kind explicitly, {@code {"kind":"REAL","value":1.5}} for static values and
 * {@code {"kind":"INTEGER","values":[1,2]}} for per-frame arrays, so integers and reals survive a reopen
 * unchanged.</p>
 */
final class AttributeJson {

  private AttributeJson() {
    // Utility
  }

  static JsonObject encodeValues(Map<String, AttributeValue> values) {
    JsonObject out = new JsonObject();
    for (Map.Entry<String, AttributeValue> entry : values.entrySet()) {
      out.add(entry.getKey(), encodeValue(entry.getValue()));
    }
    return out;
  }

  static JsonObject encodeArrays(Map<String, AttributeArray> arrays) {
    JsonObject out = new JsonObject();
    for (Map.Entry<String, AttributeArray> entry : arrays.entrySet()) {
      out.add(entry.getKey(), encodeArray(entry.getValue()));
    }
    return out;
  }

  static Map<String, AttributeValue> decodeValues(JsonObject json, String where) {
    Map<String, AttributeValue> out = new LinkedHashMap<>();
    if (json == null) {
      return out;
    }
    for (Map.Entry<String, JsonElement> entry : json.entrySet()) {
      out.put(entry.getKey(), decodeValue(object(entry.getValue(), where, entry.getKey()), where, entry.getKey()));
    }
    return out;
  }

  static Map<String, AttributeArray> decodeArrays(JsonObject json, String where) {
    Map<String, AttributeArray> out = new LinkedHashMap<>();
    if (json == null) {
      return out;
    }
    for (Map.Entry<String, JsonElement> entry : json.entrySet()) {
      out.put(entry.getKey(), decodeArray(object(entry.getValue(), where, entry.getKey()), where, entry.getKey()));
    }
    return out;
  }

  private static JsonObject encodeValue(AttributeValue value) {
    JsonObject out = new JsonObject();
    out.addProperty("kind", value.kind().name());
    if (value instanceof AttributeValue.Int i) {
      out.addProperty("value", i.value());
    } else if (value instanceof AttributeValue.Real r) {
      out.addProperty("value", r.value());
    } else {
      out.addProperty("value", value.asText());
    }
    return out;
  }

  private static JsonObject encodeArray(AttributeArray array) {
    JsonArray values = new JsonArray();
    if (array instanceof AttributeArray.RealArray reals) {
      for (double v : reals.values()) {
        values.add(v);
      }
    } else if (array instanceof AttributeArray.IntArray ints) {
      for (long v : ints.values()) {
        values.add(v);
      }
    } else if (array instanceof AttributeArray.TextArray texts) {
      for (String v : texts.values()) {
        values.add(v);
      }
    }
    JsonObject out = new JsonObject();
    out.addProperty("kind", array.kind().name());
    out.add("values", values);
    return out;
  }

  private static AttributeValue decodeValue(JsonObject json, String where, String key) {
    JsonElement value = json.get("value");
    if (value == null || !value.isJsonPrimitive()) {
      throw corrupt(where, key, "has no value");
    }
    try {
      return switch (kindOf(json, where, key)) {
        case TEXT -> AttributeValue.text(value.getAsString());
        case INTEGER -> AttributeValue.integer(value.getAsLong());
        case REAL -> AttributeValue.real(value.getAsDouble());
      };
    } catch (NumberFormatException ex) {
      throw new StorageException("Attribute '" + key + "' of " + where + " is not numeric", ex);
    }
  }

  private static AttributeArray decodeArray(JsonObject json, String where, String key) {
    JsonElement raw = json.get("values");
    if (raw == null || !raw.isJsonArray()) {
      throw corrupt(where, key, "has no values");
    }
    JsonArray values = raw.getAsJsonArray();
    try {
      switch (kindOf(json, where, key)) {
        case REAL -> {
          double[] out = new double[values.size()];
          for (int i = 0; i < out.length; i++) {
            out[i] = values.get(i).getAsDouble();
          }
          return AttributeArray.reals(out);
        }
        case INTEGER -> {
          long[] out = new long[values.size()];
          for (int i = 0; i < out.length; i++) {
            out[i] = values.get(i).getAsLong();
          }
          return AttributeArray.integers(out);
        }
        default -> {
          String[] out = new String[values.size()];
          for (int i = 0; i < out.length; i++) {
            out[i] = values.get(i).getAsString();
          }
          return AttributeArray.texts(out);
        }
      }
    } catch (NumberFormatException | UnsupportedOperationException | IllegalStateException ex) {
      throw new StorageException("Attribute '" + key + "' of " + where + " has malformed values", ex);
    }
  }

  private static AttributeKind kindOf(JsonObject json, String where, String key) {
    JsonElement kind = json.get("kind");
    if (kind == null || !kind.isJsonPrimitive()) {
      throw corrupt(where, key, "has no kind");
    }
    try {
      return AttributeKind.fromString(kind.getAsString());
    } catch (IllegalArgumentException ex) {
      throw new StorageException("Attribute '" + key + "' of " + where + " has an invalid kind", ex);
    }
  }

  private static JsonObject object(JsonElement element, String where, String key) {
    if (element == null || !element.isJsonObject()) {
      throw corrupt(where, key, "is not an object");
    }
    return element.getAsJsonObject();
  }

  private static StorageException corrupt(String where, String key, String problem) {
    return new StorageException("Attribute '" + key + "' of " + where + " " + problem);
  }
}
