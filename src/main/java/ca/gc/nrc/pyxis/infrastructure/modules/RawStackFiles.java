package ca.gc.nrc.pyxis.infrastructure.modules;

import ca.gc.nrc.pyxis.domain.attribute.AttributeArray;
import ca.gc.nrc.pyxis.domain.attribute.AttributeKind;
import ca.gc.nrc.pyxis.domain.attribute.AttributeValue;
import ca.gc.nrc.pyxis.domain.dataset.Shape;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Raw stack exchange format: {@code <name>.raw} holds every frame as big-endian {@code FLOAT64} values in row-major
 * order, {@code <name>.json} holds the shape and both attribute maps.
 *
 * <p>Sidecar layout: {@code {"format", "shape": [...], "static": {KEY: {"kind", "value"}},
 * "nonStatic": {KEY: {"kind", "values"}}}}.</p>
 */
public final class RawStackFiles {
  static final String FORMAT = "pyxis-raw-1";
  static final String RAW_SUFFIX = ".raw";
  static final String SIDECAR_SUFFIX = ".json";

  private static final JsonFactory FACTORY = new JsonFactory();

  private RawStackFiles() {}

  /**
   * Sidecar contents.
   *
   * @param shape full shape including the frame axis
   * @param statics static attributes
   * @param nonStatics per-frame attributes
   */
  public record Header(Shape shape, Map<String, AttributeValue> statics, Map<String, AttributeArray> nonStatics) {
    public Header {
      Objects.requireNonNull(shape, "shape");
      statics = Collections.unmodifiableMap(new LinkedHashMap<>(statics == null ? Map.of() : statics));
      nonStatics = Collections.unmodifiableMap(new LinkedHashMap<>(nonStatics == null ? Map.of() : nonStatics));
    }
  }

  public static Path rawPath(Path directory, String baseName) {
    return directory.resolve(baseName + RAW_SUFFIX);
  }

  public static Path sidecarPath(Path directory, String baseName) {
    return directory.resolve(baseName + SIDECAR_SUFFIX);
  }

  /**
   * Writes the sidecar file, replacing an existing one.
   *
   * @param file destination
   * @param header contents
   * @throws IOException when writing fails
   */
  public static void writeHeader(Path file, Header header) throws IOException {
    try (OutputStream out = Files.newOutputStream(file);
        JsonGenerator gen = FACTORY.createGenerator(out)) {
      gen.useDefaultPrettyPrinter();
      gen.writeStartObject();
      gen.writeStringField("format", FORMAT);
      gen.writeArrayFieldStart("shape");
      for (long dim : header.shape().toArray()) {
        gen.writeNumber(dim);
      }
      gen.writeEndArray();
      gen.writeObjectFieldStart("static");
      for (Map.Entry<String, AttributeValue> entry : header.statics().entrySet()) {
        AttributeValue value = entry.getValue();
        gen.writeObjectFieldStart(entry.getKey());
        gen.writeStringField("kind", value.kind().name());
        gen.writeFieldName("value");
        switch (value.kind()) {
          case INTEGER -> gen.writeNumber(value.asLong());
          case REAL -> gen.writeNumber(value.asDouble());
          default -> gen.writeString(value.asText());
        }
        gen.writeEndObject();
      }
      gen.writeEndObject();
      gen.writeObjectFieldStart("nonStatic");
      for (Map.Entry<String, AttributeArray> entry : header.nonStatics().entrySet()) {
        AttributeArray array = entry.getValue();
        gen.writeObjectFieldStart(entry.getKey());
        gen.writeStringField("kind", array.kind().name());
        gen.writeArrayFieldStart("values");
        for (int i = 0; i < array.length(); i++) {
          AttributeValue element = array.get(i);
          switch (array.kind()) {
            case INTEGER -> gen.writeNumber(element.asLong());
            case REAL -> gen.writeNumber(element.asDouble());
            default -> gen.writeString(element.asText());
          }
        }
        gen.writeEndArray();
        gen.writeEndObject();
      }
      gen.writeEndObject();
      gen.writeEndObject();
    }
  }

  /**
   * Reads a sidecar file.
   *
   * @param file sidecar location
   * @return parsed header
   * @throws IOException when the file is unreadable or malformed
   */
  public static Header readHeader(Path file) throws IOException {
    Map<String, Object> root;
    try (InputStream in = Files.newInputStream(file);
        JsonParser parser = FACTORY.createParser(in)) {
      JsonToken token = parser.nextToken();
      if (token != JsonToken.START_OBJECT) {
        throw new IOException(file + ": sidecar must be a JSON object");
      }
      root = readObject(parser);
    }
    Object format = root.get("format");
    if (format != null && !FORMAT.equals(format)) {
      throw new IOException(file + ": unsupported sidecar format " + format);
    }
    List<Object> dimsRaw = asList(root.get("shape"), "shape");
    if (dimsRaw.isEmpty()) {
      throw new IOException(file + ": shape must not be empty");
    }
    long[] dims = new long[dimsRaw.size()];
    for (int i = 0; i < dims.length; i++) {
      dims[i] = asNumber(dimsRaw.get(i), "shape").longValue();
    }
    Shape shape;
    try {
      shape = Shape.of(dims);
    } catch (IllegalArgumentException ex) {
      throw new IOException(file + ": invalid shape", ex);
    }

    Map<String, AttributeValue> statics = new LinkedHashMap<>();
    for (Map.Entry<String, Object> entry : asMap(root.getOrDefault("static", Map.of()), "static").entrySet()) {
      Map<String, Object> node = asMap(entry.getValue(), entry.getKey());
      statics.put(entry.getKey(), toValue(kindOf(node, entry.getKey()), node.get("value"), entry.getKey()));
    }
    Map<String, AttributeArray> nonStatics = new LinkedHashMap<>();
    for (Map.Entry<String, Object> entry : asMap(root.getOrDefault("nonStatic", Map.of()), "nonStatic").entrySet()) {
      Map<String, Object> node = asMap(entry.getValue(), entry.getKey());
      nonStatics.put(entry.getKey(), toArray(kindOf(node, entry.getKey()),
          asList(node.getOrDefault("values", List.of()), entry.getKey()), entry.getKey()));
    }
    return new Header(shape, statics, nonStatics);
  }

  private static AttributeValue toValue(AttributeKind kind, Object raw, String key) throws IOException {
    return switch (kind) {
      case TEXT -> AttributeValue.text(String.valueOf(raw));
      case INTEGER -> AttributeValue.integer(asNumber(raw, key).longValue());
      case REAL -> AttributeValue.real(asReal(raw, key));
    };
  }

  private static AttributeArray toArray(AttributeKind kind, List<Object> values, String key) throws IOException {
    switch (kind) {
      case INTEGER -> {
        long[] out = new long[values.size()];
        for (int i = 0; i < out.length; i++) {
          out[i] = asNumber(values.get(i), key).longValue();
        }
        return AttributeArray.integers(out);
      }
      case REAL -> {
        double[] out = new double[values.size()];
        for (int i = 0; i < out.length; i++) {
          out[i] = asReal(values.get(i), key);
        }
        return AttributeArray.reals(out);
      }
      default -> {
        String[] out = new String[values.size()];
        for (int i = 0; i < out.length; i++) {
          out[i] = String.valueOf(values.get(i));
        }
        return AttributeArray.texts(out);
      }
    }
  }

  private static AttributeKind kindOf(Map<String, Object> node, String key) throws IOException {
    Object kind = node.get("kind");
    if (!(kind instanceof String text)) {
      throw new IOException("attribute '" + key + "' has no kind");
    }
    try {
      return AttributeKind.fromString(text);
    } catch (IllegalArgumentException ex) {
      throw new IOException("attribute '" + key + "' has an invalid kind", ex);
    }
  }

  private static Object readValue(JsonParser parser, JsonToken token) throws IOException {
    return switch (token) {
      case START_OBJECT -> readObject(parser);
      case START_ARRAY -> readArray(parser);
      case VALUE_STRING -> parser.getText();
      case VALUE_NUMBER_INT, VALUE_NUMBER_FLOAT -> parser.getNumberValue();
      case VALUE_TRUE -> Boolean.TRUE;
      case VALUE_FALSE -> Boolean.FALSE;
      case VALUE_NULL -> null;
      default -> throw new IOException("Unsupported JSON token: " + token);
    };
  }

  private static Map<String, Object> readObject(JsonParser parser) throws IOException {
    Map<String, Object> map = new LinkedHashMap<>();
    JsonToken token;
    while ((token = parser.nextToken()) != JsonToken.END_OBJECT) {
      if (token != JsonToken.FIELD_NAME) {
        throw new IOException("Expected field name but found " + token);
      }
      String field = parser.getCurrentName();
      map.put(field, readValue(parser, parser.nextToken()));
    }
    return map;
  }

  private static List<Object> readArray(JsonParser parser) throws IOException {
    List<Object> list = new ArrayList<>();
    JsonToken token;
    while ((token = parser.nextToken()) != JsonToken.END_ARRAY) {
      list.add(readValue(parser, token));
    }
    return list;
  }

  @SuppressWarnings("unchecked")
  private static Map<String, Object> asMap(Object raw, String field) throws IOException {
    if (raw instanceof Map<?, ?> map) {
      return (Map<String, Object>) map;
    }
    throw new IOException("sidecar field '" + field + "' must be an object");
  }

  @SuppressWarnings("unchecked")
  private static List<Object> asList(Object raw, String field) throws IOException {
    if (raw instanceof List<?> list) {
      return (List<Object>) list;
    }
    throw new IOException("sidecar field '" + field + "' must be an array");
  }

  private static Number asNumber(Object raw, String field) throws IOException {
    if (raw instanceof Number n) {
      return n;
    }
    throw new IOException("sidecar field '" + field + "' must be a number");
  }

  private static double asReal(Object raw, String field) throws IOException {
    // NaN and infinities are written as strings
    if (raw instanceof String s) {
      try {
        return Double.parseDouble(s);
      } catch (NumberFormatException ex) {
        throw new IOException("sidecar field '" + field + "' must be a number", ex);
      }
    }
    return asNumber(raw, field).doubleValue();
  }
}
