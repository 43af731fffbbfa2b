package ca.gc.nrc.pyxis.domain.attribute;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * <strong>What:</strong> A single static attribute value: text, integer or real.
 * <p><strong>Why:</strong> Static attributes describe a whole dataset (instrument, pixel scale, history)
 * and must survive a round trip through the storage container with their kind intact.</p>
 * <p><strong>Thread-safety:</strong> Immutable.</p>
 *
 * @since 0.1.0
 */
public sealed interface AttributeValue permits AttributeValue.Text, AttributeValue.Int, AttributeValue.Real {
  /** Decimal integers that fit the {@link Int} kind. */
  Pattern INTEGER_TEXT = Pattern.compile("[+-]?\\d{1,18}");
  /** Decimal or scientific reals. */
  Pattern REAL_TEXT = Pattern.compile("[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?");

  AttributeKind kind();

  /**
   * Boxed value for logging and equality checks across kinds.
   *
   * @return underlying value
   */
  Object raw();

  /**
   * Text rendering of the value.
   *
   * @return value as text
   */
  default String asText() {
    return String.valueOf(raw());
  }

  /**
   * Numeric view of the value.
   *
   * @return value as double
   * @throws IllegalStateException when the value is text that does not parse as a number
   */
  double asDouble();

  /**
   * Integer view of the value; reals are truncated.
   *
   * @return value as long
   */
  default long asLong() {
    return (long) asDouble();
  }

  static AttributeValue text(String value) {
    return new Text(value);
  }

  static AttributeValue integer(long value) {
    return new Int(value);
  }

  static AttributeValue real(double value) {
    return new Real(value);
  }

  /**
   * Wraps a boxed Java value. Integral numbers map to {@link Int}, other numbers to {@link Real},
   * everything else to {@link Text}.
   *
   * @param value boxed value; must not be {@code null}
   * @return wrapped attribute value
   */
  static AttributeValue of(Object value) {
    Objects.requireNonNull(value, "value");
    if (value instanceof AttributeValue attr) {
      return attr;
    }
    if (value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof Byte) {
      return new Int(((Number) value).longValue());
    }
    if (value instanceof Number number) {
      return new Real(number.doubleValue());
    }
    return new Text(value.toString());
  }

  /**
   * Parses configuration text: integers first, then reals, otherwise text.
   *
   * @param raw configuration value
   * @return inferred attribute value
   */
  static AttributeValue parse(String raw) {
    Objects.requireNonNull(raw, "raw");
    String trimmed = raw.trim();
    if (INTEGER_TEXT.matcher(trimmed).matches()) {
      return new Int(Long.parseLong(trimmed));
    }
    if (REAL_TEXT.matcher(trimmed).matches()) {
      return new Real(Double.parseDouble(trimmed));
    }
    return new Text(raw);
  }

  /** Text value. */
  record Text(String value) implements AttributeValue {
    public Text {
      Objects.requireNonNull(value, "value");
    }

    @Override
    public AttributeKind kind() {
      return AttributeKind.TEXT;
    }

    @Override
    public Object raw() {
      return value;
    }

    @Override
    public double asDouble() {
      try {
        return Double.parseDouble(value.trim());
      } catch (NumberFormatException ex) {
        throw new IllegalStateException("attribute value '" + value + "' is not numeric", ex);
      }
    }
  }

  /** Integer value. */
  record Int(long value) implements AttributeValue {
    @Override
    public AttributeKind kind() {
      return AttributeKind.INTEGER;
    }

    @Override
    public Object raw() {
      return value;
    }

    @Override
    public double asDouble() {
      return value;
    }

    @Override
    public long asLong() {
      return value;
    }
  }

  /** Real value. */
  record Real(double value) implements AttributeValue {
    @Override
    public AttributeKind kind() {
      return AttributeKind.REAL;
    }

    @Override
    public Object raw() {
      return value;
    }

    @Override
    public double asDouble() {
      return value;
    }
  }
}
