package ca.gc.nrc.pyxis.domain.dataset;

import java.nio.ByteBuffer;
import java.util.Locale;

/**
 * <strong>What:</strong> Element types a dataset may be stored as on disk.
 * <p><strong>Why:</strong> Raw frames arrive as integers from detectors while reduced products are
 * floating point; storing the declared width keeps containers compact.</p>
 * <p><strong>Role:</strong> Domain enum consumed by storage encoders and port type inference.</p>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable.</p>
 *
 * @implNote In-memory arrays are {@code double}; integer types round to the nearest value on encode and
 * {@link #INT64} loses precision beyond 2^53.
 * @since 0.1.0
 */
public enum DataType {
  /** Signed 16-bit integer. */
  INT16(2),
  /** Signed 32-bit integer. */
  INT32(4),
  /** Signed 64-bit integer. */
  INT64(8),
  /** IEEE-754 single precision. */
  FLOAT32(4),
  /** IEEE-754 double precision. */
  FLOAT64(8);

  private final int byteSize;

  DataType(int byteSize) {
    this.byteSize = byteSize;
  }

  /**
   * Number of bytes one element occupies on disk.
   *
   * @return element width in bytes
   */
  public int byteSize() {
    return byteSize;
  }

  /**
   * Encodes a value at the buffer's current position.
   *
   * @param buffer destination buffer with at least {@link #byteSize()} bytes remaining
   * @param value value to encode
   */
  public void put(ByteBuffer buffer, double value) {
    switch (this) {
      case INT16 -> buffer.putShort((short) clamp(Math.round(value), Short.MIN_VALUE, Short.MAX_VALUE));
      case INT32 -> buffer.putInt((int) clamp(Math.round(value), Integer.MIN_VALUE, Integer.MAX_VALUE));
      case INT64 -> buffer.putLong(Math.round(value));
      case FLOAT32 -> buffer.putFloat((float) value);
      case FLOAT64 -> buffer.putDouble(value);
      default -> throw new IllegalStateException("Unhandled data type " + this);
    }
  }

  /**
   * Decodes a value at the buffer's current position.
   *
   * @param buffer source buffer with at least {@link #byteSize()} bytes remaining
   * @return decoded value widened to {@code double}
   */
  public double get(ByteBuffer buffer) {
    return switch (this) {
      case INT16 -> buffer.getShort();
      case INT32 -> buffer.getInt();
      case INT64 -> buffer.getLong();
      case FLOAT32 -> buffer.getFloat();
      case FLOAT64 -> buffer.getDouble();
    };
  }

  /**
   * Parses a data type name, case-insensitively.
   *
   * @param raw type name such as {@code float32}
   * @return parsed type
   * @throws IllegalArgumentException when the name is unknown
   */
  public static DataType fromString(String raw) {
    if (raw == null || raw.isBlank()) {
      throw new IllegalArgumentException("data type must not be blank");
    }
    try {
      return DataType.valueOf(raw.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException("Unsupported data type: " + raw, ex);
    }
  }

  private static long clamp(long value, long min, long max) {
    return Math.max(min, Math.min(max, value));
  }
}
