package ca.gc.nrc.pyxis.domain.attribute;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * <strong>What:</strong> Per-frame attribute values aligned index-for-index with a dataset's frame axis.
 * <p><strong>Why:</strong> Exposure times, parallactic angles and frame indices travel with the frames they
 * describe; selecting or dropping frames must subset these arrays identically.</p>
 * <p><strong>Thread-safety:</strong> Immutable; arrays are defensively copied.</p>
 *
 * @since 0.1.0
 */
public sealed interface AttributeArray
    permits AttributeArray.RealArray, AttributeArray.IntArray, AttributeArray.TextArray {

  AttributeKind kind();

  int length();

  /**
   * Element at the given frame index.
   *
   * @param index frame index
   * @return element as a static value
   */
  AttributeValue get(int index);

  /**
   * Picks elements in the given order.
   *
   * @param indices frame indices
   * @return subset with {@code indices.length} elements
   */
  AttributeArray select(int[] indices);

  /**
   * Appends another array of the same kind.
   *
   * @param other array to append
   * @return concatenation
   */
  AttributeArray concat(AttributeArray other);

  static AttributeArray reals(double... values) {
    return new RealArray(values);
  }

  static AttributeArray integers(long... values) {
    return new IntArray(values);
  }

  static AttributeArray texts(String... values) {
    return new TextArray(List.of(values));
  }

  /** Real-valued per-frame attribute. */
  final class RealArray implements AttributeArray {
    private final double[] values;

    RealArray(double[] values) {
      this.values = Objects.requireNonNull(values, "values").clone();
    }

    public double[] values() {
      return values.clone();
    }

    @Override
    public AttributeKind kind() {
      return AttributeKind.REAL;
    }

    @Override
    public int length() {
      return values.length;
    }

    @Override
    public AttributeValue get(int index) {
      return AttributeValue.real(values[index]);
    }

    @Override
    public AttributeArray select(int[] indices) {
      double[] out = new double[indices.length];
      for (int i = 0; i < indices.length; i++) {
        out[i] = values[indices[i]];
      }
      return new RealArray(out);
    }

    @Override
    public AttributeArray concat(AttributeArray other) {
      if (!(other instanceof RealArray real)) {
        throw new IllegalArgumentException("cannot append " + other.kind() + " values to REAL attribute");
      }
      double[] out = Arrays.copyOf(values, values.length + real.values.length);
      System.arraycopy(real.values, 0, out, values.length, real.values.length);
      return new RealArray(out);
    }

    @Override
    public boolean equals(Object o) {
      return o instanceof RealArray that && Arrays.equals(values, that.values);
    }

    @Override
    public int hashCode() {
      return Arrays.hashCode(values);
    }

    @Override
    public String toString() {
      return "REAL" + Arrays.toString(values);
    }
  }

  /** Integer-valued per-frame attribute. */
  final class IntArray implements AttributeArray {
    private final long[] values;

    IntArray(long[] values) {
      this.values = Objects.requireNonNull(values, "values").clone();
    }

    public long[] values() {
      return values.clone();
    }

    @Override
    public AttributeKind kind() {
      return AttributeKind.INTEGER;
    }

    @Override
    public int length() {
      return values.length;
    }

    @Override
    public AttributeValue get(int index) {
      return AttributeValue.integer(values[index]);
    }

    @Override
    public AttributeArray select(int[] indices) {
      long[] out = new long[indices.length];
      for (int i = 0; i < indices.length; i++) {
        out[i] = values[indices[i]];
      }
      return new IntArray(out);
    }

    @Override
    public AttributeArray concat(AttributeArray other) {
      if (!(other instanceof IntArray ints)) {
        throw new IllegalArgumentException("cannot append " + other.kind() + " values to INTEGER attribute");
      }
      long[] out = Arrays.copyOf(values, values.length + ints.values.length);
      System.arraycopy(ints.values, 0, out, values.length, ints.values.length);
      return new IntArray(out);
    }

    @Override
    public boolean equals(Object o) {
      return o instanceof IntArray that && Arrays.equals(values, that.values);
    }

    @Override
    public int hashCode() {
      return Arrays.hashCode(values);
    }

    @Override
    public String toString() {
      return "INTEGER" + Arrays.toString(values);
    }
  }

  /** Text-valued per-frame attribute. */
  final class TextArray implements AttributeArray {
    private final List<String> values;

    TextArray(List<String> values) {
      this.values = List.copyOf(values);
    }

    public List<String> values() {
      return values;
    }

    @Override
    public AttributeKind kind() {
      return AttributeKind.TEXT;
    }

    @Override
    public int length() {
      return values.size();
    }

    @Override
    public AttributeValue get(int index) {
      return AttributeValue.text(values.get(index));
    }

    @Override
    public AttributeArray select(int[] indices) {
      String[] out = new String[indices.length];
      for (int i = 0; i < indices.length; i++) {
        out[i] = values.get(indices[i]);
      }
      return new TextArray(Arrays.asList(out));
    }

    @Override
    public AttributeArray concat(AttributeArray other) {
      if (!(other instanceof TextArray text)) {
        throw new IllegalArgumentException("cannot append " + other.kind() + " values to TEXT attribute");
      }
      String[] out = values.toArray(new String[0]);
      String[] joined = Arrays.copyOf(out, out.length + text.values.size());
      for (int i = 0; i < text.values.size(); i++) {
        joined[out.length + i] = text.values.get(i);
      }
      return new TextArray(Arrays.asList(joined));
    }

    @Override
    public boolean equals(Object o) {
      return o instanceof TextArray that && values.equals(that.values);
    }

    @Override
    public int hashCode() {
      return values.hashCode();
    }

    @Override
    public String toString() {
      return "TEXT" + values;
    }
  }
}
