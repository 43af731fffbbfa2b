package ca.gc.nrc.pyxis.domain.dataset;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.function.DoubleUnaryOperator;

/**
 * <strong>What:</strong> In-memory block of frames held as a flat row-major {@code double} array.
 * <p><strong>Why:</strong> Modules exchange chunks with storage through this type regardless of the on-disk
 * element type, so transforms can be written once.</p>
 * <p><strong>Role:</strong> Domain value passed between ports, modules and the storage adapter.</p>
 * <p><strong>Thread-safety:</strong> Not thread-safe; {@link #set(long, int, double)} mutates the backing
 * array. Factories copy their input.</p>
 *
 * @since 0.1.0
 */
public final class NdArray {
  private final Shape shape;
  private final double[] data;

  private NdArray(Shape shape, double[] data) {
    this.shape = shape;
    this.data = data;
  }

  /**
   * Creates a zero-filled array.
   *
   * @param shape array shape
   * @return zero array
   */
  public static NdArray zeros(Shape shape) {
    Objects.requireNonNull(shape, "shape");
    return new NdArray(shape, new double[Math.toIntExact(shape.elementCount())]);
  }

  /**
   * Creates an array from row-major values.
   *
   * @param shape array shape
   * @param values values, copied
   * @return array
   * @throws IllegalArgumentException when the value count does not match the shape
   */
  public static NdArray of(Shape shape, double... values) {
    Objects.requireNonNull(shape, "shape");
    Objects.requireNonNull(values, "values");
    if (values.length != shape.elementCount()) {
      throw new IllegalArgumentException(
          "expected " + shape.elementCount() + " values for shape " + shape + " but got " + values.length);
    }
    return new NdArray(shape, values.clone());
  }

  /**
   * Wraps values without copying. Used by storage after decoding into a fresh buffer.
   *
   * @param shape array shape
   * @param values values, owned by the returned array
   * @return array
   */
  public static NdArray wrap(Shape shape, double[] values) {
    if (values.length != shape.elementCount()) {
      throw new IllegalArgumentException(
          "expected " + shape.elementCount() + " values for shape " + shape + " but got " + values.length);
    }
    return new NdArray(shape, values);
  }

  /**
   * Concatenates arrays along the frame axis.
   *
   * @param parts arrays with identical frame shapes
   * @return concatenated array
   */
  public static NdArray concat(List<NdArray> parts) {
    if (parts == null || parts.isEmpty()) {
      throw new IllegalArgumentException("concat requires at least one array");
    }
    Shape first = parts.get(0).shape;
    long frames = 0;
    for (NdArray part : parts) {
      if (!first.sameFrameShape(part.shape)) {
        throw new IllegalArgumentException(
            "cannot concatenate frame shape " + part.shape + " onto " + first);
      }
      frames += part.frames();
    }
    double[] out = new double[Math.toIntExact(frames * first.frameSize())];
    int offset = 0;
    for (NdArray part : parts) {
      System.arraycopy(part.data, 0, out, offset, part.data.length);
      offset += part.data.length;
    }
    return new NdArray(first.withFrames(frames), out);
  }

  public Shape shape() {
    return shape;
  }

  public long frames() {
    return shape.frames();
  }

  public int frameSize() {
    return Math.toIntExact(shape.frameSize());
  }

  public int size() {
    return data.length;
  }

  /**
   * Reads one element.
   *
   * @param frame frame index within this array
   * @param offset row-major offset within the frame
   * @return element value
   */
  public double get(long frame, int offset) {
    return data[index(frame, offset)];
  }

  /**
   * Writes one element.
   *
   * @param frame frame index within this array
   * @param offset row-major offset within the frame
   * @param value new value
   */
  public void set(long frame, int offset, double value) {
    data[index(frame, offset)] = value;
  }

  /**
   * Reads an element by flat row-major index.
   *
   * @param flatIndex index into the whole array
   * @return element value
   */
  public double getFlat(int flatIndex) {
    return data[flatIndex];
  }

  /**
   * Copies one frame's values.
   *
   * @param frame frame index within this array
   * @return copy of the frame
   */
  public double[] frameValues(long frame) {
    int from = index(frame, 0);
    return Arrays.copyOfRange(data, from, from + frameSize());
  }

  /**
   * Returns a single frame as an array with a frame count of one.
   *
   * @param frame frame index within this array
   * @return one-frame array
   */
  public NdArray frame(long frame) {
    return new NdArray(shape.withFrames(1), frameValues(frame));
  }

  /**
   * Copies a contiguous run of frames.
   *
   * @param range frames relative to this array
   * @return sub-array
   */
  public NdArray frames(FrameRange range) {
    if (range.end() > frames()) {
      throw new IndexOutOfBoundsException("range " + range + " exceeds " + frames() + " frames");
    }
    int from = Math.toIntExact(range.start() * frameSize());
    int to = Math.toIntExact(range.end() * frameSize());
    return new NdArray(shape.withFrames(range.length()), Arrays.copyOfRange(data, from, to));
  }

  /**
   * Picks frames by index in the given order.
   *
   * @param indices frame indices within this array
   * @return selected frames
   */
  public NdArray select(int[] indices) {
    int fs = frameSize();
    double[] out = new double[indices.length * fs];
    for (int i = 0; i < indices.length; i++) {
      System.arraycopy(data, index(indices[i], 0), out, i * fs, fs);
    }
    return new NdArray(shape.withFrames(indices.length), out);
  }

  /**
   * Applies a function element-wise, returning a new array.
   *
   * @param fn element transform
   * @return transformed copy
   */
  public NdArray map(DoubleUnaryOperator fn) {
    double[] out = new double[data.length];
    for (int i = 0; i < data.length; i++) {
      out[i] = fn.applyAsDouble(data[i]);
    }
    return new NdArray(shape, out);
  }

  /**
   * Copies all values in row-major order.
   *
   * @return value copy
   */
  public double[] toArray() {
    return data.clone();
  }

  private int index(long frame, int offset) {
    if (frame < 0 || frame >= frames()) {
      throw new IndexOutOfBoundsException("frame " + frame + " outside [0, " + frames() + ")");
    }
    if (offset < 0 || offset >= frameSize()) {
      throw new IndexOutOfBoundsException("offset " + offset + " outside frame of " + frameSize());
    }
    return Math.toIntExact(frame * frameSize() + offset);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    return o instanceof NdArray that && shape.equals(that.shape) && Arrays.equals(data, that.data);
  }

  @Override
  public int hashCode() {
    return 31 * shape.hashCode() + Arrays.hashCode(data);
  }

  @Override
  public String toString() {
    return "NdArray" + shape;
  }
}
