package ca.gc.nrc.pyxis.domain.dataset;

import java.util.Arrays;
import java.util.StringJoiner;

/**
 * Immutable N-dimensional extent whose first axis is the frame axis.
 *
 * <p>A one-dimensional shape describes a dataset of scalar frames. Dimensions are non-negative; only the
 * frame axis may be zero.</p>
 *
 * @since 0.1.0
 */
public final class Shape {
  private final long[] dims;

  private Shape(long[] dims) {
    this.dims = dims;
  }

  /**
   * Creates a shape from explicit dimensions.
   *
   * @param dims dimensions, frame axis first
   * @return shape
   * @throws IllegalArgumentException when no dimension is given or a dimension is invalid
   */
  public static Shape of(long... dims) {
    if (dims == null || dims.length == 0) {
      throw new IllegalArgumentException("shape requires at least one dimension");
    }
    long[] copy = dims.clone();
    if (copy[0] < 0) {
      throw new IllegalArgumentException("frame count must not be negative (was " + copy[0] + ")");
    }
    for (int i = 1; i < copy.length; i++) {
      if (copy[i] <= 0) {
        throw new IllegalArgumentException("dimension " + i + " must be positive (was " + copy[i] + ")");
      }
    }
    return new Shape(copy);
  }

  /**
   * Creates a shape from a frame count and a per-frame shape.
   *
   * @param frames number of frames
   * @param frameDims dimensions of a single frame
   * @return shape
   */
  public static Shape ofFrames(long frames, long... frameDims) {
    long[] dims = new long[frameDims.length + 1];
    dims[0] = frames;
    System.arraycopy(frameDims, 0, dims, 1, frameDims.length);
    return of(dims);
  }

  /**
   * Parses a frame shape such as {@code 64x64} into its dimensions.
   *
   * @param text dimensions separated by {@code x}; empty text yields a scalar frame
   * @return per-frame dimensions
   */
  public static long[] parseFrameDims(String text) {
    if (text == null || text.isBlank()) {
      return new long[0];
    }
    String[] parts = text.trim().split("x");
    long[] dims = new long[parts.length];
    for (int i = 0; i < parts.length; i++) {
      try {
        dims[i] = Long.parseLong(parts[i].trim());
      } catch (NumberFormatException ex) {
        throw new IllegalArgumentException("invalid frame shape: " + text, ex);
      }
    }
    return dims;
  }

  public int rank() {
    return dims.length;
  }

  public long dim(int axis) {
    return dims[axis];
  }

  public long frames() {
    return dims[0];
  }

  /**
   * Dimensions of one frame (all axes after the first).
   *
   * @return copy of the frame dimensions
   */
  public long[] frameDims() {
    return Arrays.copyOfRange(dims, 1, dims.length);
  }

  /**
   * Number of elements in a single frame.
   *
   * @return element count per frame, 1 for scalar frames
   */
  public long frameSize() {
    long size = 1;
    for (int i = 1; i < dims.length; i++) {
      size = Math.multiplyExact(size, dims[i]);
    }
    return size;
  }

  public long elementCount() {
    return Math.multiplyExact(frames(), frameSize());
  }

  /**
   * Returns a shape with the same frame dimensions and a different frame count.
   *
   * @param frames new frame count
   * @return resized shape
   */
  public Shape withFrames(long frames) {
    long[] copy = dims.clone();
    copy[0] = frames;
    return of(copy);
  }

  /**
   * Whether both shapes agree on every axis after the frame axis.
   *
   * @param other shape to compare
   * @return {@code true} when frames of both shapes are interchangeable
   */
  public boolean sameFrameShape(Shape other) {
    if (other == null || other.dims.length != dims.length) {
      return false;
    }
    for (int i = 1; i < dims.length; i++) {
      if (dims[i] != other.dims[i]) {
        return false;
      }
    }
    return true;
  }

  /**
   * Renders the frame dimensions as {@code AxB}; scalar frames render as an empty string.
   *
   * @return frame shape text
   */
  public String frameShapeText() {
    StringJoiner joiner = new StringJoiner("x");
    for (int i = 1; i < dims.length; i++) {
      joiner.add(Long.toString(dims[i]));
    }
    return joiner.toString();
  }

  public long[] toArray() {
    return dims.clone();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    return o instanceof Shape that && Arrays.equals(dims, that.dims);
  }

  @Override
  public int hashCode() {
    return Arrays.hashCode(dims);
  }

  @Override
  public String toString() {
    return Arrays.toString(dims);
  }
}
