package ca.gc.nrc.pyxis.domain.dataset;

/**
 * Half-open range {@code [start, end)} of frame indices.
 *
 * @param start first frame, inclusive
 * @param end last frame, exclusive
 * @since 0.1.0
 */
public record FrameRange(long start, long end) {

  /**
   * Validates the bounds.
   */
  public FrameRange {
    if (start < 0) {
      throw new IllegalArgumentException("range start must not be negative (was " + start + ")");
    }
    if (end < start) {
      throw new IllegalArgumentException("range end " + end + " precedes start " + start);
    }
  }

  /**
   * Range covering frames {@code [0, frames)}.
   *
   * @param frames frame count
   * @return full range
   */
  public static FrameRange all(long frames) {
    return new FrameRange(0, frames);
  }

  /**
   * Range covering exactly one frame.
   *
   * @param index frame index
   * @return single-frame range
   */
  public static FrameRange single(long index) {
    return new FrameRange(index, index + 1);
  }

  public long length() {
    return end - start;
  }

  public boolean isEmpty() {
    return end == start;
  }

  @Override
  public String toString() {
    return "[" + start + ", " + end + ")";
  }
}
