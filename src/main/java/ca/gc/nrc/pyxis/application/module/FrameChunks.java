package ca.gc.nrc.pyxis.application.module;

import ca.gc.nrc.pyxis.domain.dataset.FrameRange;
import java.util.ArrayList;
import java.util.List;

/**
 * Splits a frame axis into consecutive chunks.
 *
 * @since 0.1.0
 */
public final class FrameChunks {

  private FrameChunks() {}

  /**
   * Plans chunks covering {@code [0, total)} in order.
   *
   * <p>A non-positive or oversized chunk size yields a single range. An empty axis yields no ranges.</p>
   *
   * @param total frame count
   * @param framesPerChunk frames per chunk; {@code 0} means all frames at once
   * @return consecutive ranges; the last may be shorter
   */
  public static List<FrameRange> plan(long total, int framesPerChunk) {
    if (total < 0) {
      throw new IllegalArgumentException("total frames must not be negative (was " + total + ")");
    }
    if (framesPerChunk < 0) {
      throw new IllegalArgumentException("framesPerChunk must not be negative (was " + framesPerChunk + ")");
    }
    List<FrameRange> ranges = new ArrayList<>();
    if (total == 0) {
      return ranges;
    }
    if (framesPerChunk == 0 || framesPerChunk >= total) {
      ranges.add(FrameRange.all(total));
      return ranges;
    }
    for (long start = 0; start < total; start += framesPerChunk) {
      ranges.add(new FrameRange(start, Math.min(total, start + framesPerChunk)));
    }
    return ranges;
  }
}
