package ca.gc.nrc.pyxis.application.module;

import ca.gc.nrc.pyxis.domain.dataset.FrameRange;
import ca.gc.nrc.pyxis.domain.dataset.NdArray;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Reusable chunk loop: read a chunk, transform it, write the result, move on.
 * <p><strong>Why:</strong> Keeps memory bounded by the chunk size no matter how many frames a dataset holds.</p>
 * <p><strong>Role:</strong> Helper used by processing and writing modules.</p>
 * <p><strong>Thread-safety:</strong> Not thread-safe.</p>
 *
 * <p>When input and output name the same dataset, results are written back in place and must keep the chunk's
 * frame count; otherwise results are appended.</p>
 *
 * @since 0.1.0
 */
public final class FrameStreamer {
  private static final Logger log = LoggerFactory.getLogger(FrameStreamer.class);

  /** Transforms a block of consecutive frames. */
  @FunctionalInterface
  public interface BlockTransform {
    /**
     * Transforms a chunk.
     *
     * @param range position of the chunk in the input
     * @param block frames of the chunk
     * @return frames to write
     * @throws Exception any failure, aborting the loop
     */
    NdArray apply(FrameRange range, NdArray block) throws Exception;
  }

  /** Transforms one frame. */
  @FunctionalInterface
  public interface FrameTransform {
    /**
     * Transforms a frame.
     *
     * @param index frame index in the input
     * @param frame the frame, with a frame count of one
     * @return replacement frame with a frame count of one
     * @throws Exception any failure, aborting the loop
     */
    NdArray apply(long index, NdArray frame) throws Exception;
  }

  /** Consumes a block without writing anything back. */
  @FunctionalInterface
  public interface BlockConsumer {
    void accept(FrameRange range, NdArray block) throws Exception;
  }

  private final DatasetPort input;
  private final int framesPerChunk;

  /**
   * Creates a streamer over {@code input}.
   *
   * @param input dataset to stream
   * @param framesPerChunk frames per chunk; {@code 0} means all frames at once
   */
  public FrameStreamer(DatasetPort input, int framesPerChunk) {
    this.input = Objects.requireNonNull(input, "input");
    if (framesPerChunk < 0) {
      throw new IllegalArgumentException("framesPerChunk must not be negative");
    }
    this.framesPerChunk = framesPerChunk;
  }

  /**
   * Chunks this streamer will visit.
   *
   * @return planned ranges
   */
  public List<FrameRange> plan() {
    return FrameChunks.plan(input.frameCount(), framesPerChunk);
  }

  /**
   * Visits every chunk.
   *
   * @param consumer chunk consumer
   * @return frames visited
   * @throws Exception when the consumer fails
   */
  public long forEachBlock(BlockConsumer consumer) throws Exception {
    long frames = 0;
    for (FrameRange range : plan()) {
      consumer.accept(range, input.read(range));
      frames += range.length();
    }
    return frames;
  }

  /**
   * Transforms every chunk and writes the results to {@code output}.
   *
   * @param output destination
   * @param transform chunk transform
   * @return frames written
   * @throws Exception when the transform or a write fails
   */
  public long mapBlocks(OutputPort output, BlockTransform transform) throws Exception {
    Objects.requireNonNull(output, "output");
    boolean inPlace = output.tag().equals(input.tag());
    List<FrameRange> ranges = plan();
    long written = 0;
    for (FrameRange range : ranges) {
      NdArray result = transform.apply(range, input.read(range));
      if (inPlace) {
        if (result.frames() != range.length()) {
          throw new IllegalStateException("In-place transform of " + range + " on '" + input.tag()
              + "' returned " + result.frames() + " frames");
        }
        output.write(range, result);
      } else {
        output.append(result);
      }
      written += result.frames();
    }
    log.debug("Streamed {} chunks of '{}' into '{}'", ranges.size(), input.tag(), output.tag());
    return written;
  }

  /**
   * Transforms every frame and writes the results to {@code output}, chunk by chunk.
   *
   * @param output destination
   * @param transform per-frame transform
   * @return frames written
   * @throws Exception when the transform or a write fails
   */
  public long mapFrames(OutputPort output, FrameTransform transform) throws Exception {
    return mapBlocks(output, (range, block) -> {
      List<NdArray> frames = new ArrayList<>((int) block.frames());
      for (long i = 0; i < block.frames(); i++) {
        frames.add(transform.apply(range.start() + i, block.frame(i)));
      }
      return NdArray.concat(frames);
    });
  }
}
