package ca.gc.nrc.pyxis.infrastructure.storage;

import ca.gc.nrc.pyxis.domain.attribute.AttributeArray;
import ca.gc.nrc.pyxis.domain.attribute.AttributeValue;
import ca.gc.nrc.pyxis.domain.dataset.DataType;
import ca.gc.nrc.pyxis.domain.dataset.Shape;
import ca.gc.nrc.pyxis.domain.error.StorageException;
import java.util.LinkedHashMap;
import java.util.Map;
import org.janelia.saalfeldlab.n5.DatasetAttributes;
import org.janelia.saalfeldlab.n5.RawCompression;

/**
 * Open dataset of an {@link N5ContainerStorage}: N5 layout plus the attributes held until the next flush.
 *
 * <p>N5 orders dimensions fastest first, so a dataset of shape {@code [frames, d1, .., dn]} is stored with
 * dimensions {@code [dn, .., d1, frames]}. Blocks span whole frames and hold {@link #blockFrames} of them,
 * which keeps the flat block data in frame-major order.</p>
 */
final class DatasetEntry {
  /** Target size of one block. */
  static final long BLOCK_BYTES = 16L * 1024L * 1024L;
  /** Upper bound on frames per block for very small frames. */
  static final int MAX_BLOCK_FRAMES = 1024;

  final String tag;
  final String path;
  final DataType type;
  final long[] frameDims;
  final int blockFrames;
  final Map<String, AttributeValue> statics = new LinkedHashMap<>();
  final Map<String, AttributeArray> nonStatics = new LinkedHashMap<>();
  private DatasetAttributes attributes;

  private DatasetEntry(String tag, DataType type, long[] frameDims, int blockFrames, long frames) {
    this.tag = tag;
    this.path = "/" + tag;
    this.type = type;
    this.frameDims = frameDims.clone();
    this.blockFrames = blockFrames;
    this.attributes = layout(frames);
  }

  /** Layout for a new dataset; block depth follows the frame size. */
  static DatasetEntry create(String tag, DataType type, long[] frameDims, long frames) {
    long frameBytes = frameElements(frameDims) * type.byteSize();
    long fit = frameBytes == 0 ? MAX_BLOCK_FRAMES : BLOCK_BYTES / frameBytes;
    int blockFrames = (int) Math.max(1, Math.min(MAX_BLOCK_FRAMES, fit));
    if ((long) blockFrames * frameElements(frameDims) > Integer.MAX_VALUE) {
      throw new StorageException("Frames of dataset '" + tag + "' are too large for one block");
    }
    return new DatasetEntry(tag, type, frameDims, blockFrames, frames);
  }

  /** Rebuilds an entry from the attributes N5 holds for an existing dataset. */
  static DatasetEntry fromN5(String tag, DatasetAttributes stored) {
    long[] dims = stored.getDimensions();
    int[] blockSize = stored.getBlockSize();
    if (dims.length == 0) {
      throw new StorageException("Dataset '" + tag + "' has no frame axis");
    }
    int last = dims.length - 1;
    long[] frameDims = new long[last];
    for (int i = 0; i < last; i++) {
      frameDims[i] = dims[last - 1 - i];
      if (blockSize[last - 1 - i] != dims[last - 1 - i]) {
        throw new StorageException("Dataset '" + tag + "' has blocks that split frames");
      }
    }
    return new DatasetEntry(tag, fromN5(tag, stored.getDataType()), frameDims, blockSize[last], dims[last]);
  }

  DatasetAttributes attributes() {
    return attributes;
  }

  long frames() {
    long[] dims = attributes.getDimensions();
    return dims[dims.length - 1];
  }

  /**
   * Moves the frame axis to a new length.
   *
   * @return N5 dimensions after the change
   */
  long[] resize(long frames) {
    attributes = layout(frames);
    return attributes.getDimensions();
  }

  Shape shape() {
    return Shape.ofFrames(frames(), frameDims);
  }

  int frameElements() {
    return Math.toIntExact(frameElements(frameDims));
  }

  long[] gridPosition(long block) {
    long[] position = new long[frameDims.length + 1];
    position[frameDims.length] = block;
    return position;
  }

  /** Block size of the given block, shortened at the end of the frame axis. */
  int[] blockSize(long block) {
    int[] size = attributes.getBlockSize().clone();
    size[frameDims.length] = (int) Math.min(blockFrames, frames() - block * blockFrames);
    return size;
  }

  private DatasetAttributes layout(long frames) {
    int n = frameDims.length;
    long[] dims = new long[n + 1];
    int[] blockSize = new int[n + 1];
    for (int i = 0; i < n; i++) {
      dims[i] = frameDims[n - 1 - i];
      blockSize[i] = Math.toIntExact(frameDims[n - 1 - i]);
    }
    dims[n] = frames;
    blockSize[n] = blockFrames;
    return new DatasetAttributes(dims, blockSize, toN5(type), new RawCompression());
  }

  private static long frameElements(long[] frameDims) {
    long size = 1;
    for (long dim : frameDims) {
      size = Math.multiplyExact(size, dim);
    }
    return size;
  }

  static org.janelia.saalfeldlab.n5.DataType toN5(DataType type) {
    return switch (type) {
      case INT16 -> org.janelia.saalfeldlab.n5.DataType.INT16;
      case INT32 -> org.janelia.saalfeldlab.n5.DataType.INT32;
      case INT64 -> org.janelia.saalfeldlab.n5.DataType.INT64;
      case FLOAT32 -> org.janelia.saalfeldlab.n5.DataType.FLOAT32;
      case FLOAT64 -> org.janelia.saalfeldlab.n5.DataType.FLOAT64;
    };
  }

  private static DataType fromN5(String tag, org.janelia.saalfeldlab.n5.DataType type) {
    return switch (type) {
      case INT16 -> DataType.INT16;
      case INT32 -> DataType.INT32;
      case INT64 -> DataType.INT64;
      case FLOAT32 -> DataType.FLOAT32;
      case FLOAT64 -> DataType.FLOAT64;
      default -> throw new StorageException("Dataset '" + tag + "' has unsupported element type " + type);
    };
  }
}
