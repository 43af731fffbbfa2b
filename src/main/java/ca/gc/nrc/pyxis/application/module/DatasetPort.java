package ca.gc.nrc.pyxis.application.module;

import ca.gc.nrc.pyxis.application.port.DataStoragePort;
import ca.gc.nrc.pyxis.domain.attribute.AttributeArray;
import ca.gc.nrc.pyxis.domain.attribute.AttributeValue;
import ca.gc.nrc.pyxis.domain.dataset.FrameRange;
import ca.gc.nrc.pyxis.domain.dataset.NdArray;
import ca.gc.nrc.pyxis.domain.dataset.Shape;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Read access to one dataset on behalf of one module. Ports hold no data; every call goes to storage.
 *
 * @since 0.1.0
 */
public abstract class DatasetPort {
  private final String moduleName;
  private final String role;
  private final String tag;
  final DataStoragePort storage;

  DatasetPort(String moduleName, String role, String tag, DataStoragePort storage) {
    this.moduleName = Objects.requireNonNull(moduleName, "moduleName");
    this.role = Objects.requireNonNull(role, "role");
    this.tag = Objects.requireNonNull(tag, "tag");
    this.storage = Objects.requireNonNull(storage, "storage");
  }

  public String moduleName() {
    return moduleName;
  }

  public String role() {
    return role;
  }

  public String tag() {
    return tag;
  }

  public Shape shape() {
    return storage.shape(tag);
  }

  public long frameCount() {
    return storage.shape(tag).frames();
  }

  /**
   * Bytes one frame occupies once decoded into memory.
   *
   * @return in-memory frame size
   */
  public long frameBytesInMemory() {
    return storage.shape(tag).frameSize() * Double.BYTES;
  }

  /**
   * Reads a frame range.
   *
   * @param range frames to read
   * @return frames in memory
   */
  public NdArray read(FrameRange range) {
    return storage.readSlice(tag, range);
  }

  public NdArray readFrame(long index) {
    return storage.readSlice(tag, FrameRange.single(index));
  }

  /**
   * Reads the whole dataset. Prefer chunked reads; this warns above the memory budget.
   *
   * @return every frame
   */
  public NdArray readAll() {
    return storage.readAll(tag);
  }

  /**
   * Static attribute of the dataset, falling back to the pipeline settings when the dataset lacks the key.
   *
   * @param key attribute key
   * @return value, empty when neither the dataset nor the settings define it
   */
  public Optional<AttributeValue> staticAttribute(String key) {
    Optional<AttributeValue> own = storage.staticAttribute(tag, key);
    if (own.isPresent()) {
      return own;
    }
    return Optional.ofNullable(storage.settings().get(key));
  }

  /**
   * Per-frame attribute of the dataset.
   *
   * @param key attribute key
   * @return values aligned with the frames, empty when absent
   * @throws ca.gc.nrc.pyxis.domain.error.AttributeAlignmentException when misaligned with the frame count
   */
  public Optional<AttributeArray> nonStaticAttribute(String key) {
    return storage.nonStaticAttribute(tag, key);
  }

  public Set<String> staticAttributeKeys() {
    return storage.staticAttributeKeys(tag);
  }

  public Set<String> nonStaticAttributeKeys() {
    return storage.nonStaticAttributeKeys(tag);
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + "[" + moduleName + "." + role + " -> " + tag + "]";
  }
}
