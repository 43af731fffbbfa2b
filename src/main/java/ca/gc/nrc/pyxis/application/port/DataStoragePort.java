package ca.gc.nrc.pyxis.application.port;

import ca.gc.nrc.pyxis.domain.attribute.AttributeArray;
import ca.gc.nrc.pyxis.domain.attribute.AttributeValue;
import ca.gc.nrc.pyxis.domain.dataset.DataType;
import ca.gc.nrc.pyxis.domain.dataset.FrameRange;
import ca.gc.nrc.pyxis.domain.dataset.NdArray;
import ca.gc.nrc.pyxis.domain.dataset.Shape;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * <strong>What:</strong> Port over the central data store holding every dataset of a pipeline.
 * <p><strong>Why:</strong> Frame stacks are far larger than memory; all module I/O goes through frame-range
 * reads and writes against one container so intermediate results persist between modules.</p>
 * <p><strong>Role:</strong> Port implemented by {@code N5ContainerStorage}; owned by the pipeline and handed
 * to modules only through input and output ports.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Create, grow, slice, and delete typed N-dimensional datasets keyed by tag.</li>
 *   <li>Hold static (scalar) and non-static (per-frame) attributes per dataset.</li>
 *   <li>Persist a pipeline-wide settings snapshot next to the datasets.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Not thread-safe; a pipeline drives storage from a single thread.</p>
 * <p><strong>Observability:</strong> Failures surface as {@link ca.gc.nrc.pyxis.domain.error.StorageException}
 * naming the tag or path involved.</p>
 *
 * @since 0.1.0
 */
public interface DataStoragePort extends AutoCloseable {

  /**
   * Location of the backing container.
   *
   * @return container path
   */
  Path path();

  /**
   * Opens the container if it is not open yet. Every other operation opens implicitly.
   *
   * @throws ca.gc.nrc.pyxis.domain.error.StorageException when the container cannot be created, is corrupt, or
   *     is locked by another pipeline
   */
  void open();

  boolean isOpen();

  boolean hasDataset(String tag);

  /**
   * Lists dataset tags in creation order.
   *
   * @return dataset tags
   */
  List<String> tags();

  /**
   * Creates a dataset. A non-zero frame count allocates zero-filled frames.
   *
   * @param tag dataset tag; must not already exist
   * @param shape initial shape, frame axis first
   * @param type on-disk element type
   */
  void createDataset(String tag, Shape shape, DataType type);

  Shape shape(String tag);

  DataType dataType(String tag);

  /**
   * Reads frames {@code [range.start, range.end)}.
   *
   * @param tag dataset tag
   * @param range frame range within the dataset
   * @return frames as an array shaped {@code [range.length, frameDims...]}
   */
  NdArray readSlice(String tag, FrameRange range);

  /**
   * Reads the whole dataset into memory. Logs a warning when the dataset exceeds the memory budget.
   *
   * @param tag dataset tag
   * @return every frame of the dataset
   */
  NdArray readAll(String tag);

  /**
   * Overwrites existing frames starting at {@code range.start}.
   *
   * @param tag dataset tag
   * @param range frames to overwrite; its length must equal the array's frame count
   * @param array replacement frames with the dataset's frame shape
   */
  void writeSlice(String tag, FrameRange range, NdArray array);

  /**
   * Appends frames to the end of the frame axis.
   *
   * @param tag dataset tag
   * @param array frames with the dataset's frame shape
   */
  void appendFrames(String tag, NdArray array);

  /**
   * Removes a dataset with all of its attributes.
   *
   * @param tag dataset tag
   * @return {@code true} when the dataset existed
   */
  boolean deleteDataset(String tag);

  Optional<AttributeValue> staticAttribute(String tag, String key);

  /**
   * Sets a static attribute, overwriting silently unless the key is protected.
   *
   * @param tag dataset tag
   * @param key attribute key
   * @param value new value
   * @throws ca.gc.nrc.pyxis.domain.error.AttributeConflictException when a protected key already holds a
   *     different value
   */
  void setStaticAttribute(String tag, String key, AttributeValue value);

  /**
   * Reads a per-frame attribute.
   *
   * @param tag dataset tag
   * @param key attribute key
   * @return attribute values, empty when the key is absent
   * @throws ca.gc.nrc.pyxis.domain.error.AttributeAlignmentException when the stored length differs from the
   *     current frame count
   */
  Optional<AttributeArray> nonStaticAttribute(String tag, String key);

  /**
   * Sets a per-frame attribute.
   *
   * @param tag dataset tag
   * @param key attribute key
   * @param values one value per frame
   * @throws ca.gc.nrc.pyxis.domain.error.AttributeAlignmentException when the length differs from the frame count
   */
  void setNonStaticAttribute(String tag, String key, AttributeArray values);

  Set<String> staticAttributeKeys(String tag);

  Set<String> nonStaticAttributeKeys(String tag);

  boolean deleteStaticAttribute(String tag, String key);

  boolean deleteNonStaticAttribute(String tag, String key);

  /**
   * Pipeline-wide settings persisted with the container.
   *
   * @return settings snapshot keyed by setting name
   */
  Map<String, AttributeValue> settings();

  /**
   * Replaces the persisted settings snapshot.
   *
   * @param settings new settings
   */
  void writeSettings(Map<String, AttributeValue> settings);

  /**
   * Persists attributes, settings and the dataset list so a reopen sees every change made so far.
   */
  void flush();

  /**
   * Flushes and releases the container lock. Idempotent.
   */
  @Override
  void close();
}
