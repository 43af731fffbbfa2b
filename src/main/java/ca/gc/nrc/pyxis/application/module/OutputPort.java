package ca.gc.nrc.pyxis.application.module;

import ca.gc.nrc.pyxis.application.port.DataStoragePort;
import ca.gc.nrc.pyxis.domain.attribute.AttributeArray;
import ca.gc.nrc.pyxis.domain.attribute.AttributeValue;
import ca.gc.nrc.pyxis.domain.attribute.StandardAttributes;
import ca.gc.nrc.pyxis.domain.dataset.DataType;
import ca.gc.nrc.pyxis.domain.dataset.FrameRange;
import ca.gc.nrc.pyxis.domain.dataset.NdArray;
import ca.gc.nrc.pyxis.domain.dataset.Shape;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * <strong>What:</strong> Writable handle on a dataset a module produces.
 * <p><strong>Why:</strong> Outputs are created lazily from the first chunk, so modules never pre-compute output
 * shapes, and stale datasets from earlier runs are replaced rather than appended to.</p>
 * <p><strong>Role:</strong> Created by the pipeline for each declared output of a reading or processing module.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Create the dataset on first {@link #append(NdArray)} or {@link #set(NdArray)}, inferring frame shape.</li>
 *   <li>Replace a pre-existing dataset on first write unless the tag is also an input of the module.</li>
 *   <li>Track frames and bytes written and the attribute keys the module set.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Not thread-safe.</p>
 *
 * @since 0.1.0
 */
public final class OutputPort extends DatasetPort {
  private final DataType dataType;
  private final boolean alsoInput;
  private final AttributeSnapshot inputSnapshot;
  private final Set<String> staticKeysSet = new LinkedHashSet<>();
  private final Set<String> nonStaticKeysSet = new LinkedHashSet<>();
  private boolean replacementDone;
  private long framesWritten;
  private long bytesWritten;

  /**
   * Creates an output port. No dataset is created until data is written.
   *
   * @param moduleName owning module
   * @param role output role
   * @param tag dataset tag
   * @param storage central storage
   * @param dataType element type used when the dataset is created
   * @param alsoInput whether the tag is also an input of the module (in-place update); the input's attributes
   *     are then captured before the module runs
   */
  public OutputPort(String moduleName, String role, String tag, DataStoragePort storage, DataType dataType,
      boolean alsoInput) {
    super(moduleName, role, tag, storage);
    this.dataType = Objects.requireNonNull(dataType, "dataType");
    this.alsoInput = alsoInput;
    this.inputSnapshot = alsoInput && storage.hasDataset(tag) ? AttributeSnapshot.capture(storage, tag) : null;
  }

  public boolean exists() {
    return storage.hasDataset(tag());
  }

  /**
   * Appends frames, creating the dataset from the chunk's frame shape if needed.
   *
   * @param frames frames to append
   */
  public void append(NdArray frames) {
    Objects.requireNonNull(frames, "frames");
    replaceStaleDataset();
    if (!storage.hasDataset(tag())) {
      storage.createDataset(tag(), frames.shape().withFrames(0), dataType);
    }
    storage.appendFrames(tag(), frames);
    account(frames);
  }

  /**
   * Replaces the whole dataset content. When the tag is also a module input, static attributes survive and
   * non-static attributes survive if the frame count is unchanged.
   *
   * @param frames new content
   */
  public void set(NdArray frames) {
    Objects.requireNonNull(frames, "frames");
    replaceStaleDataset();
    Map<String, AttributeValue> keptStatic = new LinkedHashMap<>();
    Map<String, AttributeArray> keptNonStatic = new LinkedHashMap<>();
    DataType type = dataType;
    if (storage.hasDataset(tag())) {
      type = storage.dataType(tag());
      long oldFrames = storage.shape(tag()).frames();
      for (String key : storage.staticAttributeKeys(tag())) {
        storage.staticAttribute(tag(), key).ifPresent(v -> keptStatic.put(key, v));
      }
      if (oldFrames == frames.frames()) {
        for (String key : storage.nonStaticAttributeKeys(tag())) {
          storage.nonStaticAttribute(tag(), key).ifPresent(v -> keptNonStatic.put(key, v));
        }
      }
      storage.deleteDataset(tag());
    }
    storage.createDataset(tag(), frames.shape().withFrames(0), type);
    storage.appendFrames(tag(), frames);
    keptStatic.forEach((k, v) -> storage.setStaticAttribute(tag(), k, v));
    keptNonStatic.forEach((k, v) -> storage.setNonStaticAttribute(tag(), k, v));
    account(frames);
  }

  /**
   * Overwrites existing frames in place.
   *
   * @param range frames to overwrite
   * @param frames replacement frames
   */
  public void write(FrameRange range, NdArray frames) {
    storage.writeSlice(tag(), range, frames);
    account(frames);
  }

  public void setStaticAttribute(String key, AttributeValue value) {
    storage.setStaticAttribute(tag(), key, value);
    staticKeysSet.add(key);
  }

  public void setStaticAttribute(String key, String value) {
    setStaticAttribute(key, AttributeValue.text(value));
  }

  public void setStaticAttribute(String key, long value) {
    setStaticAttribute(key, AttributeValue.integer(value));
  }

  public void setStaticAttribute(String key, double value) {
    setStaticAttribute(key, AttributeValue.real(value));
  }

  public void setNonStaticAttribute(String key, AttributeArray values) {
    storage.setNonStaticAttribute(tag(), key, values);
    nonStaticKeysSet.add(key);
  }

  /**
   * Records a history entry under {@code History: <module name>}.
   *
   * @param text description of what the module did
   */
  public void addHistory(String text) {
    setStaticAttribute(StandardAttributes.historyKey(moduleName()), text);
  }

  /**
   * Static attribute of this output only, without the settings fallback.
   *
   * @param key attribute key
   * @return value when set on the dataset
   */
  public Optional<AttributeValue> ownStaticAttribute(String key) {
    return storage.staticAttribute(tag(), key);
  }

  public DataType dataType() {
    return dataType;
  }

  public boolean alsoInput() {
    return alsoInput;
  }

  /**
   * Attributes the dataset had before the module ran, when the module writes back to its own input.
   *
   * @return snapshot taken at binding time
   */
  public Optional<AttributeSnapshot> inputSnapshot() {
    return Optional.ofNullable(inputSnapshot);
  }

  public long framesWritten() {
    return framesWritten;
  }

  public long bytesWritten() {
    return bytesWritten;
  }

  /**
   * Static keys set through this port during the current run.
   *
   * @return keys in the order they were set
   */
  public Set<String> staticKeysSet() {
    return Collections.unmodifiableSet(staticKeysSet);
  }

  public Set<String> nonStaticKeysSet() {
    return Collections.unmodifiableSet(nonStaticKeysSet);
  }

  private void replaceStaleDataset() {
    if (replacementDone) {
      return;
    }
    replacementDone = true;
    if (!alsoInput && storage.hasDataset(tag())) {
      storage.deleteDataset(tag());
      staticKeysSet.clear();
      nonStaticKeysSet.clear();
    }
  }

  private void account(NdArray frames) {
    framesWritten += frames.frames();
    Shape shape = storage.shape(tag());
    bytesWritten += frames.frames() * shape.frameSize() * storage.dataType(tag()).byteSize();
  }
}
