package ca.gc.nrc.pyxis.application.module;

import ca.gc.nrc.pyxis.application.port.DataStoragePort;
import ca.gc.nrc.pyxis.domain.attribute.AttributeArray;
import ca.gc.nrc.pyxis.domain.attribute.AttributeValue;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Attributes and frame count of a dataset as they were when captured.
 *
 * <p>Taken before a module that writes back to one of its inputs runs, so attribute propagation still sees the
 * input's per-frame values after the module replaced the dataset.</p>
 *
 * @param tag dataset tag
 * @param frames frame count at capture time
 * @param statics static attributes in storage order
 * @param nonStatics per-frame attributes in storage order
 * @since 0.1.0
 */
public record AttributeSnapshot(String tag, long frames, Map<String, AttributeValue> statics,
    Map<String, AttributeArray> nonStatics) {

  public AttributeSnapshot {
    Objects.requireNonNull(tag, "tag");
    statics = Collections.unmodifiableMap(new LinkedHashMap<>(statics));
    nonStatics = Collections.unmodifiableMap(new LinkedHashMap<>(nonStatics));
  }

  /**
   * Reads every attribute of {@code tag} from storage.
   *
   * @param storage central storage
   * @param tag existing dataset
   * @return snapshot of the dataset's current attributes
   */
  public static AttributeSnapshot capture(DataStoragePort storage, String tag) {
    Map<String, AttributeValue> statics = new LinkedHashMap<>();
    for (String key : storage.staticAttributeKeys(tag)) {
      storage.staticAttribute(tag, key).ifPresent(v -> statics.put(key, v));
    }
    Map<String, AttributeArray> nonStatics = new LinkedHashMap<>();
    for (String key : storage.nonStaticAttributeKeys(tag)) {
      storage.nonStaticAttribute(tag, key).ifPresent(v -> nonStatics.put(key, v));
    }
    return new AttributeSnapshot(tag, storage.shape(tag).frames(), statics, nonStatics);
  }
}
