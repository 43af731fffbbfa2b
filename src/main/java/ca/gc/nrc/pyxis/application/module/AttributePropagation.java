package ca.gc.nrc.pyxis.application.module;

import ca.gc.nrc.pyxis.application.port.DataStoragePort;
import ca.gc.nrc.pyxis.domain.attribute.AttributeArray;
import ca.gc.nrc.pyxis.domain.attribute.AttributeValue;
import ca.gc.nrc.pyxis.domain.error.AttributeAlignmentException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * <strong>What:</strong> Copies attributes from a module's primary input onto its outputs.
 * <p><strong>Why:</strong> Observation metadata must follow the frames through every processing step; per-frame
 * values must be subset exactly like the frames when a module keeps only some of them.</p>
 * <p><strong>Role:</strong> Applied by the pipeline after a processing module finished.</p>
 * <p><strong>Thread-safety:</strong> Stateless.</p>
 *
 * <p>Keys the module already set on the destination are left untouched. Per-frame attributes that cannot be
 * aligned with the destination's frames fail the module with an {@link AttributeAlignmentException}.</p>
 *
 * @since 0.1.0
 */
public final class AttributePropagation {

  private AttributePropagation() {}

  /**
   * Copies all static and non-static attributes from {@code src} onto {@code dst}.
   *
   * @param storage central storage
   * @param moduleName module whose output is being completed
   * @param src source tag
   * @param dst destination tag
   * @param keepStatic static keys on {@code dst} that must not be overwritten
   * @param keepNonStatic non-static keys on {@code dst} that must not be overwritten
   * @throws AttributeAlignmentException when {@code src} has per-frame attributes to copy and the frame counts
   *     differ
   */
  public static void copy(DataStoragePort storage, String moduleName, String src, String dst,
      Set<String> keepStatic, Set<String> keepNonStatic) {
    if (src.equals(dst)) {
      return;
    }
    AttributeSnapshot source = AttributeSnapshot.capture(storage, src);
    copyStatic(storage, source, dst, keepStatic);
    long dstFrames = storage.shape(dst).frames();
    List<String> keys = new ArrayList<>(source.nonStatics().keySet());
    keys.removeAll(keepNonStatic);
    if (keys.isEmpty()) {
      return;
    }
    if (source.frames() != dstFrames) {
      throw new AttributeAlignmentException(moduleName, dst, keys.get(0), source.frames(), dstFrames);
    }
    for (String key : keys) {
      storage.setNonStaticAttribute(dst, key, source.nonStatics().get(key));
    }
  }

  /**
   * Copies static attributes and subsets every non-static attribute of {@code src} by {@code indices}.
   *
   * @param storage central storage
   * @param moduleName module whose output is being completed
   * @param src source tag
   * @param dst destination tag
   * @param indices source frame indices kept, in destination order
   * @param keepStatic static keys on {@code dst} that must not be overwritten
   * @param keepNonStatic non-static keys on {@code dst} that must not be overwritten
   * @throws AttributeAlignmentException when the selection length differs from the destination frame count
   */
  public static void restrict(DataStoragePort storage, String moduleName, String src, String dst, int[] indices,
      Set<String> keepStatic, Set<String> keepNonStatic) {
    restrict(storage, moduleName, AttributeSnapshot.capture(storage, src), dst, indices, keepStatic, keepNonStatic);
  }

  /**
   * Restricts attributes captured before the module ran; used when the module replaced its own input.
   *
   * @param storage central storage
   * @param moduleName module whose output is being completed
   * @param source attributes of the primary input
   * @param dst destination tag, possibly the source's own tag
   * @param indices source frame indices kept, in destination order
   * @param keepStatic static keys on {@code dst} that must not be overwritten
   * @param keepNonStatic non-static keys on {@code dst} that must not be overwritten
   * @throws AttributeAlignmentException when the selection length differs from the destination frame count
   */
  public static void restrict(DataStoragePort storage, String moduleName, AttributeSnapshot source, String dst,
      int[] indices, Set<String> keepStatic, Set<String> keepNonStatic) {
    copyStatic(storage, source, dst, keepStatic);
    long dstFrames = storage.shape(dst).frames();
    List<String> keys = new ArrayList<>(source.nonStatics().keySet());
    keys.removeAll(keepNonStatic);
    if (keys.isEmpty()) {
      return;
    }
    if (indices.length != dstFrames) {
      throw new AttributeAlignmentException(moduleName, dst, keys.get(0), indices.length, dstFrames);
    }
    List<AttributeArray> subsets = new ArrayList<>(keys.size());
    for (String key : keys) {
      subsets.add(source.nonStatics().get(key).select(indices));
    }
    for (int i = 0; i < keys.size(); i++) {
      storage.setNonStaticAttribute(dst, keys.get(i), subsets.get(i));
    }
  }

  /**
   * Copies static attributes only; {@code dst} keeps no non-static attributes the module did not set.
   *
   * @param storage central storage
   * @param src source tag
   * @param dst destination tag
   * @param keepStatic static keys on {@code dst} that must not be overwritten
   * @param keepNonStatic non-static keys on {@code dst} that survive the drop
   */
  public static void copyStaticDropNonStatic(DataStoragePort storage, String src, String dst,
      Set<String> keepStatic, Set<String> keepNonStatic) {
    if (!src.equals(dst)) {
      copyStatic(storage, AttributeSnapshot.capture(storage, src), dst, keepStatic);
    }
    dropNonStatic(storage, dst, keepNonStatic);
  }

  /**
   * Removes every non-static attribute of {@code tag} except {@code keep}.
   *
   * @param storage central storage
   * @param tag dataset tag
   * @param keep keys to retain
   */
  public static void dropNonStatic(DataStoragePort storage, String tag, Set<String> keep) {
    for (String key : List.copyOf(storage.nonStaticAttributeKeys(tag))) {
      if (!keep.contains(key)) {
        storage.deleteNonStaticAttribute(tag, key);
      }
    }
  }

  private static void copyStatic(DataStoragePort storage, AttributeSnapshot source, String dst,
      Set<String> keepStatic) {
    for (Map.Entry<String, AttributeValue> entry : source.statics().entrySet()) {
      if (!keepStatic.contains(entry.getKey())) {
        storage.setStaticAttribute(dst, entry.getKey(), entry.getValue());
      }
    }
  }
}
