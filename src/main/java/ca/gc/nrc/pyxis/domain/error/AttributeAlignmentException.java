package ca.gc.nrc.pyxis.domain.error;

import java.util.Optional;

/**
 * Raised when a non-static attribute does not have one entry per frame of its dataset.
 *
 * @since 0.1.0
 */
public final class AttributeAlignmentException extends PyxisException {
  private static final long serialVersionUID = 1L;

  private final String moduleName;
  private final String tag;
  private final String key;
  private final long attributeLength;
  private final long frameCount;

  /**
   * Creates an alignment failure.
   *
   * @param tag dataset tag
   * @param key attribute key
   * @param attributeLength stored attribute length
   * @param frameCount current frame count of the dataset
   */
  public AttributeAlignmentException(String tag, String key, long attributeLength, long frameCount) {
    super("Non-static attribute '" + key + "' of dataset '" + tag + "' has " + attributeLength
        + " entries but the dataset has " + frameCount + " frames");
    this.moduleName = null;
    this.tag = tag;
    this.key = key;
    this.attributeLength = attributeLength;
    this.frameCount = frameCount;
  }

  /**
   * Creates an alignment failure found while a module's attributes were propagated to its output.
   *
   * @param moduleName module whose output is misaligned
   * @param tag output dataset tag
   * @param key attribute key
   * @param attributeLength entries the propagated attribute would have
   * @param frameCount frame count of the output
   */
  public AttributeAlignmentException(String moduleName, String tag, String key, long attributeLength,
      long frameCount) {
    super("Module '" + moduleName + "' cannot propagate non-static attribute '" + key + "' to dataset '" + tag
        + "': " + attributeLength + " entries for " + frameCount + " frames");
    this.moduleName = moduleName;
    this.tag = tag;
    this.key = key;
    this.attributeLength = attributeLength;
    this.frameCount = frameCount;
  }

  /**
   * Module that triggered the failure.
   *
   * @return module name, empty when the failure came straight from storage
   */
  public Optional<String> moduleName() {
    return Optional.ofNullable(moduleName);
  }

  public String tag() {
    return tag;
  }

  public String key() {
    return key;
  }

  public long attributeLength() {
    return attributeLength;
  }

  public long frameCount() {
    return frameCount;
  }
}
