package ca.gc.nrc.pyxis.domain.error;

/**
 * Raised when a protected static attribute would be overwritten with a different value.
 *
 * @since 0.1.0
 */
public final class AttributeConflictException extends PyxisException {
  private static final long serialVersionUID = 1L;

  private final String tag;
  private final String key;

  /**
   * Creates a conflict failure.
   *
   * @param tag dataset tag
   * @param key protected attribute key
   * @param existing value currently stored
   * @param attempted value that was rejected
   */
  public AttributeConflictException(String tag, String key, Object existing, Object attempted) {
    super("Protected attribute '" + key + "' of dataset '" + tag + "' is " + existing
        + "; refusing to overwrite with " + attempted);
    this.tag = tag;
    this.key = key;
  }

  public String tag() {
    return tag;
  }

  public String key() {
    return key;
  }
}
