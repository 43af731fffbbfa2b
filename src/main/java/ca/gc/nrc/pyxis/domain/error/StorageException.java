package ca.gc.nrc.pyxis.domain.error;

/**
 * Raised by the central data storage for I/O failures, unknown tags, shape or type mismatches,
 * out-of-bounds slices, corrupt containers, and lock contention.
 *
 * @since 0.1.0
 */
public class StorageException extends PyxisException {
  private static final long serialVersionUID = 1L;

  /**
   * Creates a storage exception.
   *
   * @param message description including the dataset tag when known
   */
  public StorageException(String message) {
    super(message);
  }

  /**
   * Creates a storage exception wrapping an underlying cause.
   *
   * @param message description including the dataset tag when known
   * @param cause underlying failure, typically an {@link java.io.IOException}
   */
  public StorageException(String message, Throwable cause) {
    super(message, cause);
  }
}
