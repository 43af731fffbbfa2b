package ca.gc.nrc.pyxis.domain.error;

/**
 * <strong>What:</strong> Root of the PYXIS failure taxonomy.
 * <p><strong>Why:</strong> Lets CLI entry points and tests catch engine failures as one family while
 * subclasses keep the error kind explicit.</p>
 * <p><strong>Role:</strong> Domain exception shared by storage, ports, modules, and the orchestrator.</p>
 * <p><strong>Thread-safety:</strong> Immutable once constructed.</p>
 *
 * @since 0.1.0
 */
public class PyxisException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  /**
   * Creates an exception with a diagnostic message.
   *
   * @param message description naming the module, tag, or key involved
   */
  public PyxisException(String message) {
    super(message);
  }

  /**
   * Creates an exception with a diagnostic message and root cause.
   *
   * @param message description naming the module, tag, or key involved
   * @param cause underlying failure
   */
  public PyxisException(String message, Throwable cause) {
    super(message, cause);
  }

  /**
   * Short, stable name of the error kind used in logs and CLI output.
   *
   * @return error kind label
   */
  public String kind() {
    return getClass().getSimpleName();
  }
}
