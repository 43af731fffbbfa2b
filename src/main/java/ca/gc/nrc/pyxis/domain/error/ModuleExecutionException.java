package ca.gc.nrc.pyxis.domain.error;

/**
 * Raised by the orchestrator when a module fails during its run; the pipeline halts afterwards.
 *
 * <p>The cause carries the original error kind. Partial outputs of the failing module remain in
 * storage.</p>
 *
 * @since 0.1.0
 */
public final class ModuleExecutionException extends PyxisException {
  private static final long serialVersionUID = 1L;

  private final String moduleName;

  /**
   * Creates an execution failure.
   *
   * @param moduleName failing module
   * @param cause original failure
   */
  public ModuleExecutionException(String moduleName, Throwable cause) {
    super("Pipeline module '" + moduleName + "' failed with " + describe(cause), cause);
    this.moduleName = moduleName;
  }

  /**
   * Creates an execution failure without an underlying exception.
   *
   * @param moduleName failing module
   * @param message description of the broken contract
   */
  public ModuleExecutionException(String moduleName, String message) {
    super("Pipeline module '" + moduleName + "' failed: " + message);
    this.moduleName = moduleName;
  }

  public String moduleName() {
    return moduleName;
  }

  /**
   * Error kind of the underlying cause, or this exception's own kind when there is none.
   *
   * @return error kind label
   */
  public String causeKind() {
    Throwable cause = getCause();
    if (cause instanceof PyxisException pyxis) {
      return pyxis.kind();
    }
    return cause == null ? kind() : cause.getClass().getSimpleName();
  }

  private static String describe(Throwable cause) {
    if (cause == null) {
      return "unknown error";
    }
    String kind = cause instanceof PyxisException pyxis ? pyxis.kind() : cause.getClass().getSimpleName();
    return kind + ": " + cause.getMessage();
  }
}
