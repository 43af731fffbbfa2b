package ca.gc.nrc.pyxis.domain.error;

/**
 * Module-domain failure for invalid parameters or missing optional inputs a module cannot do without.
 *
 * @since 0.1.0
 */
public final class ModuleParameterException extends PyxisException {
  private static final long serialVersionUID = 1L;

  /**
   * Creates a parameter failure.
   *
   * @param message description naming the parameter
   */
  public ModuleParameterException(String message) {
    super(message);
  }

  /**
   * Creates a parameter failure caused by a parse error.
   *
   * @param message description naming the parameter
   * @param cause underlying parse failure
   */
  public ModuleParameterException(String message, Throwable cause) {
    super(message, cause);
  }
}
