package ca.gc.nrc.pyxis.domain.error;

/**
 * Raised when a module is registered under a name that is already taken.
 *
 * @since 0.1.0
 */
public final class DuplicateNameException extends PyxisException {
  private static final long serialVersionUID = 1L;

  private final String moduleName;

  /**
   * Creates a registration failure.
   *
   * @param moduleName colliding module name
   */
  public DuplicateNameException(String moduleName) {
    super("A module named '" + moduleName + "' is already registered");
    this.moduleName = moduleName;
  }

  public String moduleName() {
    return moduleName;
  }
}
