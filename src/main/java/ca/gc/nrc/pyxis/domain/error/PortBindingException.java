package ca.gc.nrc.pyxis.domain.error;

/**
 * Raised when a module input port is bound to a tag that does not exist in storage.
 *
 * @since 0.1.0
 */
public final class PortBindingException extends PyxisException {
  private static final long serialVersionUID = 1L;

  private final String moduleName;
  private final String tag;

  /**
   * Creates a binding failure.
   *
   * @param moduleName module owning the port
   * @param role logical role of the port within the module
   * @param tag missing dataset tag
   */
  public PortBindingException(String moduleName, String role, String tag) {
    super("Module '" + moduleName + "' cannot bind input '" + role + "': dataset '" + tag
        + "' does not exist in storage");
    this.moduleName = moduleName;
    this.tag = tag;
  }

  public String moduleName() {
    return moduleName;
  }

  public String tag() {
    return tag;
  }
}
