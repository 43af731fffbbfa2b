package ca.gc.nrc.pyxis.domain.error;

/**
 * Raised by pipeline validation when a module requires a tag that neither storage nor an earlier
 * module provides.
 *
 * @since 0.1.0
 */
public final class MissingInputException extends PyxisException {
  private static final long serialVersionUID = 1L;

  private final String moduleName;
  private final String tag;

  /**
   * Creates a validation failure.
   *
   * @param moduleName module declaring the input
   * @param tag tag that is not available
   */
  public MissingInputException(String moduleName, String tag) {
    super("Pipeline module '" + moduleName + "' requires dataset '" + tag
        + "' which is neither in storage nor produced by an earlier module");
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
