package ca.gc.nrc.pyxis.domain.attribute;

/**
 * Keys of static attributes maintained by the pipeline engine.
 *
 * @since 0.1.0
 */
public final class StandardAttributes {
  /** Frame count of the dataset, refreshed after every module that wrote it. */
  public static final String NFRAMES = "NFRAMES";
  /** Per-frame dimensions rendered as {@code AxB}. */
  public static final String FRAME_SHAPE = "FRAME_SHAPE";
  /** Prefix of history entries; the module name follows. */
  public static final String HISTORY_PREFIX = "History: ";

  private StandardAttributes() {
    // Utility
  }

  /**
   * History key recorded for a module.
   *
   * @param moduleName module name
   * @return key {@code History: <moduleName>}
   */
  public static String historyKey(String moduleName) {
    return HISTORY_PREFIX + moduleName;
  }
}
