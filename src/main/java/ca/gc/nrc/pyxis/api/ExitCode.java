package ca.gc.nrc.pyxis.api;

/**
 * <strong>What:</strong> Process exit codes returned by the PYXIS command-line tools.
 * <p><strong>Why:</strong> Lets batch schedulers tell bad arguments, unreadable files, broken configuration and
 * failed modules apart without parsing logs.</p>
 * <p><strong>Role:</strong> Adapter-facing enum returned by {@link Main}, {@link RunCli} and {@link InspectCli}.</p>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable and thread-safe.</p>
 *
 * @since 0.1.0
 */
public enum ExitCode {
  /** Successful execution. */
  SUCCESS(0),
  /** Command-line arguments were missing or malformed. */
  INVALID_ARGS(2),
  /** A file or the storage container could not be read, written or locked. */
  IO_ERROR(3),
  /** Configuration or recipe was malformed, or the recipe does not validate against storage. */
  CONFIG_ERROR(4),
  /** A module failed while running, or an unexpected runtime failure occurred. */
  RUNTIME_FAILURE(5);

  private final int code;

  ExitCode(int code) {
    this.code = code;
  }

  /**
   * Returns the numeric value handed to {@link System#exit(int)}.
   *
   * @return numeric exit code
   */
  public int code() {
    return code;
  }
}
