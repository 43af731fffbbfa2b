package ca.gc.nrc.pyxis.validation;

/**
 * <strong>What:</strong> Numeric validation helpers used by PYXIS CLI, configuration and module parameters.
 * <p><strong>Why:</strong> Guards against invalid chunk sizes, memory budgets and module parameters before
 * storage or modules allocate buffers.</p>
 * <p><strong>Thread-safety:</strong> Stateless utility.</p>
 *
 * @since 0.1.0
 * @see Strings
 */
public final class Numbers {
  private Numbers() {
    // Utility
  }

  /**
   * Validates that a numeric value falls within an inclusive range.
   *
   * @param name logical parameter name included in diagnostics; defaults to {@code "value"} when blank
   * @param value candidate value
   * @param min minimum inclusive value
   * @param max maximum inclusive value
   * @return the validated value for fluent call sites
   * @throws IllegalArgumentException if {@code value} lies outside {@code [min, max]}
   */
  public static long requireRange(String name, long value, long min, long max) {
    if (value < min || value > max) {
      throw new IllegalArgumentException(
          label(name) + " must be between " + min + " and " + max + " (was " + value + ")");
    }
    return value;
  }

  /**
   * Parses a decimal integer and checks it against an inclusive range.
   *
   * @param name logical parameter name included in diagnostics
   * @param raw text to parse; surrounding whitespace is ignored
   * @param min minimum inclusive value
   * @param max maximum inclusive value
   * @return parsed value
   * @throws IllegalArgumentException if the text is not an integer or lies outside {@code [min, max]}
   */
  public static long parseLong(String name, String raw, long min, long max) {
    if (raw == null || raw.isBlank()) {
      throw new IllegalArgumentException(label(name) + " must not be blank");
    }
    long value;
    try {
      value = Long.parseLong(raw.trim());
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(label(name) + " must be an integer (was '" + raw + "')", ex);
    }
    return requireRange(name, value, min, max);
  }

  /**
   * Parses a finite decimal number.
   *
   * @param name logical parameter name included in diagnostics
   * @param raw text to parse
   * @return parsed value
   * @throws IllegalArgumentException if the text is not a finite number
   */
  public static double parseFiniteDouble(String name, String raw) {
    if (raw == null || raw.isBlank()) {
      throw new IllegalArgumentException(label(name) + " must not be blank");
    }
    double value;
    try {
      value = Double.parseDouble(raw.trim());
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(label(name) + " must be a number (was '" + raw + "')", ex);
    }
    if (!Double.isFinite(value)) {
      throw new IllegalArgumentException(label(name) + " must be finite (was '" + raw + "')");
    }
    return value;
  }

  private static String label(String name) {
    return name == null || name.isBlank() ? "value" : name;
  }
}
