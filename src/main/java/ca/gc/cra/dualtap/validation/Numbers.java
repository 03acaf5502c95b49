package ca.gc.cra.dualtap.validation;

/**
 * Numeric range checks shared by configuration parsing.
 *
 * @since 0.1.0
 */
public final class Numbers {
  private Numbers() {
    // Utility
  }

  /**
   * Ensures {@code value} lies within {@code [min, max]}.
   *
   * @param name logical name for diagnostics
   * @param value candidate value
   * @param min inclusive lower bound
   * @param max inclusive upper bound
   * @return {@code value} when within range
   * @throws IllegalArgumentException when the value falls outside the range
   */
  public static long requireRange(String name, long value, long min, long max) {
    if (value < min || value > max) {
      throw new IllegalArgumentException(
          (name == null || name.isBlank() ? "value" : name)
              + " must be between " + min + " and " + max + " (was " + value + ")");
    }
    return value;
  }

  /**
   * Parses an integer option, falling back to {@code defaultValue} when blank.
   *
   * @param name logical name for diagnostics
   * @param raw raw option text; may be {@code null}
   * @param defaultValue value used when {@code raw} is blank
   * @param min inclusive lower bound
   * @param max inclusive upper bound
   * @return parsed and range-checked value
   * @throws IllegalArgumentException when the value is not numeric or out of range
   */
  public static int parseBounded(String name, String raw, int defaultValue, int min, int max) {
    if (raw == null || raw.isBlank()) {
      requireRange(name, defaultValue, min, max);
      return defaultValue;
    }
    try {
      int parsed = Integer.parseInt(raw.trim());
      requireRange(name, parsed, min, max);
      return parsed;
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(name + " must be an integer between " + min + " and " + max, ex);
    }
  }
}
