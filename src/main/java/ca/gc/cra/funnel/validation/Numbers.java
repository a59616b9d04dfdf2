package ca.gc.cra.funnel.validation;

/**
 * Numeric validation helpers for configuration values.
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
   * @param name label used in error messages
   * @param value value to check
   * @param min inclusive lower bound
   * @param max inclusive upper bound
   * @return {@code value} when valid
   * @throws IllegalArgumentException when out of range
   */
  public static long requireRange(String name, long value, long min, long max) {
    if (value < min || value > max) {
      throw new IllegalArgumentException(
          label(name) + " must be between " + min + " and " + max + " (was " + value + ")");
    }
    return value;
  }

  /**
   * Parses an integral configuration value, accepting numbers and numeric strings.
   *
   * @param name label used in error messages
   * @param raw value from a parsed document
   * @return parsed value
   * @throws IllegalArgumentException when the value is not an integer
   */
  public static long parseLong(String name, Object raw) {
    if (raw instanceof Number number) {
      double asDouble = number.doubleValue();
      if (asDouble != Math.rint(asDouble)) {
        throw new IllegalArgumentException(label(name) + " must be an integer (was " + raw + ")");
      }
      return number.longValue();
    }
    String text = raw == null ? "" : raw.toString().trim();
    try {
      return Long.parseLong(text);
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(label(name) + " must be an integer (was '" + text + "')", ex);
    }
  }

  private static String label(String name) {
    return name == null || name.isBlank() ? "value" : name;
  }
}
