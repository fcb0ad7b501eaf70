package io.doublezero.globalmonitor.validation;

/**
 * Numeric range checks for configuration parsing.
 */
public final class Numbers {
  private Numbers() {
    // Utility
  }

  /**
   * Validates that a value falls within an inclusive range.
   *
   * @return the validated value
   * @throws IllegalArgumentException if {@code value} lies outside {@code [min, max]}
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
   * Parses a decimal integer and checks its range.
   */
  public static int parseInt(String name, String raw, int min, int max) {
    String trimmed = Strings.requireNonBlank(name, raw);
    long value;
    try {
      value = Long.parseLong(trimmed);
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(Strings.message(name, "must be an integer (was " + trimmed + ")"), ex);
    }
    return (int) requireRange(name, value, min, max);
  }
}
