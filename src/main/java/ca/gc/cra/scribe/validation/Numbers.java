package ca.gc.cra.scribe.validation;

/**
 * <strong>What:</strong> Numeric validation helpers for rotation and retention settings.
 * <p><strong>Thread-safety:</strong> Stateless utility.</p>
 * <p><strong>Observability:</strong> Violations raise {@link IllegalArgumentException}.</p>
 *
 * @since 0.1.0
 * @see Strings
 */
public final class Numbers {
  private Numbers() {
    // Utility
  }

  /**
   * Validates that a value falls within an inclusive range.
   *
   * @param name parameter name used in diagnostics
   * @param value candidate value
   * @param min inclusive lower bound
   * @param max inclusive upper bound
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
   * Parses a long setting, naming the key on failure.
   *
   * @param name setting key used in diagnostics
   * @param raw textual value
   * @return parsed value
   * @throws IllegalArgumentException if {@code raw} is not a base-10 long
   */
  public static long parseLong(String name, String raw) {
    try {
      return Long.parseLong(Strings.requireNonBlank(name, raw));
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(name + " must be numeric (was " + raw + ")", ex);
    }
  }
}
