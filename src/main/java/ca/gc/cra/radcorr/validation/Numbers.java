package ca.gc.cra.radcorr.validation;

/**
 * <strong>What:</strong> Numeric validation helpers used by RADCORR CLI and configuration parsing.
 * <p><strong>Why:</strong> Rejects chunk sizes, band indices and scale factors that would misbehave once cube
 * files are open.</p>
 * <p><strong>Thread-safety:</strong> Stateless utility.</p>
 * <p><strong>Observability:</strong> Emits no logs; throws {@link IllegalArgumentException} when validation
 * fails.</p>
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
   * @param name parameter name used in diagnostics; defaults to {@code "value"} when blank
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
   * Validates that a floating point value is finite and strictly positive.
   *
   * @param name parameter name used in diagnostics
   * @param value candidate value
   * @return the validated value
   * @throws IllegalArgumentException if {@code value} is NaN, infinite, zero or negative
   */
  public static double requirePositiveFinite(String name, double value) {
    if (!Double.isFinite(value) || value <= 0.0) {
      throw new IllegalArgumentException(label(name) + " must be a positive finite number (was " + value + ")");
    }
    return value;
  }

  /**
   * Parses a decimal integer option.
   *
   * @param name parameter name used in diagnostics
   * @param raw text to parse
   * @return parsed value
   * @throws IllegalArgumentException if {@code raw} is not an integer
   */
  public static long parseLong(String name, String raw) {
    try {
      return Long.parseLong(raw.trim());
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(label(name) + " must be an integer (was '" + raw + "')", ex);
    }
  }

  /**
   * Parses a decimal floating point option.
   *
   * @param name parameter name used in diagnostics
   * @param raw text to parse
   * @return parsed value
   * @throws IllegalArgumentException if {@code raw} is not a number
   */
  public static double parseDouble(String name, String raw) {
    try {
      return Double.parseDouble(raw.trim());
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(label(name) + " must be a number (was '" + raw + "')", ex);
    }
  }

  private static String label(String name) {
    return name == null || name.isBlank() ? "value" : name;
  }
}
