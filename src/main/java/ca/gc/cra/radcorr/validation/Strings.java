package ca.gc.cra.radcorr.validation;

import java.util.Objects;

/**
 * <strong>What:</strong> String validation for RADCORR configuration and CLI values.
 * <p><strong>Why:</strong> Free text such as the output description ends up inside header files, where control
 * characters or stray braces would corrupt the grammar.</p>
 * <p><strong>Thread-safety:</strong> Stateless utility.</p>
 *
 * @since 0.1.0
 * @see Numbers
 * @see Paths
 */
public final class Strings {
  private Strings() {
    // Utility
  }

  /**
   * Ensures a value is non-null, non-blank and free of control characters.
   *
   * @param name parameter name for diagnostics
   * @param value candidate text
   * @return trimmed value
   * @throws NullPointerException if {@code value} is {@code null}
   * @throws IllegalArgumentException if the value is blank or contains control characters
   */
  public static String requireNonBlank(String name, String value) {
    String raw = Objects.requireNonNull(value, label(name));
    if (containsControl(raw)) {
      throw new IllegalArgumentException(label(name) + " must not contain control characters");
    }
    String trimmed = raw.trim();
    if (trimmed.isEmpty()) {
      throw new IllegalArgumentException(label(name) + " must not be blank");
    }
    return trimmed;
  }

  /**
   * Ensures a value contains only printable ASCII and fits the length budget.
   *
   * @param name parameter name for diagnostics
   * @param value candidate text
   * @param maxLength maximum length in characters
   * @return validated, trimmed value
   * @throws IllegalArgumentException if the value is too long or holds characters outside {@code 0x20-0x7E}
   */
  public static String requirePrintableAscii(String name, String value, int maxLength) {
    String sanitized = requireNonBlank(name, value);
    if (sanitized.length() > maxLength) {
      throw new IllegalArgumentException(label(name) + " length must be <= " + maxLength);
    }
    for (int i = 0; i < sanitized.length(); i++) {
      char c = sanitized.charAt(i);
      if (c < 0x20 || c > 0x7E) {
        throw new IllegalArgumentException(label(name) + " must contain printable ASCII characters");
      }
    }
    return sanitized;
  }

  /**
   * Ensures a value can be embedded in a braced header value and still read back as a single text field.
   * A comma inside braces starts a list, so commas are rejected along with braces.
   *
   * @param name parameter name for diagnostics
   * @param value candidate text
   * @return validated, trimmed value
   * @throws IllegalArgumentException if the value is blank or contains braces, commas or control characters
   */
  public static String requireHeaderText(String name, String value) {
    String sanitized = requireNonBlank(name, value);
    if (sanitized.indexOf('{') >= 0 || sanitized.indexOf('}') >= 0) {
      throw new IllegalArgumentException(label(name) + " must not contain '{' or '}'");
    }
    if (sanitized.indexOf(',') >= 0) {
      throw new IllegalArgumentException(label(name) + " must not contain ',' (it would be read back as a list)");
    }
    return sanitized;
  }

  static boolean containsControl(CharSequence value) {
    for (int i = 0; i < value.length(); i++) {
      if (Character.isISOControl(value.charAt(i))) {
        return true;
      }
    }
    return false;
  }

  private static String label(String name) {
    return (name == null || name.isBlank()) ? "value" : name;
  }
}
