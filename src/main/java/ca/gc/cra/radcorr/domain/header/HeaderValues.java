package ca.gc.cra.radcorr.domain.header;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.OptionalDouble;
import java.util.OptionalLong;
import java.util.regex.Pattern;

/**
 * <strong>What:</strong> Coercion rules that turn raw header text into {@link HeaderField}s.
 * <p><strong>Why:</strong> Downstream code relies on dimension keys never decoding as lists, so the order of
 * the checks is fixed: a comma selects the list path before any integer parse is attempted.</p>
 * <p><strong>Role:</strong> Domain helper invoked by the header parser for scalar and braced values.</p>
 * <p><strong>Thread-safety:</strong> Stateless; safe for concurrent use.</p>
 *
 * @since 0.1.0
 */
public final class HeaderValues {
  private static final Pattern DECIMAL = Pattern.compile(
      "[+-]?(?:\\d+(?:_\\d+)*(?:\\.(?:\\d+(?:_\\d+)*)?)?|\\.\\d+(?:_\\d+)*)(?:[eE][+-]?\\d+(?:_\\d+)*)?");
  private static final Pattern INTEGER = Pattern.compile("[+-]?\\d+(?:_\\d+)*");

  private HeaderValues() {
    // Utility
  }

  /**
   * Decodes a scalar value or the inside of a single-line brace pair.
   *
   * @param raw untrimmed value text; must not be {@code null}
   * @return {@link HeaderField.FloatListValue} or {@link HeaderField.TextListValue} when the value holds a comma,
   *     otherwise {@link HeaderField.IntegerValue} or {@link HeaderField.TextValue}
   */
  public static HeaderField decodeScalar(String raw) {
    String trimmed = raw.trim();
    if (trimmed.indexOf(',') >= 0) {
      return decodeList(splitList(trimmed));
    }
    OptionalLong integer = parseInteger(trimmed);
    if (integer.isPresent()) {
      return new HeaderField.IntegerValue(integer.getAsLong());
    }
    return new HeaderField.TextValue(trimmed);
  }

  /**
   * Decodes an assembled list. Blank pieces are dropped; the remainder becomes a float list when every piece
   * parses as a float, otherwise a text list.
   *
   * @param pieces list pieces as split from the source text
   * @return decoded list field
   */
  public static HeaderField decodeList(List<String> pieces) {
    List<String> kept = new ArrayList<>(pieces.size());
    for (String piece : pieces) {
      String trimmed = piece.trim();
      if (!trimmed.isEmpty()) {
        kept.add(trimmed);
      }
    }
    List<Double> values = new ArrayList<>(kept.size());
    for (String piece : kept) {
      OptionalDouble parsed = parseFloat(piece);
      if (parsed.isEmpty()) {
        return new HeaderField.TextListValue(kept);
      }
      values.add(parsed.getAsDouble());
    }
    return new HeaderField.FloatListValue(values);
  }

  /**
   * Splits text on commas and trims every piece; empty pieces are kept.
   *
   * @param text text to split
   * @return trimmed pieces
   */
  public static List<String> splitList(String text) {
    String[] parts = text.split(",", -1);
    List<String> pieces = new ArrayList<>(parts.length);
    for (String part : parts) {
      pieces.add(part.trim());
    }
    return pieces;
  }

  /**
   * Parses a float64 using decimal or scientific notation, {@code nan}, {@code inf} or {@code infinity}.
   *
   * @param raw candidate text
   * @return parsed value, or empty when the text is not a float
   */
  public static OptionalDouble parseFloat(String raw) {
    if (raw == null) {
      return OptionalDouble.empty();
    }
    String text = raw.trim();
    if (text.isEmpty()) {
      return OptionalDouble.empty();
    }
    String lower = text.toLowerCase(Locale.ROOT);
    boolean negative = lower.startsWith("-");
    String unsigned = lower.startsWith("-") || lower.startsWith("+") ? lower.substring(1) : lower;
    switch (unsigned) {
      case "nan":
        return OptionalDouble.of(Double.NaN);
      case "inf":
      case "infinity":
        return OptionalDouble.of(negative ? Double.NEGATIVE_INFINITY : Double.POSITIVE_INFINITY);
      default:
        break;
    }
    if (!DECIMAL.matcher(text).matches()) {
      return OptionalDouble.empty();
    }
    return OptionalDouble.of(Double.parseDouble(text.replace("_", "")));
  }

  /**
   * Parses a signed base-10 integer that fits in a {@code long}.
   *
   * @param raw candidate text
   * @return parsed value, or empty when the text is not an integer
   */
  public static OptionalLong parseInteger(String raw) {
    if (raw == null) {
      return OptionalLong.empty();
    }
    String text = raw.trim();
    if (!INTEGER.matcher(text).matches()) {
      return OptionalLong.empty();
    }
    try {
      return OptionalLong.of(Long.parseLong(text.replace("_", "")));
    } catch (NumberFormatException ex) {
      return OptionalLong.empty();
    }
  }
}
