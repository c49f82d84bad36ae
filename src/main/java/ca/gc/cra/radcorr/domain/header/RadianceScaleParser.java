package ca.gc.cra.radcorr.domain.header;

import java.util.Locale;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Extracts the radiance scale factor embedded in a description such as
 * {@code "Radiance [mW/(cm^2*sr*um)] * 1000.0]"}.
 *
 * <p>The description is lower-cased (list descriptions are first joined with single spaces) and must contain
 * both {@code mw} and {@code *}. The factor is the text after the last {@code *} up to the next {@code ]} (or
 * the end of the text), trimmed and parsed as a float64.</p>
 *
 * @since 0.1.0
 */
public final class RadianceScaleParser {
  private RadianceScaleParser() {}

  /**
   * Parses the scale factor from an optional description field.
   *
   * @param description description field, if declared
   * @return factor, or empty when the pattern is absent or the number does not parse
   */
  public static OptionalDouble parse(Optional<HeaderField> description) {
    if (description == null || description.isEmpty()) {
      return OptionalDouble.empty();
    }
    return parse(descriptionText(description.get()));
  }

  /**
   * Parses the scale factor from description text.
   *
   * @param description raw description text
   * @return factor, or empty when the pattern is absent or the number does not parse
   */
  public static OptionalDouble parse(String description) {
    if (description == null) {
      return OptionalDouble.empty();
    }
    String lower = description.toLowerCase(Locale.ROOT);
    if (!lower.contains("mw") || !lower.contains("*")) {
      return OptionalDouble.empty();
    }
    String tail = lower.substring(lower.lastIndexOf('*') + 1);
    int close = tail.indexOf(']');
    String token = (close < 0 ? tail : tail.substring(0, close)).trim();
    return HeaderValues.parseFloat(token);
  }

  static String descriptionText(HeaderField field) {
    if (field instanceof HeaderField.TextListValue list) {
      return String.join(" ", list.items());
    }
    if (field instanceof HeaderField.FloatListValue list) {
      StringBuilder sb = new StringBuilder();
      for (Double value : list.values()) {
        if (sb.length() > 0) {
          sb.append(' ');
        }
        sb.append(value);
      }
      return sb.toString();
    }
    return field.text();
  }
}
