package ca.gc.cra.radcorr.domain.header;

import java.util.List;
import java.util.Objects;

/**
 * <strong>What:</strong> Typed value decoded from one {@code key = value} header declaration.
 * <p><strong>Why:</strong> Header values are heterogeneous (dimensions, wavelength tables, free text); a closed
 * set of value kinds lets consumers branch on the kind instead of re-parsing strings.</p>
 * <p><strong>Role:</strong> Domain value produced by {@link HeaderValues} and stored in {@link HeaderFields}.</p>
 * <p><strong>Thread-safety:</strong> All implementations are immutable records.</p>
 *
 * @since 0.1.0
 * @see HeaderValues
 */
public sealed interface HeaderField
    permits HeaderField.TextValue,
        HeaderField.IntegerValue,
        HeaderField.FloatListValue,
        HeaderField.TextListValue {

  /**
   * Renders the value as free text.
   *
   * @return textual form of the value
   */
  String text();

  /**
   * Scalar text value that did not parse as an integer.
   *
   * @param text trimmed text
   */
  record TextValue(String text) implements HeaderField {
    public TextValue {
      Objects.requireNonNull(text, "text");
    }
  }

  /**
   * Scalar integer value.
   *
   * @param value parsed integer
   */
  record IntegerValue(long value) implements HeaderField {
    @Override
    public String text() {
      return Long.toString(value);
    }
  }

  /**
   * List value whose every element parsed as a float64.
   *
   * @param values decoded values in declaration order
   */
  record FloatListValue(List<Double> values) implements HeaderField {
    public FloatListValue {
      values = List.copyOf(Objects.requireNonNull(values, "values"));
    }

    @Override
    public String text() {
      StringBuilder sb = new StringBuilder();
      for (Double value : values) {
        if (sb.length() > 0) {
          sb.append(", ");
        }
        sb.append(value);
      }
      return sb.toString();
    }
  }

  /**
   * List value holding at least one element that is not a float; kept as raw text pieces.
   *
   * @param items trimmed, non-empty pieces in declaration order
   */
  record TextListValue(List<String> items) implements HeaderField {
    public TextListValue {
      items = List.copyOf(Objects.requireNonNull(items, "items"));
    }

    /**
     * Joins the pieces with {@code ", "}, restoring the comma-separated form they were split from.
     *
     * @return joined text
     */
    @Override
    public String text() {
      return String.join(", ", items);
    }
  }
}
