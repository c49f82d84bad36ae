package ca.gc.cra.radcorr.infrastructure.header;

import ca.gc.cra.radcorr.domain.header.HeaderField;
import ca.gc.cra.radcorr.domain.header.HeaderKeys;
import ca.gc.cra.radcorr.domain.header.HeaderModel;
import java.nio.ByteOrder;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Serializes a {@link HeaderModel} into ENVI header text.
 *
 * <p>Field order is fixed: magic, description, dimensions, layout, wavelength table, then pass-through fields.
 * Lists are written one element per line so that {@link EnviHeaderParser} reads them back as lists even when
 * they hold a single element.</p>
 */
public final class EnviHeaderWriter {
  static final String NEWLINE = "\n";
  private static final String FILE_TYPE = "ENVI Standard";

  /**
   * Renders the header text for {@code model}.
   *
   * @param model model to render
   * @return header text ending with a newline
   */
  public String write(HeaderModel model) {
    Objects.requireNonNull(model, "model");
    StringBuilder out = new StringBuilder(256);
    line(out, "ENVI");
    model.description().ifPresent(description ->
        line(out, HeaderKeys.DESCRIPTION + " = {" + description.text() + "}"));
    line(out, HeaderKeys.SAMPLES + " = " + model.shape().samples());
    line(out, HeaderKeys.LINES + " = " + model.shape().lines());
    line(out, HeaderKeys.BANDS + " = " + model.shape().bands());
    line(out, HeaderKeys.HEADER_OFFSET + " = " + model.headerOffset());
    line(out, HeaderKeys.FILE_TYPE + " = " + FILE_TYPE);
    line(out, HeaderKeys.DATA_TYPE + " = " + HeaderModel.DATA_TYPE_FLOAT32);
    line(out, HeaderKeys.INTERLEAVE + " = " + HeaderModel.INTERLEAVE_BSQ);
    line(out, HeaderKeys.BYTE_ORDER + " = " + (model.byteOrder() == ByteOrder.BIG_ENDIAN ? 1 : 0));
    model.wavelengths().filter(values -> !values.isEmpty()).ifPresent(values -> writeWavelengths(out, values));
    for (Map.Entry<String, HeaderField> entry : model.passThrough().entrySet()) {
      writeField(out, entry.getKey(), entry.getValue());
    }
    return out.toString();
  }

  private static void writeWavelengths(StringBuilder out, List<Double> values) {
    out.append(HeaderKeys.WAVELENGTH).append(" = {").append(NEWLINE);
    for (int i = 0; i < values.size(); i++) {
      out.append(' ').append(String.format(Locale.ROOT, "%.6f", values.get(i)));
      if (i < values.size() - 1) {
        out.append(',').append(NEWLINE);
      }
    }
    out.append('}').append(NEWLINE);
  }

  private static void writeField(StringBuilder out, String key, HeaderField value) {
    if (value instanceof HeaderField.FloatListValue floats) {
      writeList(out, key, floats.values().stream().map(String::valueOf).toList());
    } else if (value instanceof HeaderField.TextListValue texts) {
      writeList(out, key, texts.items());
    } else {
      line(out, key + " = " + value.text());
    }
  }

  private static void writeList(StringBuilder out, String key, List<String> items) {
    out.append(key).append(" = {").append(NEWLINE);
    out.append(' ').append(String.join("," + NEWLINE + " ", items));
    out.append('}').append(NEWLINE);
  }

  private static void line(StringBuilder out, String text) {
    out.append(text).append(NEWLINE);
  }
}
