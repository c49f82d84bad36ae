package ca.gc.cra.radcorr.infrastructure.header;

import ca.gc.cra.radcorr.domain.header.HeaderField;
import ca.gc.cra.radcorr.domain.header.HeaderFields;
import ca.gc.cra.radcorr.domain.header.HeaderSyntaxException;
import ca.gc.cra.radcorr.domain.header.HeaderValues;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Line-oriented parser for ENVI-style {@code key = value} headers.
 *
 * <p>Scalars are decoded with {@link HeaderValues#decodeScalar(String)}; braced values that close on the same
 * line go through the same path. A brace left open collects comma separated pieces across lines until the
 * closing brace and always decodes as a list. Blank lines are ignored everywhere, and a leading {@code ENVI}
 * magic line is skipped.</p>
 *
 * <p>Stateless; a single instance may be shared across threads.</p>
 */
public final class EnviHeaderParser {
  private static final Logger log = LoggerFactory.getLogger(EnviHeaderParser.class);
  private static final String MAGIC = "envi";

  /**
   * Parses complete header text.
   *
   * @param text header contents; must not be {@code null}
   * @return decoded fields, last assignment winning for repeated keys
   * @throws HeaderSyntaxException if a line lacks {@code '='} or a list is never closed
   */
  public HeaderFields parse(String text) throws HeaderSyntaxException {
    Objects.requireNonNull(text, "text");
    HeaderFields.Builder fields = HeaderFields.builder();
    String[] lines = text.split("\\R", -1);

    boolean seenContent = false;
    String listKey = null;
    int listOpenedAt = 0;
    List<String> pieces = null;

    for (int i = 0; i < lines.length; i++) {
      int lineNumber = i + 1;
      String line = lines[i].strip();
      if (line.isEmpty()) {
        continue;
      }

      if (listKey != null) {
        int close = line.indexOf('}');
        if (close < 0) {
          pieces.addAll(HeaderValues.splitList(line));
          continue;
        }
        pieces.addAll(HeaderValues.splitList(line.substring(0, close)));
        assign(fields, listKey, HeaderValues.decodeList(pieces), listOpenedAt);
        listKey = null;
        pieces = null;
        continue;
      }

      boolean first = !seenContent;
      seenContent = true;
      int eq = line.indexOf('=');
      if (eq < 0) {
        if (first && line.toLowerCase(Locale.ROOT).equals(MAGIC)) {
          continue;
        }
        throw new HeaderSyntaxException("missing '=' in header line '" + line + "'", lineNumber);
      }

      String key = HeaderFields.normalizeKey(line.substring(0, eq));
      if (key.isEmpty()) {
        throw new HeaderSyntaxException("blank key in header line '" + line + "'", lineNumber);
      }
      String value = line.substring(eq + 1);
      int open = value.indexOf('{');
      if (open < 0) {
        assign(fields, key, HeaderValues.decodeScalar(value), lineNumber);
        continue;
      }
      int close = value.indexOf('}', open + 1);
      if (close >= 0) {
        assign(fields, key, HeaderValues.decodeScalar(value.substring(open + 1, close)), lineNumber);
        continue;
      }
      listKey = key;
      listOpenedAt = lineNumber;
      pieces = new ArrayList<>(HeaderValues.splitList(value.substring(open + 1)));
    }

    if (listKey != null) {
      throw new HeaderSyntaxException("unterminated list for key '" + listKey + "'", listOpenedAt);
    }
    return fields.build();
  }

  private static void assign(
      HeaderFields.Builder fields, String key, HeaderField value, int line) {
    if (log.isDebugEnabled()) {
      log.debug("Header line {}: {} -> {}", line, key, value.getClass().getSimpleName());
    }
    fields.put(key, value);
  }
}
