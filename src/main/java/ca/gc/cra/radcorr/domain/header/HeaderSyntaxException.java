package ca.gc.cra.radcorr.domain.header;

import ca.gc.cra.radcorr.domain.CorrectionException;

/**
 * Checked exception raised when header text violates the {@code key = value} grammar.
 *
 * @since 0.1.0
 */
public final class HeaderSyntaxException extends CorrectionException {
  private final int lineNumber;

  /**
   * Creates an exception naming the offending line.
   *
   * @param msg description of the violation
   * @param lineNumber 1-based line number in the header text
   */
  public HeaderSyntaxException(String msg, int lineNumber) {
    super(msg + " (line " + lineNumber + ")");
    this.lineNumber = lineNumber;
  }

  /**
   * Returns the 1-based line that triggered the failure.
   *
   * @return line number
   */
  public int lineNumber() {
    return lineNumber;
  }
}
