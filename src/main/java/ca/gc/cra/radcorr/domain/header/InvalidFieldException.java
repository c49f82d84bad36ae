package ca.gc.cra.radcorr.domain.header;

import ca.gc.cra.radcorr.domain.CorrectionException;

/**
 * Checked exception raised when a header key is present but holds an unusable value.
 *
 * @since 0.1.0
 */
public final class InvalidFieldException extends CorrectionException {
  private final String key;

  /**
   * Creates an exception for an invalid value.
   *
   * @param key normalized header key
   * @param reason what is wrong with the value
   */
  public InvalidFieldException(String key, String reason) {
    super("header field '" + key + "' " + reason);
    this.key = key;
  }

  /**
   * Returns the offending key.
   *
   * @return normalized key
   */
  public String key() {
    return key;
  }
}
