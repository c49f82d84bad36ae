package ca.gc.cra.radcorr.domain.header;

import ca.gc.cra.radcorr.domain.CorrectionException;

/**
 * Checked exception raised when a required header key is absent.
 *
 * @since 0.1.0
 */
public final class MissingFieldException extends CorrectionException {
  private final String key;

  /**
   * Creates an exception for a missing key.
   *
   * @param key normalized header key
   */
  public MissingFieldException(String key) {
    super("required header field missing: " + key);
    this.key = key;
  }

  /**
   * Returns the missing key.
   *
   * @return normalized key
   */
  public String key() {
    return key;
  }
}
