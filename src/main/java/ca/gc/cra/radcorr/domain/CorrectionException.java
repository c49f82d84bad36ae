package ca.gc.cra.radcorr.domain;

/**
 * Base checked exception for data errors that abort a correction run before any output is written.
 *
 * <p>Subclasses describe malformed headers, missing or unsupported fields, disagreeing cube shapes,
 * and output allocation failures. Plain {@link java.io.IOException}s are reserved for transport
 * failures while reading or writing bytes.</p>
 *
 * @since 0.1.0
 */
public abstract class CorrectionException extends Exception {
  /**
   * Creates an exception with a descriptive message.
   *
   * @param msg human-readable error
   */
  protected CorrectionException(String msg) { super(msg); }

  /**
   * Creates an exception with a message and underlying cause.
   *
   * @param msg human-readable error
   * @param cause root cause
   */
  protected CorrectionException(String msg, Throwable cause) { super(msg, cause); }
}
