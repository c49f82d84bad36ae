package ca.gc.cra.radcorr.domain.cube;

import ca.gc.cra.radcorr.domain.CorrectionException;

/**
 * Checked exception raised when the output cube cannot be created at its full size.
 *
 * <p>Thrown before any element is written; the partially created file has already been removed.</p>
 *
 * @since 0.1.0
 */
public final class OutputAllocationException extends CorrectionException {
  /**
   * Creates an exception with a descriptive message.
   *
   * @param msg human-readable error
   */
  public OutputAllocationException(String msg) { super(msg); }

  /**
   * Creates an exception with a message and underlying cause.
   *
   * @param msg human-readable error
   * @param cause filesystem failure
   */
  public OutputAllocationException(String msg, Throwable cause) { super(msg, cause); }
}
