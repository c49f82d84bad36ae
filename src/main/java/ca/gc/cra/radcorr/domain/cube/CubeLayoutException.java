package ca.gc.cra.radcorr.domain.cube;

import ca.gc.cra.radcorr.domain.CorrectionException;

/**
 * Checked exception raised when a cube file does not match the layout its header declares.
 *
 * @since 0.1.0
 */
public final class CubeLayoutException extends CorrectionException {
  /**
   * Creates an exception with a descriptive message.
   *
   * @param msg human-readable error
   */
  public CubeLayoutException(String msg) { super(msg); }
}
