package ca.gc.cra.radcorr.domain.header;

import ca.gc.cra.radcorr.domain.CorrectionException;

/**
 * Checked exception raised when two headers describe cubes of different shape.
 *
 * @since 0.1.0
 */
public final class DimensionMismatchException extends CorrectionException {
  private final CubeShape source;
  private final CubeShape reference;

  /**
   * Creates an exception for disagreeing shapes.
   *
   * @param source shape declared by the source header
   * @param reference shape declared by the reference header
   */
  public DimensionMismatchException(CubeShape source, CubeShape reference) {
    super("dimension mismatch between source " + source + " and reference " + reference
        + " (differs in " + source.differingKeys(reference) + ")");
    this.source = source;
    this.reference = reference;
  }

  public CubeShape source() {
    return source;
  }

  public CubeShape reference() {
    return reference;
  }
}
