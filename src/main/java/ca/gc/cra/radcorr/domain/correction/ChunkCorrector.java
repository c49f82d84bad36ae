package ca.gc.cra.radcorr.domain.correction;

/**
 * Applies a band factor to a chunk of samples and clips the result to {@code [0, 1]}.
 *
 * <p>The factor is narrowed to float32 and the multiplication runs in float32, matching float32 array
 * arithmetic. NaN samples are left as NaN.</p>
 *
 * @since 0.1.0
 */
public final class ChunkCorrector {
  /** Lower clip bound. */
  public static final float MIN_VALUE = 0.0f;
  /** Upper clip bound. */
  public static final float MAX_VALUE = 1.0f;

  private ChunkCorrector() {}

  /**
   * Corrects {@code data[0..length)} in place.
   *
   * @param data chunk samples; modified in place
   * @param length number of leading elements to correct
   * @param factor band correction factor
   * @return number of elements that fell outside {@code [0, 1]} before clipping
   */
  public static long apply(float[] data, int length, double factor) {
    if (length < 0 || length > data.length) {
      throw new IndexOutOfBoundsException("length " + length + " outside buffer of " + data.length);
    }
    float f = (float) factor;
    long clipped = 0;
    for (int i = 0; i < length; i++) {
      float v = data[i] * f;
      if (v < MIN_VALUE) {
        v = MIN_VALUE;
        clipped++;
      } else if (v > MAX_VALUE) {
        v = MAX_VALUE;
        clipped++;
      }
      data[i] = v;
    }
    return clipped;
  }
}
