package ca.gc.cra.radcorr.domain.cube;

/**
 * Summary statistics over one band. NaN samples are counted separately and excluded from min, max and mean.
 *
 * @param band zero-based band
 * @param min smallest finite-or-infinite value, or NaN when no value was seen
 * @param max largest value, or NaN when no value was seen
 * @param mean arithmetic mean, or NaN when no value was seen
 * @param count number of non-NaN samples
 * @param nanCount number of NaN samples
 */
public record BandStatistics(int band, double min, double max, double mean, long count, long nanCount) {

  /**
   * Creates an accumulator for {@code band}.
   *
   * @param band zero-based band
   * @return empty accumulator
   */
  public static Accumulator accumulate(int band) {
    return new Accumulator(band);
  }

  /** Streaming accumulator fed chunk by chunk. Not thread-safe. */
  public static final class Accumulator {
    private final int band;
    private double min = Double.POSITIVE_INFINITY;
    private double max = Double.NEGATIVE_INFINITY;
    private double sum;
    private long count;
    private long nanCount;

    private Accumulator(int band) {
      this.band = band;
    }

    /**
     * Adds the first {@code length} samples of {@code values}.
     *
     * @param values chunk buffer
     * @param length number of valid samples in the buffer
     * @return this accumulator
     */
    public Accumulator add(float[] values, int length) {
      for (int i = 0; i < length; i++) {
        float v = values[i];
        if (Float.isNaN(v)) {
          nanCount++;
          continue;
        }
        min = Math.min(min, v);
        max = Math.max(max, v);
        sum += v;
        count++;
      }
      return this;
    }

    /**
     * Produces the statistics seen so far.
     *
     * @return statistics snapshot
     */
    public BandStatistics result() {
      if (count == 0) {
        return new BandStatistics(band, Double.NaN, Double.NaN, Double.NaN, 0, nanCount);
      }
      return new BandStatistics(band, min, max, sum / count, count, nanCount);
    }
  }
}
