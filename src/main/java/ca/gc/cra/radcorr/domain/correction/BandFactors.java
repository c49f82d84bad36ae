package ca.gc.cra.radcorr.domain.correction;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Per-band multiplicative correction factors, computed once per run.
 * <p><strong>Why:</strong> Applies a linear de-trend centred on {@value #CENTER_WAVELENGTH_NM} nm using raw
 * wavelength values: {@code factor = 1 + (wavelength - 500) / 1000}.</p>
 * <p><strong>Role:</strong> Domain table consulted by the correction use case for every chunk of a band.</p>
 * <p><strong>Thread-safety:</strong> Immutable after construction.</p>
 *
 * @since 0.1.0
 */
public final class BandFactors {
  /** Wavelength at which the factor equals one. */
  public static final double CENTER_WAVELENGTH_NM = 500.0;
  /** Wavelength distance over which the factor changes by one. */
  public static final double WAVELENGTH_SPAN_NM = 1000.0;
  /** Factor used for bands with no wavelength entry. */
  public static final double IDENTITY = 1.0;

  private final double[] factors;

  private BandFactors(double[] factors) {
    this.factors = factors;
  }

  /**
   * Builds the table for {@code bands} bands. Bands without a wavelength entry get {@link #IDENTITY}; entries
   * beyond {@code bands} are ignored.
   *
   * @param wavelengths optional wavelength table
   * @param bands number of bands in the cube; must be positive
   * @return factor table of length {@code bands}
   */
  public static BandFactors fromWavelengths(Optional<List<Double>> wavelengths, int bands) {
    Objects.requireNonNull(wavelengths, "wavelengths");
    if (bands <= 0) {
      throw new IllegalArgumentException("bands must be positive (was " + bands + ")");
    }
    double[] factors = new double[bands];
    Arrays.fill(factors, IDENTITY);
    if (wavelengths.isPresent()) {
      List<Double> values = wavelengths.get();
      int limit = Math.min(values.size(), bands);
      for (int band = 0; band < limit; band++) {
        factors[band] = factorFor(values.get(band));
      }
    }
    return new BandFactors(factors);
  }

  /**
   * Computes the factor for a single wavelength.
   *
   * @param wavelength raw wavelength value
   * @return {@code 1.0 + (wavelength - 500.0) / 1000.0}
   */
  public static double factorFor(double wavelength) {
    return IDENTITY + (wavelength - CENTER_WAVELENGTH_NM) / WAVELENGTH_SPAN_NM;
  }

  /**
   * Returns the factor for a band.
   *
   * @param band zero-based band index
   * @return correction factor
   */
  public double factor(int band) {
    Objects.checkIndex(band, factors.length);
    return factors[band];
  }

  public int size() {
    return factors.length;
  }

  /**
   * Returns a copy of the table.
   *
   * @return factors indexed by band
   */
  public double[] toArray() {
    return factors.clone();
  }

  @Override
  public String toString() {
    return "BandFactors" + Arrays.toString(factors);
  }
}
