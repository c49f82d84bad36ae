package ca.gc.cra.radcorr.application.pipeline;

import ca.gc.cra.radcorr.domain.cube.BandStatistics;
import ca.gc.cra.radcorr.domain.header.HeaderModel;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.OptionalInt;

/**
 * Result of inspecting a header and, optionally, its cube.
 *
 * @param header validated header
 * @param radianceScale scale factor found in the description, if any
 * @param nearestBand band closest to the requested wavelength, if one was requested and wavelengths exist
 * @param statistics statistics of the requested (or nearest) band when a cube was supplied
 * @param spectrum spectrum of the requested pixel when a cube was supplied
 */
public record InspectReport(
    HeaderModel header,
    OptionalDouble radianceScale,
    OptionalInt nearestBand,
    Optional<BandStatistics> statistics,
    Optional<float[]> spectrum) {

  public InspectReport {
    Objects.requireNonNull(header, "header");
    Objects.requireNonNull(radianceScale, "radianceScale");
    Objects.requireNonNull(nearestBand, "nearestBand");
    Objects.requireNonNull(statistics, "statistics");
    spectrum = Objects.requireNonNull(spectrum, "spectrum").map(float[]::clone);
  }
}
