package ca.gc.cra.radcorr.domain.correction;

import ca.gc.cra.radcorr.domain.header.CubeShape;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Outcome of a completed correction run.
 *
 * @param outputData corrected cube file
 * @param outputHeader companion header, written after the cube was flushed
 * @param shape cube geometry
 * @param radianceScale scale factor parsed from the reference description, or the configured default
 * @param factors per-band factors that were applied
 * @param warnings non-fatal conditions raised during the run
 * @param chunksWritten number of flushed chunks
 * @param clippedSamples number of samples clamped to {@code [0, 1]}
 * @since 0.1.0
 */
public record CorrectionReport(
    Path outputData,
    Path outputHeader,
    CubeShape shape,
    double radianceScale,
    BandFactors factors,
    List<CorrectionWarning> warnings,
    long chunksWritten,
    long clippedSamples) {

  public CorrectionReport {
    Objects.requireNonNull(outputData, "outputData");
    Objects.requireNonNull(outputHeader, "outputHeader");
    Objects.requireNonNull(shape, "shape");
    Objects.requireNonNull(factors, "factors");
    warnings = List.copyOf(Objects.requireNonNull(warnings, "warnings"));
  }
}
