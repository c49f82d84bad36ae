package ca.gc.cra.radcorr.application.pipeline;

import ca.gc.cra.radcorr.config.CorrectConfig;
import ca.gc.cra.radcorr.domain.correction.BandFactors;
import ca.gc.cra.radcorr.domain.correction.CorrectionWarning;
import ca.gc.cra.radcorr.domain.cube.CubeLayout;
import java.util.List;
import java.util.Objects;

/**
 * Everything a correction run decides before touching the file system: reconciled headers, per-band factors,
 * the radiance scale factor, and accumulated warnings.
 *
 * @param config run configuration
 * @param headers reconciled headers
 * @param factors correction factor per band
 * @param radianceScale scale factor parsed from the reference description, or the configured default
 * @param warnings non-fatal findings, in discovery order
 */
public record CorrectionPlan(
    CorrectConfig config,
    ReconciledHeaders headers,
    BandFactors factors,
    double radianceScale,
    List<CorrectionWarning> warnings) {

  public CorrectionPlan {
    Objects.requireNonNull(config, "config");
    Objects.requireNonNull(headers, "headers");
    Objects.requireNonNull(factors, "factors");
    warnings = List.copyOf(warnings);
  }

  /**
   * Returns the layout used to read the input cube.
   *
   * @return input layout
   */
  public CubeLayout inputLayout() {
    return CubeLayout.of(headers.source());
  }

  /**
   * Returns the rows moved per chunk: the configured chunk size, capped by the band height and by the largest
   * transfer {@link CubeLayout#MAX_CHUNK_BYTES} allows for this row width.
   *
   * @return rows per chunk, at least 1 for any plan built by {@link CorrectionUseCase#plan()}
   */
  public int chunkRows() {
    return Math.max(1, Math.min(config.chunkSize(), CubeLayout.maxChunkRows(headers.shape())));
  }

  /**
   * Returns the number of row chunks each band is split into.
   *
   * @return chunks per band
   */
  public int chunksPerBand() {
    int lines = headers.shape().lines();
    int rows = chunkRows();
    return (int) ((lines + (long) rows - 1) / rows);
  }
}
