package ca.gc.cra.radcorr.domain.correction;

import java.util.Objects;

/**
 * Non-fatal condition surfaced by a correction run; a default was applied and processing continued.
 *
 * @param kind warning category
 * @param message human-readable detail
 * @since 0.1.0
 */
public record CorrectionWarning(Kind kind, String message) {

  public CorrectionWarning {
    Objects.requireNonNull(kind, "kind");
    Objects.requireNonNull(message, "message");
  }

  /** Warning categories. */
  public enum Kind {
    /** Description held no parsable radiance scale factor; the configured default was used. */
    SCALE_FACTOR_DEFAULTED,
    /** Wavelength table length differs from the band count; unmatched bands use factor 1.0. */
    WAVELENGTH_LENGTH_MISMATCH,
    /** Configured chunk size would exceed a single I/O transfer for this row width; fewer rows are used. */
    CHUNK_SIZE_REDUCED
  }
}
