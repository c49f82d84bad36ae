package ca.gc.cra.radcorr.application.pipeline;

import ca.gc.cra.radcorr.domain.correction.CorrectionWarning;
import ca.gc.cra.radcorr.domain.header.CubeShape;
import ca.gc.cra.radcorr.domain.header.HeaderField;
import ca.gc.cra.radcorr.domain.header.HeaderModel;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of reconciling a source header with its reference header.
 *
 * @param source validated source header, whose layout governs how the input cube is read
 * @param reference validated reference header
 * @param wavelengths wavelength table chosen for the correction and the output header
 * @param passThrough metadata copied to the output header
 * @param warnings non-fatal findings raised while reconciling
 */
public record ReconciledHeaders(
    HeaderModel source,
    HeaderModel reference,
    Optional<List<Double>> wavelengths,
    Map<String, HeaderField> passThrough,
    List<CorrectionWarning> warnings) {

  public ReconciledHeaders {
    Objects.requireNonNull(source, "source");
    Objects.requireNonNull(reference, "reference");
    wavelengths = Objects.requireNonNull(wavelengths, "wavelengths").map(List::copyOf);
    passThrough = Collections.unmodifiableMap(new LinkedHashMap<>(passThrough));
    warnings = List.copyOf(warnings);
  }

  /**
   * Returns the shared cube geometry.
   *
   * @return shape declared by both headers
   */
  public CubeShape shape() {
    return source.shape();
  }

  /**
   * Builds the header describing the corrected cube. An empty wavelength table is omitted.
   *
   * @param description text written to the {@code description} field
   * @return little-endian, zero-offset output header model
   */
  public HeaderModel outputModel(String description) {
    return HeaderModel.forOutput(
        shape(),
        wavelengths.filter(values -> !values.isEmpty()),
        new HeaderField.TextValue(description),
        passThrough);
  }
}
