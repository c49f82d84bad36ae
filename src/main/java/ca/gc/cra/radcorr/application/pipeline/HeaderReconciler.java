package ca.gc.cra.radcorr.application.pipeline;

import ca.gc.cra.radcorr.domain.correction.CorrectionWarning;
import ca.gc.cra.radcorr.domain.header.DimensionMismatchException;
import ca.gc.cra.radcorr.domain.header.HeaderField;
import ca.gc.cra.radcorr.domain.header.HeaderFields;
import ca.gc.cra.radcorr.domain.header.HeaderKeys;
import ca.gc.cra.radcorr.domain.header.HeaderModel;
import ca.gc.cra.radcorr.domain.header.InvalidFieldException;
import ca.gc.cra.radcorr.domain.header.MissingFieldException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Validates a source header against its reference header and merges what the output needs.
 * <p><strong>Why:</strong> Every dimensional and layout problem must surface before any output file exists.</p>
 * <p><strong>Role:</strong> Application service used by {@link CorrectionUseCase} for both dry runs and real runs.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Require a float32 band-sequential source and equal {@code samples}, {@code lines}, {@code bands}.</li>
 *   <li>Prefer the reference wavelength table and pass-through fields, falling back to the source.</li>
 *   <li>Flag wavelength tables whose length disagrees with the band count.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless.</p>
 *
 * @since 0.1.0
 */
public final class HeaderReconciler {
  private static final Logger log = LoggerFactory.getLogger(HeaderReconciler.class);

  /**
   * Reconciles the two headers.
   *
   * @param source fields of the header paired with the input cube
   * @param reference fields of the reference header
   * @return reconciled view
   * @throws MissingFieldException if either header lacks a dimension key
   * @throws InvalidFieldException if a field holds an unsupported value
   * @throws DimensionMismatchException if the headers disagree on any dimension
   */
  public ReconciledHeaders reconcile(HeaderFields source, HeaderFields reference)
      throws MissingFieldException, InvalidFieldException, DimensionMismatchException {
    Objects.requireNonNull(source, "source");
    Objects.requireNonNull(reference, "reference");
    HeaderModel.requireFloat32Bsq(source);
    HeaderModel sourceModel = HeaderModel.from(source);
    HeaderModel referenceModel = HeaderModel.from(reference);
    if (!sourceModel.shape().equals(referenceModel.shape())) {
      throw new DimensionMismatchException(sourceModel.shape(), referenceModel.shape());
    }

    HeaderModel wavelengthSource = referenceModel.wavelengths().isPresent() ? referenceModel : sourceModel;
    Optional<List<Double>> wavelengths = wavelengthSource.wavelengths();
    List<CorrectionWarning> warnings = new ArrayList<>(1);
    int bands = sourceModel.shape().bands();
    if (wavelengths.isPresent() && !wavelengthSource.wavelengthMatchesBands()) {
      int declared = wavelengths.get().size();
      String message = declared < bands
          ? "wavelength table lists " + declared + " values for " + bands
              + " bands; bands " + declared + ".." + (bands - 1) + " use factor 1.0"
          : "wavelength table lists " + declared + " values for " + bands
              + " bands; extra values are ignored by the correction";
      warnings.add(new CorrectionWarning(CorrectionWarning.Kind.WAVELENGTH_LENGTH_MISMATCH, message));
    }
    if (wavelengths.isEmpty()) {
      log.debug("Neither header declares wavelengths; every band uses factor 1.0");
    }

    Map<String, HeaderField> passThrough = new LinkedHashMap<>();
    for (String key : HeaderKeys.PASS_THROUGH) {
      Optional<HeaderField> value =
          Optional.ofNullable(referenceModel.passThrough().get(key))
              .or(() -> Optional.ofNullable(sourceModel.passThrough().get(key)));
      value.ifPresent(field -> passThrough.put(key, field));
    }
    return new ReconciledHeaders(sourceModel, referenceModel, wavelengths, passThrough, warnings);
  }
}
