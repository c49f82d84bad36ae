package ca.gc.cra.radcorr.application.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.radcorr.domain.correction.CorrectionWarning;
import ca.gc.cra.radcorr.domain.header.CubeShape;
import ca.gc.cra.radcorr.domain.header.DimensionMismatchException;
import ca.gc.cra.radcorr.domain.header.HeaderField;
import ca.gc.cra.radcorr.domain.header.HeaderFields;
import ca.gc.cra.radcorr.domain.header.HeaderModel;
import ca.gc.cra.radcorr.domain.header.InvalidFieldException;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class HeaderReconcilerTest {
  private final HeaderReconciler reconciler = new HeaderReconciler();

  private static HeaderFields.Builder dims(int bands, int lines, int samples) {
    return HeaderFields.builder()
        .put("samples", new HeaderField.IntegerValue(samples))
        .put("lines", new HeaderField.IntegerValue(lines))
        .put("bands", new HeaderField.IntegerValue(bands));
  }

  @Test
  void referenceWavelengthsAndMetadataWin() throws Exception {
    HeaderFields source = dims(2, 3, 4)
        .put("wavelength", new HeaderField.FloatListValue(List.of(1.0, 2.0)))
        .put("sensor type", new HeaderField.TextValue("source-sensor"))
        .put("acquisition date", new HeaderField.TextValue("2026-01-01"))
        .build();
    HeaderFields reference = dims(2, 3, 4)
        .put("wavelength", new HeaderField.FloatListValue(List.of(500.0, 600.0)))
        .put("sensor type", new HeaderField.TextValue("AFX10"))
        .build();

    ReconciledHeaders result = reconciler.reconcile(source, reference);

    assertEquals(new CubeShape(2, 3, 4), result.shape());
    assertEquals(Optional.of(List.of(500.0, 600.0)), result.wavelengths());
    assertEquals(new HeaderField.TextValue("AFX10"), result.passThrough().get("sensor type"));
    assertEquals(new HeaderField.TextValue("2026-01-01"), result.passThrough().get("acquisition date"));
    assertTrue(result.warnings().isEmpty());
  }

  @Test
  void sourceWavelengthsAreUsedWhenReferenceHasNone() throws Exception {
    HeaderFields source = dims(1, 1, 1)
        .put("wavelength", new HeaderField.FloatListValue(List.of(700.0)))
        .build();

    ReconciledHeaders result = reconciler.reconcile(source, dims(1, 1, 1).build());

    assertEquals(Optional.of(List.of(700.0)), result.wavelengths());
  }

  @Test
  void dimensionMismatchCarriesBothShapes() {
    DimensionMismatchException ex = assertThrows(DimensionMismatchException.class,
        () -> reconciler.reconcile(dims(2, 3, 4).build(), dims(2, 3, 5).build()));

    assertEquals(new CubeShape(2, 3, 4), ex.source());
    assertEquals(new CubeShape(2, 3, 5), ex.reference());
  }

  @Test
  void shortWavelengthTableRaisesWarning() throws Exception {
    HeaderFields reference = dims(3, 1, 1)
        .put("wavelength", new HeaderField.FloatListValue(List.of(500.0)))
        .build();

    ReconciledHeaders result = reconciler.reconcile(dims(3, 1, 1).build(), reference);

    assertEquals(1, result.warnings().size());
    assertEquals(CorrectionWarning.Kind.WAVELENGTH_LENGTH_MISMATCH, result.warnings().get(0).kind());
  }

  @Test
  void longSourceTableRaisesWarningWhenReferenceHasNone() throws Exception {
    HeaderFields source = dims(1, 1, 1)
        .put("wavelength", new HeaderField.FloatListValue(List.of(500.0, 600.0)))
        .build();

    ReconciledHeaders result = reconciler.reconcile(source, dims(1, 1, 1).build());

    assertEquals(Optional.of(List.of(500.0, 600.0)), result.wavelengths());
    assertEquals(List.of(CorrectionWarning.Kind.WAVELENGTH_LENGTH_MISMATCH),
        result.warnings().stream().map(CorrectionWarning::kind).toList());
  }

  @Test
  void matchingReferenceTableOverridesMismatchedSource() throws Exception {
    HeaderFields source = dims(2, 1, 1)
        .put("wavelength", new HeaderField.FloatListValue(List.of(500.0)))
        .build();
    HeaderFields reference = dims(2, 1, 1)
        .put("wavelength", new HeaderField.FloatListValue(List.of(500.0, 900.0)))
        .build();

    assertTrue(reconciler.reconcile(source, reference).warnings().isEmpty());
  }

  @Test
  void nonFloatSourceIsRejectedButReferenceLayoutIsIgnored() throws Exception {
    HeaderFields intSource = dims(1, 1, 1).put("data type", new HeaderField.IntegerValue(2)).build();
    assertThrows(InvalidFieldException.class, () -> reconciler.reconcile(intSource, dims(1, 1, 1).build()));

    HeaderFields intReference = dims(1, 1, 1)
        .put("data type", new HeaderField.IntegerValue(12))
        .put("interleave", new HeaderField.TextValue("bil"))
        .build();
    ReconciledHeaders result = reconciler.reconcile(dims(1, 1, 1).build(), intReference);
    assertEquals(1, result.shape().bands());
  }

  @Test
  void outputModelDropsEmptyWavelengthTable() throws Exception {
    HeaderFields reference = dims(1, 1, 1)
        .put("wavelength", new HeaderField.FloatListValue(List.of()))
        .build();

    HeaderModel output = reconciler.reconcile(dims(1, 1, 1).build(), reference).outputModel("corrected");

    assertTrue(output.wavelengths().isEmpty());
    assertEquals(Optional.of(new HeaderField.TextValue("corrected")), output.description());
  }
}
