package ca.gc.cra.radcorr.domain.header;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.ByteOrder;
import java.util.List;
import org.junit.jupiter.api.Test;

class HeaderModelTest {

  private static HeaderFields.Builder dims(long bands, long lines, long samples) {
    return HeaderFields.builder()
        .put("Samples", new HeaderField.IntegerValue(samples))
        .put("LINES", new HeaderField.IntegerValue(lines))
        .put("bands", new HeaderField.IntegerValue(bands));
  }

  @Test
  void buildsModelWithDefaultsForOptionalLayoutKeys() throws Exception {
    HeaderModel model = HeaderModel.from(dims(3, 4, 5).build());

    assertEquals(new CubeShape(3, 4, 5), model.shape());
    assertEquals(0L, model.headerOffset());
    assertEquals(ByteOrder.LITTLE_ENDIAN, model.byteOrder());
    assertTrue(model.wavelengths().isEmpty());
    assertTrue(model.passThrough().isEmpty());
  }

  @Test
  void missingDimensionNamesTheKey() {
    HeaderFields fields = HeaderFields.builder()
        .put("samples", new HeaderField.IntegerValue(2))
        .put("lines", new HeaderField.IntegerValue(2))
        .build();

    MissingFieldException ex = assertThrows(MissingFieldException.class, () -> HeaderModel.from(fields));
    assertEquals("bands", ex.key());
  }

  @Test
  void listValuedDimensionIsRejected() {
    HeaderFields fields = dims(2, 2, 2)
        .put("samples", new HeaderField.FloatListValue(List.of(1.0, 2.0)))
        .build();

    InvalidFieldException ex = assertThrows(InvalidFieldException.class, () -> HeaderModel.from(fields));
    assertEquals("samples", ex.key());
  }

  @Test
  void zeroDimensionIsRejected() {
    assertThrows(InvalidFieldException.class, () -> HeaderModel.from(dims(0, 2, 2).build()));
  }

  @Test
  void bigEndianAndOffsetAreRead() throws Exception {
    HeaderModel model = HeaderModel.from(dims(1, 1, 1)
        .put("header offset", new HeaderField.IntegerValue(128))
        .put("byte order", new HeaderField.IntegerValue(1))
        .build());

    assertEquals(128L, model.headerOffset());
    assertEquals(ByteOrder.BIG_ENDIAN, model.byteOrder());
  }

  @Test
  void unsupportedByteOrderIsRejected() {
    assertThrows(InvalidFieldException.class, () -> HeaderModel.from(dims(1, 1, 1)
        .put("byte order", new HeaderField.IntegerValue(2))
        .build()));
  }

  @Test
  void requireFloat32BsqRejectsOtherLayouts() throws Exception {
    HeaderModel.requireFloat32Bsq(dims(1, 1, 1).build());
    HeaderModel.requireFloat32Bsq(dims(1, 1, 1)
        .put("data type", new HeaderField.IntegerValue(4))
        .put("interleave", new HeaderField.TextValue("BSQ"))
        .build());

    InvalidFieldException type = assertThrows(InvalidFieldException.class, () -> HeaderModel.requireFloat32Bsq(
        dims(1, 1, 1).put("data type", new HeaderField.IntegerValue(12)).build()));
    assertEquals("data type", type.key());
    InvalidFieldException interleave = assertThrows(InvalidFieldException.class,
        () -> HeaderModel.requireFloat32Bsq(
            dims(1, 1, 1).put("interleave", new HeaderField.TextValue("bil")).build()));
    assertEquals("interleave", interleave.key());
  }

  @Test
  void fromAcceptsHeadersDescribingOtherDataTypes() throws Exception {
    HeaderModel model = HeaderModel.from(dims(2, 2, 2)
        .put("data type", new HeaderField.IntegerValue(12))
        .build());
    assertEquals(2, model.shape().bands());
  }

  @Test
  void wavelengthLookupAndNearestBand() throws Exception {
    HeaderModel model = HeaderModel.from(dims(3, 1, 1)
        .put("wavelength", new HeaderField.FloatListValue(List.of(400.0, 500.0, 600.0)))
        .build());

    assertTrue(model.wavelengthMatchesBands());
    assertEquals(500.0, model.wavelength(1).getAsDouble());
    assertTrue(model.wavelength(3).isEmpty());
    assertEquals(2, model.nearestBand(590.0).getAsInt());
    assertEquals(0, model.nearestBand(450.0).getAsInt(), "ties resolve to the lower band");
  }

  @Test
  void textWavelengthTableIsRejected() {
    assertThrows(InvalidFieldException.class, () -> HeaderModel.from(dims(2, 1, 1)
        .put("wavelength", new HeaderField.TextListValue(List.of("400", "n/a")))
        .build()));
  }

  @Test
  void passThroughKeepsDeclaredFieldsOnly() throws Exception {
    HeaderModel model = HeaderModel.from(dims(1, 1, 1)
        .put("sensor type", new HeaderField.TextValue("AFX10"))
        .put("wavelength units", new HeaderField.TextValue("Nanometers"))
        .put("gain", new HeaderField.TextValue("1"))
        .build());

    assertEquals(List.of("wavelength units", "sensor type"), List.copyOf(model.passThrough().keySet()));
    assertFalse(model.passThrough().containsKey("gain"));
  }
}
