package ca.gc.cra.radcorr.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Path;
import java.util.Map;
import org.junit.jupiter.api.Test;

class InspectConfigTest {

  @Test
  void parsesAllOptions() {
    InspectConfig config = InspectConfig.fromMap(Map.of(
        "header", "/d/cube.hdr",
        "data", "/d/cube.dat",
        "band", "7",
        "pixel", "10, 20",
        "wavelength", "550.5"));

    assertEquals(Path.of("/d/cube.hdr"), config.header());
    assertEquals(Path.of("/d/cube.dat"), config.data().orElseThrow());
    assertEquals(7, config.band().getAsInt());
    assertEquals(new InspectConfig.Pixel(10, 20), config.pixel().orElseThrow());
    assertEquals(550.5, config.wavelength().getAsDouble());
  }

  @Test
  void blankOptionalValuesAreAbsent() {
    InspectConfig config = InspectConfig.fromMap(Map.of("header", "/d/cube.hdr", "band", "", "data", " "));

    assertTrue(config.data().isEmpty());
    assertTrue(config.band().isEmpty());
  }

  @Test
  void bandAndPixelRequireData() {
    assertThrows(IllegalArgumentException.class,
        () -> InspectConfig.fromMap(Map.of("header", "/d/cube.hdr", "band", "1")));
    assertThrows(IllegalArgumentException.class,
        () -> InspectConfig.fromMap(Map.of("header", "/d/cube.hdr", "pixel", "1,1")));
  }

  @Test
  void malformedValuesAreRejected() {
    assertThrows(IllegalArgumentException.class, () -> InspectConfig.fromMap(Map.of()));
    assertThrows(IllegalArgumentException.class,
        () -> InspectConfig.fromMap(Map.of("header", "/h", "data", "/d", "band", "-1")));
    assertThrows(IllegalArgumentException.class,
        () -> InspectConfig.fromMap(Map.of("header", "/h", "data", "/d", "pixel", "1,2,3")));
    assertThrows(IllegalArgumentException.class,
        () -> InspectConfig.fromMap(Map.of("header", "/h", "wavelength", "NaN")));
  }
}
