package ca.gc.cra.radcorr.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Path;
import java.util.Map;
import org.junit.jupiter.api.Test;

class CorrectConfigTest {

  @Test
  void derivesHeadersAndOutputFromInput() {
    CorrectConfig config = CorrectConfig.fromMap(Map.of(
        "in", "/data/afx102_1_2026_reflectance.dat",
        "refHeader", "/data/afx102_1_2026_radiance.hdr"));

    assertEquals(Path.of("/data/afx102_1_2026_reflectance.dat.hdr"), config.inputHeader());
    assertEquals(Path.of("/data/afx102_1_2026_radcorr.dat"), config.outputData());
    assertEquals(Path.of("/data/afx102_1_2026_radcorr.dat.hdr"), config.outputHeader());
    assertEquals(CorrectConfig.DEFAULT_CHUNK_SIZE, config.chunkSize());
    assertEquals(CubeStorageMode.CHANNEL, config.storage());
    assertEquals(CorrectConfig.DEFAULT_SCALE_FACTOR, config.defaultScaleFactor());
    assertEquals(CorrectConfig.DEFAULT_DESCRIPTION, config.outputDescription());
  }

  @Test
  void markerIsOnlyReplacedInTheFileName() {
    assertEquals(Path.of("/reflectance/scene_radcorr.dat"),
        CorrectConfig.deriveOutput(Path.of("/reflectance/scene_reflectance.dat")));
  }

  @Test
  void inputWithoutMarkerGetsSuffixBeforeExtension() {
    assertEquals(Path.of("/data/cube_radcorr.img"), CorrectConfig.deriveOutput(Path.of("/data/cube.img")));
    assertEquals(Path.of("/data/cube_radcorr"), CorrectConfig.deriveOutput(Path.of("/data/cube")));
  }

  @Test
  void explicitValuesAreParsed() {
    CorrectConfig config = CorrectConfig.fromMap(Map.of(
        "in", "/data/in.dat",
        "inHeader", "/data/in.hdr",
        "refHeader", "/data/ref.hdr",
        "out", "/out/result.dat",
        "outHeader", "/out/result.hdr",
        "chunkSize", "64",
        "storage", "MMAP",
        "defaultScaleFactor", "100.5",
        "outputDescription", "Corrected by batch 7"));

    assertEquals(Path.of("/data/in.hdr"), config.inputHeader());
    assertEquals(Path.of("/out/result.hdr"), config.outputHeader());
    assertEquals(64, config.chunkSize());
    assertEquals(CubeStorageMode.MMAP, config.storage());
    assertEquals(100.5, config.defaultScaleFactor());
    assertEquals("Corrected by batch 7", config.outputDescription());
  }

  @Test
  void missingRequiredKeysAreRejected() {
    assertThrows(IllegalArgumentException.class, () -> CorrectConfig.fromMap(Map.of("in", "/data/in.dat")));
    assertThrows(IllegalArgumentException.class, () -> CorrectConfig.fromMap(Map.of("refHeader", "/data/r.hdr")));
  }

  @Test
  void chunkSizeIsBounded() {
    assertThrows(IllegalArgumentException.class, () -> CorrectConfig.fromMap(Map.of(
        "in", "/d/in.dat", "refHeader", "/d/r.hdr", "chunkSize", "0")));
    assertThrows(IllegalArgumentException.class, () -> CorrectConfig.fromMap(Map.of(
        "in", "/d/in.dat", "refHeader", "/d/r.hdr", "chunkSize", "1000001")));
    assertThrows(IllegalArgumentException.class, () -> CorrectConfig.fromMap(Map.of(
        "in", "/d/in.dat", "refHeader", "/d/r.hdr", "chunkSize", "lots")));
  }

  @Test
  void outputMayNotOverwriteAnInput() {
    assertThrows(IllegalArgumentException.class, () -> CorrectConfig.fromMap(Map.of(
        "in", "/d/in.dat", "refHeader", "/d/r.hdr", "out", "/d/./in.dat")));
    assertThrows(IllegalArgumentException.class, () -> CorrectConfig.fromMap(Map.of(
        "in", "/d/in.dat", "refHeader", "/d/r.hdr", "outHeader", "/d/r.hdr")));
    assertThrows(IllegalArgumentException.class, () -> CorrectConfig.fromMap(Map.of(
        "in", "/d/in.dat", "refHeader", "/d/r.hdr", "out", "/d/o.dat", "outHeader", "/d/o.dat")));
  }

  @Test
  void invalidScaleAndDescriptionAreRejected() {
    assertThrows(IllegalArgumentException.class, () -> CorrectConfig.fromMap(Map.of(
        "in", "/d/in.dat", "refHeader", "/d/r.hdr", "defaultScaleFactor", "-1")));
    assertThrows(IllegalArgumentException.class, () -> CorrectConfig.fromMap(Map.of(
        "in", "/d/in.dat", "refHeader", "/d/r.hdr", "outputDescription", "a {b}")));
    assertThrows(IllegalArgumentException.class, () -> CorrectConfig.fromMap(Map.of(
        "in", "/d/in.dat", "refHeader", "/d/r.hdr", "storage", "tape")));
  }

  @Test
  void descriptionWithCommaIsRejected() {
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class, () -> CorrectConfig.fromMap(Map.of(
        "in", "/d/in.dat", "refHeader", "/d/r.hdr", "outputDescription", "Corrected, v2")));
    assertTrue(ex.getMessage().contains("outputDescription"));
  }
}
