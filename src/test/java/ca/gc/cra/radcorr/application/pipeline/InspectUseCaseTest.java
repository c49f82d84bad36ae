package ca.gc.cra.radcorr.application.pipeline;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.radcorr.config.CubeStorageMode;
import ca.gc.cra.radcorr.config.InspectConfig;
import ca.gc.cra.radcorr.domain.cube.BandStatistics;
import ca.gc.cra.radcorr.domain.cube.CubeLayoutException;
import ca.gc.cra.radcorr.infrastructure.cube.FileCubeStorage;
import ca.gc.cra.radcorr.infrastructure.header.FileHeaderStore;
import ca.gc.cra.radcorr.testutil.CubeFixtures;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.OptionalInt;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class InspectUseCaseTest {
  @TempDir Path tempDir;

  private Path header;
  private Path data;

  @BeforeEach
  void setUp() throws IOException {
    data = CubeFixtures.writeCube(tempDir.resolve("cube.dat"), 3, 2, 2, (b, l, s) -> b + (l * 2 + s) / 10f);
    header = CubeFixtures.writeHeader(tempDir.resolve("cube.dat.hdr"), CubeFixtures.header(3, 2, 2,
        "description = {Radiance [mW/(cm^2*sr*um)] * 500]}",
        "wavelength = {400.0, 500.0, 600.0}"));
  }

  private InspectReport run(InspectConfig config) throws Exception {
    return new InspectUseCase(config, new FileHeaderStore(), new FileCubeStorage(CubeStorageMode.CHANNEL)).run();
  }

  @Test
  void headerOnlyReportsShapeAndScale() throws Exception {
    InspectReport report = run(new InspectConfig(
        header, Optional.empty(), OptionalInt.empty(), Optional.empty(), OptionalDouble.empty()));

    assertEquals(3, report.header().shape().bands());
    assertEquals(500.0, report.radianceScale().getAsDouble());
    assertTrue(report.statistics().isEmpty());
    assertTrue(report.spectrum().isEmpty());
  }

  @Test
  void bandStatisticsAndSpectrum() throws Exception {
    InspectReport report = run(new InspectConfig(header, Optional.of(data), OptionalInt.of(1),
        Optional.of(new InspectConfig.Pixel(1, 0)), OptionalDouble.empty()));

    BandStatistics stats = report.statistics().orElseThrow();
    assertEquals(1, stats.band());
    assertEquals(1.0, stats.min());
    assertEquals(1 + 3 / 10f, (float) stats.max());
    assertEquals(4L, stats.count());
    assertArrayEquals(new float[] {2 / 10f, 1 + 2 / 10f, 2 + 2 / 10f}, report.spectrum().orElseThrow());
  }

  @Test
  void wavelengthSelectsNearestBandForStatistics() throws Exception {
    InspectReport report = run(new InspectConfig(
        header, Optional.of(data), OptionalInt.empty(), Optional.empty(), OptionalDouble.of(590.0)));

    assertEquals(2, report.nearestBand().getAsInt());
    assertEquals(2, report.statistics().orElseThrow().band());
  }

  @Test
  void outOfRangeBandIsRejected() {
    InspectConfig config = new InspectConfig(
        header, Optional.of(data), OptionalInt.of(3), Optional.empty(), OptionalDouble.empty());

    assertThrows(IllegalArgumentException.class, () -> run(config));
  }

  @Test
  void truncatedCubeIsALayoutError() throws Exception {
    Files.write(data, new byte[8]);
    InspectConfig config = new InspectConfig(
        header, Optional.of(data), OptionalInt.of(0), Optional.empty(), OptionalDouble.empty());

    assertThrows(CubeLayoutException.class, () -> run(config));
  }
}
