package ca.gc.cra.radcorr.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.radcorr.testutil.CubeFixtures;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Path;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class InspectCliTest {
  @TempDir Path tempDir;

  private StringWriter buffer;
  private String originalExporter;
  private Path data;
  private Path header;

  @BeforeEach
  void setUp() throws IOException {
    originalExporter = System.getProperty(TelemetryConfigurator.EXPORTER_PROPERTY);
    buffer = new StringWriter();
    CliPrinter.setWriterForTesting(new PrintWriter(buffer));
    data = CubeFixtures.writeCube(tempDir.resolve("cube.dat"), 2, 2, 2, (b, l, s) -> b + l * 0.25f);
    header = CubeFixtures.writeHeader(tempDir.resolve("cube.dat.hdr"), CubeFixtures.header(2, 2, 2,
        "description = {Radiance [mW/(cm^2*sr*um)] * 500]}",
        "wavelength = {450.0, 650.0}"));
  }

  @AfterEach
  void tearDown() {
    CliPrinter.clearTestWriter();
    if (originalExporter == null) {
      System.clearProperty(TelemetryConfigurator.EXPORTER_PROPERTY);
    } else {
      System.setProperty(TelemetryConfigurator.EXPORTER_PROPERTY, originalExporter);
    }
  }

  @Test
  void summarizesHeaderOnly() {
    assertEquals(ExitCode.SUCCESS, InspectCli.run(new String[] {"header=" + header}));

    String text = buffer.toString();
    assertTrue(text.contains("Dimensions        : 2 bands x 2 lines x 2 samples"));
    assertTrue(text.contains("Wavelengths       : 2 (450.000000 .. 650.000000)"));
    assertTrue(text.contains("Radiance scale    : 500.000000"));
  }

  @Test
  void reportsStatisticsSpectrumAndNearestBand() {
    ExitCode code = InspectCli.run(new String[] {
        "header=" + header, "data=" + data, "band=1", "pixel=1,0", "wavelength=600"});

    assertEquals(ExitCode.SUCCESS, code);
    String text = buffer.toString();
    assertTrue(text.contains("Nearest band      : 1 (650.000000)"));
    assertTrue(text.contains("Band 1 statistics : min=1.000000 max=1.250000 mean=1.125000 count=4 nan=0"));
    assertTrue(text.contains("Spectrum 1,0    : 0.250000, 1.250000"));
  }

  @Test
  void bandWithoutDataIsInvalid() {
    assertEquals(ExitCode.INVALID_ARGS, InspectCli.run(new String[] {"header=" + header, "band=0"}));
    assertTrue(buffer.toString().contains("usage: inspect"));
  }

  @Test
  void bandOutOfRangeIsInvalid() {
    assertEquals(ExitCode.INVALID_ARGS,
        InspectCli.run(new String[] {"header=" + header, "data=" + data, "band=5"}));
  }

  @Test
  void malformedHeaderIsDataError() throws IOException {
    Path broken = CubeFixtures.writeHeader(tempDir.resolve("broken.hdr"), "ENVI\nsamples 4\n");

    assertEquals(ExitCode.DATA_ERROR, InspectCli.run(new String[] {"header=" + broken}));
  }

  @Test
  void missingHeaderFileIsInvalid() {
    assertEquals(ExitCode.INVALID_ARGS,
        InspectCli.run(new String[] {"header=" + tempDir.resolve("missing.hdr")}));
  }

  @Test
  void flagsAreRejected() {
    assertEquals(ExitCode.INVALID_ARGS, InspectCli.run(new String[] {"header=" + header, "--dry-run"}));
  }
}
