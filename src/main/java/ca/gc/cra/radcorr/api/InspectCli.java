package ca.gc.cra.radcorr.api;

import ca.gc.cra.radcorr.application.pipeline.InspectReport;
import ca.gc.cra.radcorr.config.CompositionRoot;
import ca.gc.cra.radcorr.config.DefaultsForMode;
import ca.gc.cra.radcorr.config.InspectConfig;
import ca.gc.cra.radcorr.domain.CorrectionException;
import ca.gc.cra.radcorr.domain.cube.BandStatistics;
import ca.gc.cra.radcorr.domain.header.HeaderModel;
import ca.gc.cra.radcorr.infrastructure.metrics.NoOpMetricsAdapter;
import ca.gc.cra.radcorr.logging.LoggingConfigurator;
import ca.gc.cra.radcorr.validation.Paths;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for the {@code inspect} command: summarizes a header and optionally reports band statistics,
 * a pixel spectrum, or the band nearest a wavelength.
 *
 * @since 0.1.0
 */
public final class InspectCli {
  private static final Logger log = LoggerFactory.getLogger(InspectCli.class);
  private static final String SUMMARY_USAGE =
      "usage: inspect header=PATH [data=PATH] [band=N] [pixel=LINE,SAMPLE] [wavelength=NM] [config=PATH]";
  private static final String HELP_TEXT = """
      RADCORR cube inspection

      Usage:
        inspect header=./scene_radcorr.dat.hdr data=./scene_radcorr.dat band=12

      Required:
        header=PATH            ENVI header to summarize

      Optional:
        data=PATH              Cube paired with the header (needed for band and pixel)
        band=N                 Zero-based band whose min/max/mean are reported
        pixel=LINE,SAMPLE      Zero-based pixel whose spectrum is printed
        wavelength=NM          Report the band nearest this wavelength (used for statistics when band is absent)
        config=PATH            YAML file with common/inspect sections
        --verbose              Enable DEBUG logging
        --help                 Show this message
      """;

  private InspectCli() {}

  public static void main(String[] args) {
    System.exit(run(args).code());
  }

  /**
   * Runs the command and maps the outcome to an exit code.
   *
   * @param args raw CLI arguments
   * @return exit code
   */
  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
    }

    CommandSupport.Effective effective =
        CommandSupport.effectiveConfig(DefaultsForMode.INSPECT, input, Set.of(), SUMMARY_USAGE, log);
    if (!effective.ok()) {
      return effective.failure();
    }
    Map<String, String> values = effective.values();

    InspectConfig config;
    try {
      TelemetryConfigurator.configureMetrics(values);
      config = InspectConfig.fromMap(values);
      config = new InspectConfig(
          Paths.requireReadableFile("header", config.header()),
          config.data().map(data -> Paths.requireReadableFile("data", data)),
          config.band(),
          config.pixel(),
          config.wavelength());
    } catch (IllegalArgumentException ex) {
      log.error("Invalid inspect arguments: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    InspectReport report;
    try (CompositionRoot root = new CompositionRoot(new NoOpMetricsAdapter())) {
      report = root.inspectUseCase(config).run();
    } catch (IllegalArgumentException ex) {
      log.error("Invalid inspect request: {}", ex.getMessage());
      return ExitCode.INVALID_ARGS;
    } catch (CorrectionException ex) {
      log.error("Cannot inspect {}: {}", config.header(), ex.getMessage());
      return ExitCode.DATA_ERROR;
    } catch (IOException ex) {
      log.error("Inspect I/O failure for {}", config.header(), ex);
      return ExitCode.IO_ERROR;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure in inspect", ex);
      return ExitCode.RUNTIME_FAILURE;
    }

    CliPrinter.printLines(render(config, report).toArray(String[]::new));
    return ExitCode.SUCCESS;
  }

  static List<String> render(InspectConfig config, InspectReport report) {
    HeaderModel header = report.header();
    List<String> lines = new ArrayList<>();
    lines.add("Header            : " + config.header());
    lines.add("Dimensions        : " + header.shape());
    lines.add("Header offset     : " + header.headerOffset());
    lines.add("Byte order        : " + header.byteOrder());
    lines.add("Wavelengths       : " + header.wavelengths()
        .filter(values -> !values.isEmpty())
        .map(values -> values.size() + " (" + format(values.get(0)) + " .. "
            + format(values.get(values.size() - 1)) + ")")
        .orElse("<none>"));
    lines.add("Radiance scale    : "
        + (report.radianceScale().isPresent() ? format(report.radianceScale().getAsDouble()) : "<none>"));
    if (config.wavelength().isPresent()) {
      lines.add("Nearest band      : " + (report.nearestBand().isPresent()
          ? report.nearestBand().getAsInt() + " ("
              + format(header.wavelength(report.nearestBand().getAsInt()).orElse(Double.NaN)) + ")"
          : "<no wavelengths>"));
    }
    Optional<BandStatistics> stats = report.statistics();
    stats.ifPresent(s -> lines.add(String.format(Locale.ROOT,
        "Band %d statistics : min=%.6f max=%.6f mean=%.6f count=%d nan=%d",
        s.band(), s.min(), s.max(), s.mean(), s.count(), s.nanCount())));
    report.spectrum().ifPresent(spectrum -> {
      InspectConfig.Pixel pixel = config.pixel().orElseThrow();
      StringBuilder sb = new StringBuilder();
      for (int i = 0; i < spectrum.length; i++) {
        if (i > 0) {
          sb.append(", ");
        }
        sb.append(String.format(Locale.ROOT, "%.6f", spectrum[i]));
      }
      lines.add("Spectrum " + pixel.line() + "," + pixel.sample() + "    : " + sb);
    });
    return lines;
  }

  private static String format(double value) {
    return String.format(Locale.ROOT, "%.6f", value);
  }
}
