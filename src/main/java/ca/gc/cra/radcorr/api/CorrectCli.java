package ca.gc.cra.radcorr.api;

import ca.gc.cra.radcorr.application.pipeline.CorrectionPlan;
import ca.gc.cra.radcorr.application.pipeline.CorrectionUseCase;
import ca.gc.cra.radcorr.config.CompositionRoot;
import ca.gc.cra.radcorr.config.CorrectConfig;
import ca.gc.cra.radcorr.config.DefaultsForMode;
import ca.gc.cra.radcorr.domain.CorrectionException;
import ca.gc.cra.radcorr.domain.correction.CorrectionReport;
import ca.gc.cra.radcorr.domain.correction.CorrectionWarning;
import ca.gc.cra.radcorr.domain.cube.OutputAllocationException;
import ca.gc.cra.radcorr.infrastructure.metrics.NoOpMetricsAdapter;
import ca.gc.cra.radcorr.logging.LoggingConfigurator;
import ca.gc.cra.radcorr.validation.Paths;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for the {@code correct} command: applies the wavelength-dependent radiometric correction to a
 * float32 BSQ reflectance cube.
 *
 * @since 0.1.0
 */
public final class CorrectCli {
  private static final Logger log = LoggerFactory.getLogger(CorrectCli.class);
  private static final Set<String> FLAGS = Set.of("--dry-run", "--allow-overwrite");
  private static final String SUMMARY_USAGE =
      "usage: correct in=PATH refHeader=PATH [inHeader=PATH] [out=PATH] [outHeader=PATH] "
          + "[chunkSize=N] [storage=channel|mmap] [defaultScaleFactor=X] [outputDescription=TEXT] "
          + "[config=PATH] [--dry-run] [--allow-overwrite] [metricsExporter=otlp|none] [otelEndpoint=URL]";
  private static final String HELP_TEXT = """
      RADCORR radiometric correction

      Usage:
        correct in=./scene_reflectance.dat refHeader=./scene_radiance.hdr [options]

      Required:
        in=PATH                    Source reflectance cube (float32, band-sequential)
        refHeader=PATH             Reference (radiance) header supplying wavelengths and metadata

      Optional:
        inHeader=PATH              Source header (default: in + .hdr)
        out=PATH                   Corrected cube (default: 'reflectance' -> 'radcorr' in the file name,
                                   otherwise _radcorr before the extension)
        outHeader=PATH             Corrected header (default: out + .hdr)
        chunkSize=N                Rows per chunk, 1..1000000 (default 500)
        storage=channel|mmap       Output write strategy (default channel)
        defaultScaleFactor=X       Radiance scale used when the reference description has none (default 1000)
        outputDescription=TEXT     Description written to the output header
        config=PATH                YAML file with common/correct sections
        --dry-run                  Read and reconcile headers, print the plan, write nothing
        --allow-overwrite          Replace existing output files
        metricsExporter=otlp|none  Metrics exporter (default none)
        otelEndpoint=URL           OTLP metrics endpoint when exporter=otlp
        otelResourceAttributes=K=V Comma-separated OTel resource attributes
        --verbose                  Enable DEBUG logging
        --help                     Show this message

      Notes:
        The output header is written only after every band has been flushed.
        Exit codes: 0 ok, 2 bad arguments, 3 I/O failure, 4 configuration error, 6 invalid header or cube data.
      """;

  private CorrectCli() {}

  /**
   * Entry point invoked by the JVM.
   *
   * @param args raw CLI arguments
   */
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
      log.debug("Verbose logging enabled for correct CLI");
    }

    CommandSupport.Effective effective =
        CommandSupport.effectiveConfig(DefaultsForMode.CORRECT, input, FLAGS, SUMMARY_USAGE, log);
    if (!effective.ok()) {
      return effective.failure();
    }
    Map<String, String> values = effective.values();
    boolean dryRun = input.hasFlag("--dry-run") || ConfigCliUtils.parseBoolean(values, "dryRun");
    boolean allowOverwrite =
        input.hasFlag("--allow-overwrite") || ConfigCliUtils.parseBoolean(values, "allowOverwrite");
    if (ConfigCliUtils.parseBoolean(values, "verbose") && !input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
    }

    String metricsExporter;
    CorrectConfig config;
    try {
      metricsExporter = TelemetryConfigurator.configureMetrics(values);
      config = validatePaths(CorrectConfig.fromMap(values), allowOverwrite);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid correct arguments: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    if (dryRun) {
      return dryRun(config, allowOverwrite);
    }

    log.info("Configured correction: in={}, refHeader={}, out={}, chunkSize={}, storage={}, metricsExporter={}",
        config.inputData(), config.referenceHeader(), config.outputData(), config.chunkSize(),
        config.storage(), metricsExporter);
    try (CompositionRoot root = new CompositionRoot()) {
      CorrectionReport report = root.correctionUseCase(config).run();
      printSummary(report);
      return ExitCode.SUCCESS;
    } catch (OutputAllocationException ex) {
      log.error("Unable to allocate {}: {}", config.outputData(), ex.getMessage(), ex);
      return ExitCode.IO_ERROR;
    } catch (CorrectionException ex) {
      log.error("Correction rejected {}: {}", config.inputData(), ex.getMessage());
      return ExitCode.DATA_ERROR;
    } catch (IOException ex) {
      log.error("Correction I/O failure while processing {}", config.inputData(), ex);
      return ExitCode.IO_ERROR;
    } catch (IllegalArgumentException ex) {
      log.error("Correction configuration error: {}", ex.getMessage(), ex);
      return ExitCode.CONFIG_ERROR;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure in correction", ex);
      return ExitCode.RUNTIME_FAILURE;
    }
  }

  private static CorrectConfig validatePaths(CorrectConfig config, boolean allowOverwrite) {
    Path in = Paths.requireReadableFile("in", config.inputData());
    Path inHeader = Paths.requireReadableFile("inHeader", config.inputHeader());
    Path refHeader = Paths.requireReadableFile("refHeader", config.referenceHeader());
    Path out = Paths.requireWritableFile("out", config.outputData(), allowOverwrite);
    Path outHeader = Paths.requireWritableFile("outHeader", config.outputHeader(), allowOverwrite);
    Paths.requireDistinct("out", out, in, inHeader, refHeader);
    Paths.requireDistinct("outHeader", outHeader, in, inHeader, refHeader, out);
    return config.withInputs(in, inHeader, refHeader).withOutputs(out, outHeader);
  }

  private static ExitCode dryRun(CorrectConfig config, boolean allowOverwrite) {
    CorrectionPlan plan;
    try (CompositionRoot root = new CompositionRoot(new NoOpMetricsAdapter())) {
      CorrectionUseCase useCase = root.correctionUseCase(config);
      plan = useCase.plan();
    } catch (CorrectionException ex) {
      log.error("Dry run rejected {}: {}", config.inputData(), ex.getMessage());
      return ExitCode.DATA_ERROR;
    } catch (IOException ex) {
      log.error("Dry run could not read headers", ex);
      return ExitCode.IO_ERROR;
    }

    List<String> lines = new ArrayList<>(List.of(
        "Correct dry-run: no files will be written.",
        " Input cube        : " + config.inputData(),
        " Input header      : " + config.inputHeader(),
        " Reference header  : " + config.referenceHeader(),
        " Output cube       : " + config.outputData(),
        " Output header     : " + config.outputHeader(),
        " Dimensions        : " + plan.headers().shape(),
        " Output size       : " + plan.headers().shape().byteSize() + " bytes",
        " Chunk size        : " + plan.chunkRows() + " rows (" + plan.chunksPerBand() + " chunks per band)",
        " Storage           : " + config.storage(),
        " Radiance scale    : " + plan.radianceScale(),
        " Band factors      : " + plan.factors(),
        " Allow overwrite   : " + allowOverwrite));
    for (CorrectionWarning warning : plan.warnings()) {
      lines.add(" Warning           : " + warning.kind() + ": " + warning.message());
    }
    lines.add(" Re-run without --dry-run to correct the cube.");
    CliPrinter.printLines(lines.toArray(String[]::new));
    return ExitCode.SUCCESS;
  }

  private static void printSummary(CorrectionReport report) {
    CliPrinter.printLines(
        "Corrected cube    : " + report.outputData(),
        "Header            : " + report.outputHeader(),
        "Dimensions        : " + report.shape(),
        "Chunks written    : " + report.chunksWritten(),
        "Samples clipped   : " + report.clippedSamples(),
        "Warnings          : " + report.warnings().size());
  }
}
