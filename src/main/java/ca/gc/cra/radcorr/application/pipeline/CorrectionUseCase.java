package ca.gc.cra.radcorr.application.pipeline;

import ca.gc.cra.radcorr.application.port.CubeReader;
import ca.gc.cra.radcorr.application.port.CubeStoragePort;
import ca.gc.cra.radcorr.application.port.CubeWriter;
import ca.gc.cra.radcorr.application.port.HeaderStorePort;
import ca.gc.cra.radcorr.application.port.MetricsPort;
import ca.gc.cra.radcorr.config.CorrectConfig;
import ca.gc.cra.radcorr.domain.CorrectionException;
import ca.gc.cra.radcorr.domain.correction.BandFactors;
import ca.gc.cra.radcorr.domain.correction.ChunkCorrector;
import ca.gc.cra.radcorr.domain.correction.CorrectionReport;
import ca.gc.cra.radcorr.domain.correction.CorrectionWarning;
import ca.gc.cra.radcorr.domain.cube.CubeLayout;
import ca.gc.cra.radcorr.domain.cube.CubeLayoutException;
import ca.gc.cra.radcorr.domain.header.CubeShape;
import ca.gc.cra.radcorr.domain.header.HeaderFields;
import ca.gc.cra.radcorr.domain.header.RadianceScaleParser;
import ca.gc.cra.radcorr.logging.Logs;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.OptionalDouble;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * <strong>What:</strong> Streams a float32 band-sequential cube through the per-band radiometric correction.
 * <p><strong>Why:</strong> Cubes are far larger than memory, so each band is processed in row chunks that are
 * flushed to durable storage before the next one is read.</p>
 * <p><strong>Role:</strong> Application-layer use case driven by the {@code correct} CLI.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Parse and reconcile both headers before any output file is touched.</li>
 *   <li>Remove a stale output header, then allocate the output cube at full size.</li>
 *   <li>For each band in ascending order, read, scale, clip, write and flush every row chunk.</li>
 *   <li>Write the output header only after the data file has been flushed and closed.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Not thread-safe; one run per instance at a time.</p>
 * <p><strong>Performance:</strong> Memory is bounded by one chunk of {@code chunkRows * samples} floats.</p>
 * <p><strong>Observability:</strong> Emits {@code correct.*} metrics and sets MDC keys {@code radcorr.in} and
 * {@code band}.</p>
 *
 * @since 0.1.0
 */
public final class CorrectionUseCase {
  private static final Logger log = LoggerFactory.getLogger(CorrectionUseCase.class);
  private static final int LOG_TEXT_BYTES = 256;

  static final String MDC_INPUT = "radcorr.in";
  static final String MDC_BAND = "band";
  static final String METRIC_CHUNKS_WRITTEN = "correct.chunks.written";
  static final String METRIC_BANDS_COMPLETED = "correct.bands.completed";
  static final String METRIC_WARNINGS = "correct.warnings";
  static final String METRIC_CHUNK_LATENCY = "correct.chunk.latencyNanos";
  static final String METRIC_BAND_CLIPPED = "correct.band.clippedPixels";

  private final CorrectConfig config;
  private final HeaderStorePort headers;
  private final CubeStoragePort storage;
  private final MetricsPort metrics;
  private final HeaderReconciler reconciler = new HeaderReconciler();

  /**
   * Creates a correction use case.
   *
   * @param config run configuration; must not be {@code null}
   * @param headers header store used for both input headers and the output header
   * @param storage cube storage used for the input reader and output writer
   * @param metrics metrics sink; use {@link MetricsPort#NO_OP} to disable
   */
  public CorrectionUseCase(
      CorrectConfig config, HeaderStorePort headers, CubeStoragePort storage, MetricsPort metrics) {
    this.config = Objects.requireNonNull(config, "config");
    this.headers = Objects.requireNonNull(headers, "headers");
    this.storage = Objects.requireNonNull(storage, "storage");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Reads and reconciles both headers and computes the correction parameters without writing anything.
   *
   * @return plan for the run
   * @throws CorrectionException if a header is malformed, incomplete, or the headers disagree, or a single row
   *     is too wide to transfer in one chunk
   * @throws IOException if a header cannot be read
   */
  public CorrectionPlan plan() throws CorrectionException, IOException {
    HeaderFields source = headers.read(config.inputHeader());
    HeaderFields reference = headers.read(config.referenceHeader());
    ReconciledHeaders reconciled = reconciler.reconcile(source, reference);

    CubeShape shape = reconciled.shape();
    int maxRows = CubeLayout.maxChunkRows(shape);
    if (maxRows == 0) {
      throw new CubeLayoutException("rows of " + shape.samples() + " samples exceed the "
          + CubeLayout.MAX_CHUNK_BYTES + "-byte chunk limit");
    }
    List<CorrectionWarning> warnings = new ArrayList<>(reconciled.warnings());
    if (config.chunkSize() > maxRows && maxRows < shape.lines()) {
      warnings.add(new CorrectionWarning(
          CorrectionWarning.Kind.CHUNK_SIZE_REDUCED,
          "chunkSize " + config.chunkSize() + " exceeds the chunk limit for rows of " + shape.samples()
              + " samples; using " + maxRows + " rows"));
    }
    OptionalDouble parsedScale = RadianceScaleParser.parse(reconciled.reference().description());
    double radianceScale;
    if (parsedScale.isPresent()) {
      radianceScale = parsedScale.getAsDouble();
    } else {
      radianceScale = config.defaultScaleFactor();
      String described = reconciled.reference().description()
          .map(field -> "'" + Logs.truncate(field.text(), LOG_TEXT_BYTES) + "'")
          .orElse("absent");
      warnings.add(new CorrectionWarning(
          CorrectionWarning.Kind.SCALE_FACTOR_DEFAULTED,
          "no radiance scale factor in reference description (" + described + "); using " + radianceScale));
    }

    BandFactors factors = BandFactors.fromWavelengths(reconciled.wavelengths(), reconciled.shape().bands());
    return new CorrectionPlan(config, reconciled, factors, radianceScale, warnings);
  }

  /**
   * Executes the correction.
   *
   * @return report describing the written outputs
   * @throws CorrectionException if validation or output allocation fails; no output header is written
   * @throws IOException if reading or writing cube data fails; no output header is written
   */
  public CorrectionReport run() throws CorrectionException, IOException {
    MDC.put(MDC_INPUT, config.inputData().toString());
    try {
      CorrectionPlan plan = plan();
      CubeShape shape = plan.headers().shape();
      log.info("Correcting {} ({}) with reference {}", config.inputData(), shape, config.referenceHeader());
      log.info("Radiance scale factor {}", plan.radianceScale());
      for (CorrectionWarning warning : plan.warnings()) {
        log.warn("{}: {}", warning.kind(), warning.message());
        metrics.increment(METRIC_WARNINGS);
      }

      Totals totals;
      try (CubeReader reader = storage.openReader(config.inputData(), plan.inputLayout())) {
        headers.delete(config.outputHeader());
        try (CubeWriter writer = storage.create(config.outputData(), shape)) {
          totals = correctBands(plan, reader, writer);
        }
      } catch (IOException | CorrectionException ex) {
        log.error("Correction of {} failed; no header written for {}", config.inputData(), config.outputData());
        throw ex;
      }

      headers.write(config.outputHeader(), plan.headers().outputModel(config.outputDescription()));
      log.info("Wrote {} and {} ({} chunks, {} samples clipped)",
          config.outputData(), config.outputHeader(), totals.chunks(), totals.clipped());
      return new CorrectionReport(
          config.outputData(),
          config.outputHeader(),
          shape,
          plan.radianceScale(),
          plan.factors(),
          plan.warnings(),
          totals.chunks(),
          totals.clipped());
    } finally {
      MDC.remove(MDC_INPUT);
    }
  }

  private Totals correctBands(CorrectionPlan plan, CubeReader reader, CubeWriter writer) throws IOException {
    CubeShape shape = plan.headers().shape();
    int chunkRows = plan.chunkRows();
    float[] buffer = new float[Math.multiplyExact(chunkRows, shape.samples())];
    long chunks = 0;
    long clippedTotal = 0;
    for (int band = 0; band < shape.bands(); band++) {
      MDC.put(MDC_BAND, Integer.toString(band));
      try {
        double factor = plan.factors().factor(band);
        log.debug("Band {}/{} factor {}", band + 1, shape.bands(), factor);
        long clipped = 0;
        for (int first = 0; first < shape.lines(); first += chunkRows) {
          int rows = Math.min(chunkRows, shape.lines() - first);
          int length = rows * shape.samples();
          long started = System.nanoTime();
          reader.readRows(band, first, rows, buffer);
          clipped += ChunkCorrector.apply(buffer, length, factor);
          writer.writeRows(band, first, rows, buffer);
          writer.flush();
          metrics.observe(METRIC_CHUNK_LATENCY, System.nanoTime() - started);
          metrics.increment(METRIC_CHUNKS_WRITTEN);
          chunks++;
        }
        metrics.observe(METRIC_BAND_CLIPPED, clipped);
        metrics.increment(METRIC_BANDS_COMPLETED);
        clippedTotal += clipped;
      } finally {
        MDC.remove(MDC_BAND);
      }
    }
    return new Totals(chunks, clippedTotal);
  }

  private record Totals(long chunks, long clipped) {}
}
