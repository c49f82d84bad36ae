package ca.gc.cra.radcorr.application.pipeline;

import ca.gc.cra.radcorr.application.port.CubeReader;
import ca.gc.cra.radcorr.application.port.CubeStoragePort;
import ca.gc.cra.radcorr.application.port.HeaderStorePort;
import ca.gc.cra.radcorr.config.InspectConfig;
import ca.gc.cra.radcorr.domain.CorrectionException;
import ca.gc.cra.radcorr.domain.cube.BandStatistics;
import ca.gc.cra.radcorr.domain.cube.CubeLayout;
import ca.gc.cra.radcorr.domain.header.CubeShape;
import ca.gc.cra.radcorr.domain.header.HeaderFields;
import ca.gc.cra.radcorr.domain.header.HeaderModel;
import ca.gc.cra.radcorr.domain.header.RadianceScaleParser;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Read-only inspection of a header and its cube: nearest band lookup, band statistics,
 * and single-pixel spectra.
 * <p><strong>Why:</strong> Gives display tooling and operators random access to corrected cubes without
 * loading them into memory.</p>
 * <p><strong>Thread-safety:</strong> Not thread-safe.</p>
 *
 * @since 0.1.0
 */
public final class InspectUseCase {
  private static final Logger log = LoggerFactory.getLogger(InspectUseCase.class);
  private static final int STATISTICS_CHUNK_SAMPLES = 1 << 20;

  private final InspectConfig config;
  private final HeaderStorePort headers;
  private final CubeStoragePort storage;

  /**
   * Creates an inspect use case.
   *
   * @param config inspection request
   * @param headers header store
   * @param storage cube storage used to open the data file read-only
   */
  public InspectUseCase(InspectConfig config, HeaderStorePort headers, CubeStoragePort storage) {
    this.config = Objects.requireNonNull(config, "config");
    this.headers = Objects.requireNonNull(headers, "headers");
    this.storage = Objects.requireNonNull(storage, "storage");
  }

  /**
   * Runs the inspection.
   *
   * @return report
   * @throws CorrectionException if the header is malformed or does not describe the data file
   * @throws IOException if a file cannot be read
   * @throws IllegalArgumentException if the requested band or pixel lies outside the cube
   */
  public InspectReport run() throws CorrectionException, IOException {
    HeaderFields fields = headers.read(config.header());
    HeaderModel header = HeaderModel.from(fields);
    CubeShape shape = header.shape();
    log.info("Inspecting {} ({})", config.header(), shape);

    OptionalInt nearest = OptionalInt.empty();
    if (config.wavelength().isPresent()) {
      nearest = header.nearestBand(config.wavelength().getAsDouble());
      if (nearest.isEmpty()) {
        log.warn("Header {} declares no wavelengths; cannot resolve {}", config.header(),
            config.wavelength().getAsDouble());
      }
    }

    OptionalInt band = config.band().isPresent() ? config.band() : nearest;
    band.ifPresent(b -> requireIndex("band", b, shape.bands()));
    config.pixel().ifPresent(pixel -> {
      requireIndex("pixel line", pixel.line(), shape.lines());
      requireIndex("pixel sample", pixel.sample(), shape.samples());
    });

    Optional<BandStatistics> statistics = Optional.empty();
    Optional<float[]> spectrum = Optional.empty();
    if (config.data().isPresent()) {
      HeaderModel.requireFloat32Bsq(fields);
      Path data = config.data().get();
      try (CubeReader reader = storage.openReader(data, CubeLayout.of(header))) {
        if (band.isPresent()) {
          statistics = Optional.of(statistics(reader, band.getAsInt()));
        }
        if (config.pixel().isPresent()) {
          InspectConfig.Pixel pixel = config.pixel().get();
          spectrum = Optional.of(reader.readSpectrum(pixel.line(), pixel.sample()));
        }
      }
    }
    return new InspectReport(
        header, RadianceScaleParser.parse(header.description()), nearest, statistics, spectrum);
  }

  private static BandStatistics statistics(CubeReader reader, int band) throws IOException {
    CubeShape shape = reader.layout().shape();
    int rows = Math.max(1, Math.min(shape.lines(), STATISTICS_CHUNK_SAMPLES / shape.samples()));
    float[] buffer = new float[Math.multiplyExact(rows, shape.samples())];
    BandStatistics.Accumulator acc = BandStatistics.accumulate(band);
    for (int first = 0; first < shape.lines(); first += rows) {
      int count = Math.min(rows, shape.lines() - first);
      reader.readRows(band, first, count, buffer);
      acc.add(buffer, count * shape.samples());
    }
    return acc.result();
  }

  private static void requireIndex(String name, int value, int size) {
    if (value < 0 || value >= size) {
      throw new IllegalArgumentException(name + " must be between 0 and " + (size - 1) + " (was " + value + ")");
    }
  }
}
