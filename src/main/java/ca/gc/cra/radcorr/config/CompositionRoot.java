package ca.gc.cra.radcorr.config;

import ca.gc.cra.radcorr.application.pipeline.CorrectionUseCase;
import ca.gc.cra.radcorr.application.pipeline.InspectUseCase;
import ca.gc.cra.radcorr.application.port.CubeStoragePort;
import ca.gc.cra.radcorr.application.port.HeaderStorePort;
import ca.gc.cra.radcorr.application.port.MetricsPort;
import ca.gc.cra.radcorr.infrastructure.cube.FileCubeStorage;
import ca.gc.cra.radcorr.infrastructure.header.FileHeaderStore;
import ca.gc.cra.radcorr.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import java.util.Objects;

/**
 * <strong>What:</strong> Composition root wiring RADCORR use cases to file adapters and metrics.
 * <p><strong>Why:</strong> Keeps adapter selection (storage backend, metrics exporter) in one place.</p>
 * <p><strong>Role:</strong> Bootstrap layer invoked by the CLI after configuration is merged.</p>
 * <p><strong>Thread-safety:</strong> Factories allocate new use cases; not synchronized.</p>
 * <p><strong>Observability:</strong> Owns the metrics adapter and flushes it on {@link #close()}.</p>
 *
 * @since 0.1.0
 */
public final class CompositionRoot implements AutoCloseable {
  private final MetricsPort metrics;
  private final HeaderStorePort headerStore;

  /**
   * Creates a root whose metrics follow the {@code otel.*} system properties and environment.
   */
  public CompositionRoot() {
    this(new OpenTelemetryMetricsAdapter());
  }

  /**
   * Creates a root with an explicit metrics adapter.
   *
   * @param metrics metrics adapter shared by constructed use cases
   */
  public CompositionRoot(MetricsPort metrics) {
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.headerStore = new FileHeaderStore();
  }

  /**
   * Builds the correction use case for {@code config}.
   *
   * @param config validated correction configuration
   * @return use case ready to run
   */
  public CorrectionUseCase correctionUseCase(CorrectConfig config) {
    return new CorrectionUseCase(config, headerStore, cubeStorage(config.storage()), metrics);
  }

  /**
   * Builds the inspect use case for {@code config}.
   *
   * @param config validated inspect configuration
   * @return use case ready to run
   */
  public InspectUseCase inspectUseCase(InspectConfig config) {
    return new InspectUseCase(config, headerStore, cubeStorage(CubeStorageMode.CHANNEL));
  }

  /**
   * Returns the metrics adapter shared by use cases.
   *
   * @return metrics port
   */
  public MetricsPort metrics() {
    return metrics;
  }

  CubeStoragePort cubeStorage(CubeStorageMode mode) {
    return new FileCubeStorage(mode);
  }

  /** Flushes and shuts down the metrics adapter when it owns exporter resources. */
  @Override
  public void close() {
    if (metrics instanceof OpenTelemetryMetricsAdapter otel) {
      otel.close();
    }
  }
}
