package ca.gc.cra.radcorr.infrastructure.metrics;

import ca.gc.cra.radcorr.application.port.MetricsPort;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.LongHistogram;
import io.opentelemetry.api.metrics.Meter;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Metrics adapter that forwards RADCORR counters and histograms to OpenTelemetry.
 *
 * <p>Instruments are created lazily per key. Histogram units are inferred from the key suffix:
 * {@code *Nanos} records nanoseconds and {@code *Pixels} records pixel counts.</p>
 */
public final class OpenTelemetryMetricsAdapter implements MetricsPort, AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(OpenTelemetryMetricsAdapter.class);
  private static final AttributeKey<String> METRIC_KEY_ATTRIBUTE = AttributeKey.stringKey("radcorr.metric.key");
  private static final Map<String, String> UNIT_SUFFIXES = Map.of("Nanos", "ns", "Pixels", "{pixel}");

  private final OpenTelemetryBootstrap.BootstrapResult bootstrap;
  private final Meter meter;
  private final ConcurrentMap<String, LongCounter> counters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, LongHistogram> histograms = new ConcurrentHashMap<>();

  /**
   * Creates an adapter wired to the environment-configured exporter.
   */
  public OpenTelemetryMetricsAdapter() {
    this(OpenTelemetryBootstrap.initialize());
  }

  OpenTelemetryMetricsAdapter(OpenTelemetryBootstrap.BootstrapResult bootstrap) {
    this.bootstrap = Objects.requireNonNull(bootstrap, "bootstrap");
    this.meter = bootstrap.meter();
    if (bootstrap.isNoop()) {
      log.debug("OpenTelemetry metrics adapter running in noop mode");
    }
  }

  @Override
  public void increment(String key) {
    Objects.requireNonNull(key, "key");
    counters.computeIfAbsent(key, this::counter).add(1, attributes(key));
  }

  @Override
  public void observe(String key, long value) {
    Objects.requireNonNull(key, "key");
    histograms.computeIfAbsent(key, this::histogram).record(value, attributes(key));
  }

  void forceFlush() {
    bootstrap.forceFlush();
  }

  /** Exports pending points and shuts the meter provider down. */
  @Override
  public void close() {
    bootstrap.forceFlush();
    bootstrap.close();
  }

  private LongCounter counter(String key) {
    return meter.counterBuilder(key)
        .setUnit("1")
        .setDescription("RADCORR counter for " + key)
        .build();
  }

  private LongHistogram histogram(String key) {
    return meter.histogramBuilder(key)
        .ofLongs()
        .setUnit(unitFor(key))
        .setDescription("RADCORR observation for " + key)
        .build();
  }

  static String unitFor(String key) {
    for (Map.Entry<String, String> suffix : UNIT_SUFFIXES.entrySet()) {
      if (key.endsWith(suffix.getKey())) {
        return suffix.getValue();
      }
    }
    return "1";
  }

  private static Attributes attributes(String key) {
    return Attributes.of(METRIC_KEY_ATTRIBUTE, key);
  }
}
