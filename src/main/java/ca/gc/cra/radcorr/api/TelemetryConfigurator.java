package ca.gc.cra.radcorr.api;

import ca.gc.cra.radcorr.validation.Strings;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Copies telemetry settings from the merged configuration into the {@code otel.*} system properties read when
 * the metrics adapter is created.
 */
final class TelemetryConfigurator {
  private static final Logger log = LoggerFactory.getLogger(TelemetryConfigurator.class);
  private static final int MAX_RESOURCE_ATTRIBUTES_LENGTH = 4_096;

  static final String EXPORTER_PROPERTY = "otel.metrics.exporter";
  static final String ENDPOINT_PROPERTY = "otel.exporter.otlp.endpoint";
  static final String RESOURCE_PROPERTY = "otel.resource.attributes";

  private TelemetryConfigurator() {}

  /**
   * Removes {@code metricsExporter}, {@code otelEndpoint} and {@code otelResourceAttributes} from {@code config}
   * and applies the non-blank ones.
   *
   * @param config mutable merged configuration
   * @return the effective exporter name
   * @throws IllegalArgumentException if a value is invalid
   */
  static String configureMetrics(Map<String, String> config) {
    String exporter = blankToNull(config.remove("metricsExporter"));
    String endpoint = blankToNull(config.remove("otelEndpoint"));
    String attributes = blankToNull(config.remove("otelResourceAttributes"));

    String effective = exporter == null ? "none" : exporter.toLowerCase(Locale.ROOT);
    if (!effective.equals("otlp") && !effective.equals("none")) {
      throw new IllegalArgumentException("metricsExporter must be 'otlp' or 'none' (was '" + exporter + "')");
    }
    if (endpoint != null) {
      validateEndpoint(endpoint);
    }
    if (attributes != null) {
      Strings.requirePrintableAscii("otelResourceAttributes", attributes, MAX_RESOURCE_ATTRIBUTES_LENGTH);
    }

    System.setProperty(EXPORTER_PROPERTY, effective);
    log.debug("Metrics exporter: {}", effective);
    if (endpoint != null) {
      System.setProperty(ENDPOINT_PROPERTY, endpoint);
      log.debug("OTLP endpoint: {}", endpoint);
    }
    if (attributes != null) {
      System.setProperty(RESOURCE_PROPERTY, attributes);
    }
    return effective;
  }

  private static void validateEndpoint(String raw) {
    URI uri;
    try {
      uri = new URI(raw);
    } catch (URISyntaxException ex) {
      throw new IllegalArgumentException("otelEndpoint must be a valid URI", ex);
    }
    String scheme = uri.getScheme();
    if (scheme == null || !(scheme.equalsIgnoreCase("http") || scheme.equalsIgnoreCase("https"))) {
      throw new IllegalArgumentException("otelEndpoint must use http or https scheme");
    }
    if (uri.getHost() == null || uri.getHost().isBlank()) {
      throw new IllegalArgumentException("otelEndpoint must include a host");
    }
  }

  private static String blankToNull(String value) {
    return value == null || value.isBlank() ? null : value.trim();
  }
}
