package ca.gc.cra.radcorr.infrastructure.metrics;

import ca.gc.cra.radcorr.application.port.MetricsPort;

/**
 * Metrics adapter that discards all observations; used for dry runs and the {@code inspect} command.
 */
public final class NoOpMetricsAdapter implements MetricsPort {
  @Override
  public void increment(String key) {}

  @Override
  public void observe(String key, long value) {}
}
