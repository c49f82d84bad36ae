/**
 * Metrics adapters bridging the RADCORR metrics port to OpenTelemetry or discarding updates.
 * <p><strong>Role:</strong> Adapter layer on the observability plane.</p>
 * <p><strong>Concurrency:</strong> Adapters are thread-safe.</p>
 * <p><strong>Metrics:</strong> Publishes under the {@code correct.*} namespace.</p>
 */
package ca.gc.cra.radcorr.infrastructure.metrics;
