/**
 * Ports consumed by RADCORR use cases: cube storage, header storage, and metrics.
 * <p><strong>Role:</strong> Boundary between the application layer and infrastructure adapters.</p>
 * <p><strong>Concurrency:</strong> Unless documented, implementations are used from the single pipeline thread.</p>
 * <p><strong>Durability:</strong> {@link ca.gc.cra.radcorr.application.port.CubeWriter#flush()} defines the
 * flush-after-write contract honoured by every storage backend.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.radcorr.application.port;
