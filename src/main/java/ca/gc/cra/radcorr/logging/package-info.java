/**
 * <strong>Purpose:</strong> Logging utilities that tune verbosity and keep header text log-friendly.
 * <p><strong>Concurrency:</strong> Stateless helpers.</p>
 * <p><strong>Observability:</strong> Coordinates with SLF4J/Logback; no custom metrics.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.radcorr.logging;
