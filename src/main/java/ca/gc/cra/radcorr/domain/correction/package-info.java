/**
 * <strong>Purpose:</strong> Radiometric correction math: per-band factors, in-place chunk correction with
 * clipping, and run results.
 * <p><strong>Concurrency:</strong> {@link ca.gc.cra.radcorr.domain.correction.ChunkCorrector} mutates only the
 * caller's buffer; other types are immutable.</p>
 * <p><strong>Performance:</strong> Chunk correction is a single pass over a primitive array with no
 * allocation.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.radcorr.domain.correction;
