/**
 * File-backed cube storage: positional channel reader, channel and memory-mapped writers.
 * <p><strong>Role:</strong> Driven-side adapters behind {@code CubeStoragePort}.</p>
 * <p><strong>Concurrency:</strong> Readers and writers are single-threaded.</p>
 * <p><strong>Performance:</strong> Memory use is bounded by one row chunk per reader or writer.</p>
 */
package ca.gc.cra.radcorr.infrastructure.cube;
