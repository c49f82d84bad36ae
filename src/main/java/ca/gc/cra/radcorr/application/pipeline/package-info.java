/**
 * Use cases for correcting and inspecting band-sequential cubes.
 * <p><strong>Role:</strong> Application layer orchestrating header, cube storage, and metrics ports.</p>
 * <p><strong>Concurrency:</strong> Single-threaded; bands run strictly in ascending order.</p>
 * <p><strong>Performance:</strong> Memory bounded by one row chunk.</p>
 * <p><strong>Metrics:</strong> Publishes {@code correct.*} counters and histograms.</p>
 */
package ca.gc.cra.radcorr.application.pipeline;
