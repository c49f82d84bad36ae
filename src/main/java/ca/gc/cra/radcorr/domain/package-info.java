/**
 * Core domain model for RADCORR header parsing and cube correction.
 * <p><strong>Role:</strong> Domain layer describing header fields, cube geometry, and correction math without
 * filesystem dependencies.</p>
 * <p><strong>Concurrency:</strong> Types are immutable unless noted; safe to share across threads.</p>
 * <p><strong>Performance:</strong> Chunk math operates in place on caller-owned float arrays.</p>
 * <p><strong>Metrics:</strong> Domain results feed {@code correct.*} metric tags.</p>
 */
package ca.gc.cra.radcorr.domain;
