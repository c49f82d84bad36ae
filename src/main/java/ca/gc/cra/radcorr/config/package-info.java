/**
 * Configuration aggregates and composition root wiring for RADCORR CLIs.
 * <p><strong>Role:</strong> Bootstrap layer merging defaults, YAML and CLI options and selecting adapters.</p>
 * <p><strong>Concurrency:</strong> Configuration records are immutable; safe to share.</p>
 * <p><strong>Security:</strong> Validates paths and header text through {@code ca.gc.cra.radcorr.validation}.</p>
 */
package ca.gc.cra.radcorr.config;
