/**
 * <strong>Purpose:</strong> Command-line entry points for RADCORR: the {@code radcorr} dispatcher and the
 * {@code correct} and {@code inspect} commands.
 * <p><strong>Role:</strong> Adapter layer that parses arguments, merges YAML and defaults, and maps failures to
 * {@link ca.gc.cra.radcorr.api.ExitCode} values.</p>
 * <p><strong>Observability:</strong> Logs via SLF4J; report text goes to stdout through
 * {@link ca.gc.cra.radcorr.api.CliPrinter}.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.radcorr.api;
