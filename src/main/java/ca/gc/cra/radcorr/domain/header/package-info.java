/**
 * <strong>Purpose:</strong> Typed model of ENVI-style text headers: decoded field values, the validated header
 * view, cube geometry, and the header-level error taxonomy.
 * <p><strong>Concurrency:</strong> Immutable values; safe to share.</p>
 * <p><strong>Security:</strong> Header text is untrusted input; dimensions are range-checked before any
 * allocation is sized from them.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.radcorr.domain.header;
