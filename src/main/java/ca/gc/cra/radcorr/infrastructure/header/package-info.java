/**
 * File adapters for ENVI text headers: parser, writer, and the {@code HeaderStorePort} implementation.
 * <p><strong>Role:</strong> Driven-side adapters used by the correction and inspect use cases.</p>
 * <p><strong>Concurrency:</strong> Stateless; safe to share.</p>
 */
package ca.gc.cra.radcorr.infrastructure.header;
