/**
 * <strong>Purpose:</strong> Ports defining the ingest -> encode -> compute -> store workflow contracts.
 * <p><strong>Pipeline role:</strong> Application boundary; infrastructure adapters implement these interfaces and
 * {@code CompositionRoot} selects exactly one implementation per port.</p>
 * <p><strong>Concurrency:</strong> Port implementations must be thread-safe unless documented otherwise; the
 * orchestrator calls them from its worker pool.</p>
 * <p><strong>Errors:</strong> Pipeline-facing ports report failures through the checked
 * {@link ca.gc.cra.prism.domain.error.PipelineException} taxonomy.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.prism.application.port;
