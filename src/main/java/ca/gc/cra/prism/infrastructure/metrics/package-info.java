/**
 * Metrics adapters bridging {@link ca.gc.cra.prism.application.port.MetricsPort} to OpenTelemetry or to nothing.
 * <p><strong>Concurrency:</strong> Adapters are thread-safe; instruments are created once per metric key.</p>
 * <p><strong>Metrics:</strong> Publishes under the {@code source.*}, {@code pipeline.*}, {@code store.*} and
 * {@code compute.*} namespaces.</p>
 */
package ca.gc.cra.prism.infrastructure.metrics;
