/**
 * Configuration aggregates and composition root wiring for PRISM CLIs.
 * <p><strong>Role:</strong> Application bootstrap layer; merges embedded defaults, YAML and {@code key=value}
 * arguments, then selects the source, computation and store adapters.</p>
 * <p><strong>Concurrency:</strong> Configuration objects are immutable; safe to share.</p>
 * <p><strong>Security:</strong> Rejects unknown keys and non-HTTP endpoints; relies on
 * {@code ca.gc.cra.prism.validation} utilities.</p>
 */
package ca.gc.cra.prism.config;
