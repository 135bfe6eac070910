/**
 * Application layer: ports, pipeline use cases and the result store.
 * <p><strong>Role:</strong> Depends on the domain and on port interfaces only; adapters live in
 * {@code ca.gc.cra.prism.infrastructure}.</p>
 */
package ca.gc.cra.prism.application;
