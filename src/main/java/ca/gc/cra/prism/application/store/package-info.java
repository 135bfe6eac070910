/**
 * Write-once result store layered as a Caffeine read cache over a {@link ca.gc.cra.prism.application.port.DurableStorePort}.
 * <p><strong>Metrics:</strong> Emits {@code store.put.*} and {@code store.cache.*} counters.</p>
 */
package ca.gc.cra.prism.application.store;
