/**
 * Durable backing stores for {@link ca.gc.cra.prism.application.store.ResultStore}: an in-memory map and a
 * directory of JSON documents, one per key.
 */
package ca.gc.cra.prism.infrastructure.store;
