/**
 * Adapters implementing the application ports against HTTP, the filesystem, OpenTelemetry and the JDK.
 */
package ca.gc.cra.prism.infrastructure;
