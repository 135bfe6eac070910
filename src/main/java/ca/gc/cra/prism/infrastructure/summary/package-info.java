/**
 * Deterministic summary generator used when no external summarizing model is configured.
 */
package ca.gc.cra.prism.infrastructure.summary;
