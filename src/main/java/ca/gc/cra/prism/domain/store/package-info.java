/**
 * Stored results, their provenance and the listing view used to browse them.
 */
package ca.gc.cra.prism.domain.store;
