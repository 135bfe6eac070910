/**
 * Validated natural-language summaries with their numeric embedding.
 */
package ca.gc.cra.prism.domain.summary;
