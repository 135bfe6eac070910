/**
 * Transactions as fetched from the block explorer, plus the block ranges and reporting windows they are grouped by.
 * <p><strong>Security:</strong> Transaction ids never leave the ingest stage; only aggregates are encoded.</p>
 */
package ca.gc.cra.prism.domain.chain;
