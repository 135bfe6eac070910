/**
 * Plaintext aggregates and the fee histogram layout they carry.
 */
package ca.gc.cra.prism.domain.aggregate;
