/**
 * Fixed-point encoded vectors and the metadata required to decode them.
 * <p><strong>Role:</strong> The only representation of chain statistics that crosses the computation boundary.</p>
 * <p><strong>Layout:</strong> four scalar slots (tx count, shielded count, total fees, sum of squared fees)
 * followed by one slot per histogram bucket, all scaled by {@code scaling_factor}.</p>
 */
package ca.gc.cra.prism.domain.vector;
