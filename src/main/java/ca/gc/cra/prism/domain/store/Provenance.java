package ca.gc.cra.prism.domain.store;

import ca.gc.cra.prism.domain.chain.BlockRange;
import java.time.Instant;
import java.util.Objects;

/**
 * Origin of a stored result, kept for audit.
 *
 * @param sourceUrl upstream base URL the transactions were read from
 * @param blockRange block range that was aggregated
 * @param submittedAt time the vector was submitted for computation
 * @since PRISM 0.1
 */
public record Provenance(String sourceUrl, BlockRange blockRange, Instant submittedAt) {
  public Provenance {
    Objects.requireNonNull(sourceUrl, "sourceUrl");
    Objects.requireNonNull(blockRange, "blockRange");
    Objects.requireNonNull(submittedAt, "submittedAt");
  }
}
