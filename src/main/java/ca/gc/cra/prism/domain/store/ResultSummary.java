package ca.gc.cra.prism.domain.store;

import java.time.Instant;
import java.util.Map;

/**
 * Listing view of a stored result.
 *
 * @param key store key
 * @param referenceId reference id
 * @param metadata result metadata
 * @param payloadSize payload size in bytes
 * @param provenance origin of the result
 * @param storedAt write time
 * @since PRISM 0.1
 */
public record ResultSummary(
    String key,
    String referenceId,
    Map<String, String> metadata,
    int payloadSize,
    Provenance provenance,
    Instant storedAt) {

  public ResultSummary {
    metadata = Map.copyOf(metadata);
  }
}
