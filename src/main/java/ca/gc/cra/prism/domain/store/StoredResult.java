package ca.gc.cra.prism.domain.store;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Arrays;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * <strong>What:</strong> Immutable result of one successful pipeline run.
 * <p><strong>Why:</strong> The payload stays opaque to the store; it may be a computation blob or a plaintext
 * JSON document. Everything needed to interpret it travels in {@link #metadata()}.</p>
 *
 * @param key store key (job key, or job key plus {@code #summary})
 * @param referenceId store-assigned reference id
 * @param payload opaque bytes; copied on the way in and out
 * @param metadata flat string metadata such as {@code window} or {@code contentType}
 * @param provenance origin of the result
 * @param storedAt time the result was written
 * @since PRISM 0.1
 */
public record StoredResult(
    String key,
    String referenceId,
    byte[] payload,
    Map<String, String> metadata,
    Provenance provenance,
    Instant storedAt) {

  /** Metadata key holding the payload media type. */
  public static final String CONTENT_TYPE = "contentType";

  /** Metadata key holding the aggregate window label. */
  public static final String WINDOW = "window";

  public StoredResult {
    Objects.requireNonNull(key, "key");
    Objects.requireNonNull(referenceId, "referenceId");
    Objects.requireNonNull(payload, "payload");
    Objects.requireNonNull(metadata, "metadata");
    Objects.requireNonNull(provenance, "provenance");
    Objects.requireNonNull(storedAt, "storedAt");
    if (key.isBlank()) {
      throw new IllegalArgumentException("key must not be blank");
    }
    payload = payload.clone();
    metadata = Collections.unmodifiableMap(new TreeMap<>(metadata));
  }

  @Override
  public byte[] payload() {
    return payload.clone();
  }

  /**
   * Payload size in bytes.
   *
   * @return byte count
   */
  public int payloadSize() {
    return payload.length;
  }

  /**
   * Decodes the payload as UTF-8 text.
   *
   * @return payload text
   */
  public String payloadText() {
    return new String(payload, StandardCharsets.UTF_8);
  }

  /**
   * Projects this result onto its listing summary.
   *
   * @return summary without the payload
   */
  public ResultSummary summary() {
    return new ResultSummary(key, referenceId, metadata, payload.length, provenance, storedAt);
  }

  @Override
  public boolean equals(Object other) {
    if (this == other) {
      return true;
    }
    if (!(other instanceof StoredResult that)) {
      return false;
    }
    return key.equals(that.key)
        && referenceId.equals(that.referenceId)
        && Arrays.equals(payload, that.payload)
        && metadata.equals(that.metadata)
        && provenance.equals(that.provenance)
        && storedAt.equals(that.storedAt);
  }

  @Override
  public int hashCode() {
    return Objects.hash(key, referenceId, Arrays.hashCode(payload), metadata, provenance, storedAt);
  }

  @Override
  public String toString() {
    return "StoredResult[key=" + key + ", referenceId=" + referenceId + ", payloadSize=" + payload.length
        + ", metadata=" + metadata + ", provenance=" + provenance + ", storedAt=" + storedAt + "]";
  }
}
