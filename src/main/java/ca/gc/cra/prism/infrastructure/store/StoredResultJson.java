package ca.gc.cra.prism.infrastructure.store;

import ca.gc.cra.prism.application.json.JsonSupport;
import ca.gc.cra.prism.domain.chain.BlockRange;
import ca.gc.cra.prism.domain.store.Provenance;
import ca.gc.cra.prism.domain.store.StoredResult;
import java.time.Instant;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * On-disk JSON form of a {@link StoredResult}. The payload is Base64 encoded so binary blobs survive.
 *
 * @since PRISM 0.1
 */
final class StoredResultJson {
  private final JsonSupport json = new JsonSupport();

  byte[] write(StoredResult result) {
    Map<String, Object> provenance = new LinkedHashMap<>();
    provenance.put("source_url", result.provenance().sourceUrl());
    provenance.put("block_range", result.provenance().blockRange().toString());
    provenance.put("submitted_at", result.provenance().submittedAt().toString());

    Map<String, Object> document = new LinkedHashMap<>();
    document.put("key", result.key());
    document.put("reference_id", result.referenceId());
    document.put("stored_at", result.storedAt().toString());
    document.put("metadata", new LinkedHashMap<>(result.metadata()));
    document.put("provenance", provenance);
    document.put("payload", Base64.getEncoder().encodeToString(result.payload()));
    return json.write(document, true);
  }

  StoredResult read(byte[] bytes) {
    Map<String, Object> document = json.parseObject(bytes);
    Map<String, Object> provenance = JsonSupport.asObject("provenance", document.get("provenance"));
    Map<String, Object> rawMetadata = JsonSupport.asObject("metadata", document.get("metadata"));
    Map<String, String> metadata = new LinkedHashMap<>();
    rawMetadata.forEach((key, value) -> metadata.put(key, value == null ? "" : value.toString()));
    return new StoredResult(
        JsonSupport.requireString(document, "key"),
        JsonSupport.requireString(document, "reference_id"),
        Base64.getDecoder().decode(JsonSupport.requireString(document, "payload")),
        metadata,
        new Provenance(
            JsonSupport.requireString(provenance, "source_url"),
            BlockRange.parse(JsonSupport.requireString(provenance, "block_range")),
            Instant.parse(JsonSupport.requireString(provenance, "submitted_at"))),
        Instant.parse(JsonSupport.requireString(document, "stored_at")));
  }
}
