package ca.gc.cra.prism.testing;

import ca.gc.cra.prism.domain.aggregate.AggregateRecord;
import ca.gc.cra.prism.domain.aggregate.BucketPolicy;
import ca.gc.cra.prism.domain.aggregate.HistogramSpec;
import ca.gc.cra.prism.domain.chain.AggregateWindow;
import ca.gc.cra.prism.domain.chain.BlockRange;
import ca.gc.cra.prism.domain.chain.TransactionRecord;
import ca.gc.cra.prism.domain.store.Provenance;
import ca.gc.cra.prism.domain.store.StoredResult;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Map;

/** Shared sample values. */
public final class Fixtures {
  public static final Instant OBSERVED_AT = Instant.parse("2024-05-01T12:00:00Z");

  private Fixtures() {
    // Utility
  }

  public static AggregateRecord aggregate(
      long txCount, long shieldedCount, double totalFees, double feeSumSq, Map<Integer, Long> histogram,
      int bucketCount) {
    return new AggregateRecord(
        txCount,
        shieldedCount,
        totalFees,
        feeSumSq,
        histogram,
        new HistogramSpec(BucketPolicy.STATIC, bucketCount, 0.0001),
        AggregateWindow.DAY,
        OBSERVED_AT,
        "stub://zcash");
  }

  public static TransactionRecord shielded(String txId, long height, double fee) {
    return new TransactionRecord(txId, height, fee, false, 1, 2, 0);
  }

  public static TransactionRecord transparent(String txId, long height, double fee) {
    return TransactionRecord.transparent(txId, height, fee);
  }

  public static StoredResult storedResult(String key, String payload, AggregateWindow window) {
    return new StoredResult(
        key,
        "ref_" + key.hashCode(),
        payload.getBytes(StandardCharsets.UTF_8),
        Map.of(StoredResult.CONTENT_TYPE, "application/json", StoredResult.WINDOW, window.label()),
        new Provenance("stub://zcash", new BlockRange(100, 110), OBSERVED_AT),
        OBSERVED_AT);
  }
}
