package ca.gc.cra.prism.domain.chain;

import java.util.Objects;

/**
 * Raw per-transaction record as returned by the upstream block explorer.
 *
 * <p>Only the fields needed for aggregation are retained. Shielded-activity indicators are kept
 * separately so that the shielded predicate can be chosen per deployment.</p>
 *
 * @param txId transaction identifier; never {@code null}
 * @param blockHeight height of the containing block
 * @param fee fee paid in whole coin units; non-negative
 * @param shieldedFlag explicit shielded flag reported by the upstream ({@code is_shielded} or {@code shielded_spend})
 * @param shieldedSpends number of shielded spends
 * @param shieldedOutputs number of shielded outputs
 * @param joinSplits number of legacy joinsplit descriptions
 * @since PRISM 0.1
 */
public record TransactionRecord(
    String txId,
    long blockHeight,
    double fee,
    boolean shieldedFlag,
    int shieldedSpends,
    int shieldedOutputs,
    int joinSplits) {

  public TransactionRecord {
    Objects.requireNonNull(txId, "txId");
    if (!Double.isFinite(fee) || fee < 0) {
      throw new IllegalArgumentException("fee must be a finite non-negative number (was " + fee + ")");
    }
    if (shieldedSpends < 0 || shieldedOutputs < 0 || joinSplits < 0) {
      throw new IllegalArgumentException("shielded component counts must be non-negative");
    }
  }

  /**
   * Convenience factory for a transparent transaction.
   *
   * @param txId transaction identifier
   * @param blockHeight containing block height
   * @param fee fee in coin units
   * @return record with no shielded components
   */
  public static TransactionRecord transparent(String txId, long blockHeight, double fee) {
    return new TransactionRecord(txId, blockHeight, fee, false, 0, 0, 0);
  }
}
