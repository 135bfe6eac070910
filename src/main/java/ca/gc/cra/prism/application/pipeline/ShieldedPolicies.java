package ca.gc.cra.prism.application.pipeline;

import ca.gc.cra.prism.domain.chain.TransactionRecord;
import java.util.Locale;
import java.util.function.Predicate;

/**
 * Pluggable predicates deciding whether a transaction counts as shielded.
 *
 * @since PRISM 0.1
 */
public enum ShieldedPolicies implements Predicate<TransactionRecord> {
  /** Explicit flag or any shielded spend, output, or joinsplit. */
  ANY {
    @Override
    public boolean test(TransactionRecord tx) {
      return tx.shieldedFlag() || tx.shieldedSpends() > 0 || tx.shieldedOutputs() > 0 || tx.joinSplits() > 0;
    }
  },
  /** Shielded spend or output counts only. */
  COUNTS {
    @Override
    public boolean test(TransactionRecord tx) {
      return tx.shieldedSpends() > 0 || tx.shieldedOutputs() > 0;
    }
  },
  /** The upstream's explicit flag only. */
  FLAG {
    @Override
    public boolean test(TransactionRecord tx) {
      return tx.shieldedFlag();
    }
  };

  /**
   * Parses a policy name case-insensitively.
   *
   * @param raw policy name
   * @return policy
   * @throws IllegalArgumentException if the name is unknown
   */
  public static ShieldedPolicies parse(String raw) {
    if (raw == null || raw.isBlank()) {
      throw new IllegalArgumentException("shielded policy must not be blank");
    }
    try {
      return valueOf(raw.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException("shielded policy must be one of any, counts, flag (was " + raw + ")", ex);
    }
  }
}
