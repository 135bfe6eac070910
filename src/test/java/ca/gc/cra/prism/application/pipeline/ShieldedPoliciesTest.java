package ca.gc.cra.prism.application.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.prism.domain.chain.TransactionRecord;
import org.junit.jupiter.api.Test;

class ShieldedPoliciesTest {
  private static final TransactionRecord FLAGGED = new TransactionRecord("a", 1, 0.1, true, 0, 0, 0);
  private static final TransactionRecord SPENDS = new TransactionRecord("b", 1, 0.1, false, 1, 0, 0);
  private static final TransactionRecord JOINSPLIT = new TransactionRecord("c", 1, 0.1, false, 0, 0, 2);
  private static final TransactionRecord PLAIN = TransactionRecord.transparent("d", 1, 0.1);

  @Test
  void anyAcceptsEverySignal() {
    assertTrue(ShieldedPolicies.ANY.test(FLAGGED));
    assertTrue(ShieldedPolicies.ANY.test(SPENDS));
    assertTrue(ShieldedPolicies.ANY.test(JOINSPLIT));
    assertFalse(ShieldedPolicies.ANY.test(PLAIN));
  }

  @Test
  void countsIgnoresFlagAndJoinSplits() {
    assertFalse(ShieldedPolicies.COUNTS.test(FLAGGED));
    assertTrue(ShieldedPolicies.COUNTS.test(SPENDS));
    assertFalse(ShieldedPolicies.COUNTS.test(JOINSPLIT));
  }

  @Test
  void flagTrustsUpstreamOnly() {
    assertTrue(ShieldedPolicies.FLAG.test(FLAGGED));
    assertFalse(ShieldedPolicies.FLAG.test(SPENDS));
  }

  @Test
  void parseIsCaseInsensitive() {
    assertEquals(ShieldedPolicies.COUNTS, ShieldedPolicies.parse(" counts "));
    assertThrows(IllegalArgumentException.class, () -> ShieldedPolicies.parse("maybe"));
    assertThrows(IllegalArgumentException.class, () -> ShieldedPolicies.parse(""));
  }
}
