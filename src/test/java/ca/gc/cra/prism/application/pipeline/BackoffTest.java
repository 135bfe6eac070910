package ca.gc.cra.prism.application.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.Random;
import org.junit.jupiter.api.Test;

class BackoffTest {

  @Test
  void delaysDoubleUntilCapped() {
    Backoff backoff = new Backoff(Duration.ofMillis(100), Duration.ofMillis(500), 5, fixedRandom(0.0));

    assertEquals(Duration.ofMillis(100), backoff.delayFor(0));
    assertEquals(Duration.ofMillis(200), backoff.delayFor(1));
    assertEquals(Duration.ofMillis(400), backoff.delayFor(2));
    assertEquals(Duration.ofMillis(500), backoff.delayFor(3));
    assertEquals(Duration.ofMillis(500), backoff.delayFor(62));
  }

  @Test
  void jitterAddsAtMostTenPercent() {
    Backoff backoff = new Backoff(Duration.ofMillis(1000), Duration.ofSeconds(30), 5, fixedRandom(0.999));

    Duration delay = backoff.delayFor(1);

    assertTrue(delay.toMillis() >= 2000 && delay.toMillis() <= 2200, "delay was " + delay);
  }

  @Test
  void retriesStopAtMaxAttempts() {
    Backoff backoff = new Backoff(Duration.ZERO, Duration.ZERO, 3, new Random(1));

    assertTrue(backoff.canRetry(1));
    assertTrue(backoff.canRetry(2));
    assertFalse(backoff.canRetry(3));
  }

  @Test
  void rejectsInvalidSettings() {
    assertThrows(IllegalArgumentException.class,
        () -> new Backoff(Duration.ofMillis(-1), Duration.ZERO, 1, new Random()));
    assertThrows(IllegalArgumentException.class,
        () -> new Backoff(Duration.ZERO, Duration.ZERO, 0, new Random()));
  }

  private static Random fixedRandom(double value) {
    return new Random() {
      private static final long serialVersionUID = 1L;

      @Override
      public double nextDouble() {
        return value;
      }
    };
  }
}
