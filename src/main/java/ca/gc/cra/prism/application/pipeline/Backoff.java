package ca.gc.cra.prism.application.pipeline;

import java.time.Duration;
import java.util.Objects;
import java.util.Random;

/**
 * Exponential backoff with additive jitter.
 *
 * <p>The delay after failed attempt {@code n} (zero-based) is {@code d = min(base * 2^n, maxDelay)} plus a
 * uniform jitter in {@code [0, 0.1 * d)}. The jitter never shortens the exponential component.</p>
 *
 * <p><strong>Thread-safety:</strong> Thread-safe; {@link Random} is synchronized internally.</p>
 *
 * @since PRISM 0.1
 */
public final class Backoff {
  private static final double JITTER_FRACTION = 0.1;
  private static final int MAX_SHIFT = 30;

  private final Duration base;
  private final Duration maxDelay;
  private final int maxAttempts;
  private final Random random;

  /**
   * Creates a backoff policy.
   *
   * @param base delay after the first failure; must be non-negative
   * @param maxDelay cap applied to the exponential component
   * @param maxAttempts total attempts allowed, including the first; at least one
   * @param random jitter source; inject a seeded instance for reproducible tests
   */
  public Backoff(Duration base, Duration maxDelay, int maxAttempts, Random random) {
    this.base = Objects.requireNonNull(base, "base");
    this.maxDelay = Objects.requireNonNull(maxDelay, "maxDelay");
    this.random = Objects.requireNonNull(random, "random");
    if (base.isNegative() || maxDelay.isNegative()) {
      throw new IllegalArgumentException("backoff delays must be non-negative");
    }
    if (maxAttempts < 1) {
      throw new IllegalArgumentException("maxAttempts must be >= 1 (was " + maxAttempts + ")");
    }
    this.maxAttempts = maxAttempts;
  }

  /**
   * Computes the pause after failed attempt {@code attempt}.
   *
   * @param attempt zero-based index of the attempt that just failed
   * @return delay before the next attempt
   */
  public Duration delayFor(int attempt) {
    if (attempt < 0) {
      throw new IllegalArgumentException("attempt must be non-negative");
    }
    long baseMillis = base.toMillis();
    long exponential;
    int shift = Math.min(attempt, MAX_SHIFT);
    if (baseMillis > (Long.MAX_VALUE >> shift)) {
      exponential = maxDelay.toMillis();
    } else {
      exponential = Math.min(baseMillis << shift, maxDelay.toMillis());
    }
    long jitter = (long) (random.nextDouble() * JITTER_FRACTION * exponential);
    return Duration.ofMillis(exponential + jitter);
  }

  /**
   * Whether another attempt is allowed after {@code attemptsMade} attempts.
   *
   * @param attemptsMade attempts already performed
   * @return {@code true} while under the budget
   */
  public boolean canRetry(int attemptsMade) {
    return attemptsMade < maxAttempts;
  }

  public int maxAttempts() {
    return maxAttempts;
  }

  public Duration base() {
    return base;
  }
}
