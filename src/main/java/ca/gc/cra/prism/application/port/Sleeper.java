package ca.gc.cra.prism.application.port;

import java.time.Duration;

/**
 * <strong>What:</strong> Port for blocking pauses between retry attempts.
 * <p><strong>Why:</strong> Backoff delays are observable and instantaneous in tests when a recording sleeper is
 * injected.</p>
 * <p><strong>Thread-safety:</strong> Implementations must be thread-safe.</p>
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface Sleeper {
  /**
   * Blocks the calling thread for {@code delay}.
   *
   * @param delay pause length; zero or negative returns immediately
   * @throws InterruptedException if the thread is interrupted while waiting
   */
  void sleep(Duration delay) throws InterruptedException;

  /**
   * Sleeper backed by {@link Thread#sleep(long)}.
   */
  Sleeper SYSTEM = delay -> {
    long millis = delay.toMillis();
    if (millis > 0) {
      Thread.sleep(millis);
    }
  };
}
