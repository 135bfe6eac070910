package ca.gc.cra.prism.testing;

import ca.gc.cra.prism.application.port.ClockPort;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;

/** Manually advanced clock. */
public final class MutableClock implements ClockPort {
  private final AtomicLong millis;

  public MutableClock(Instant start) {
    this.millis = new AtomicLong(start.toEpochMilli());
  }

  public static MutableClock atEpoch() {
    return new MutableClock(Instant.parse("2024-05-01T00:00:00Z"));
  }

  @Override
  public long nowMillis() {
    return millis.get();
  }

  public void advance(Duration delta) {
    millis.addAndGet(delta.toMillis());
  }
}
