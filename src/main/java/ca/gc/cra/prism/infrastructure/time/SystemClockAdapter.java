package ca.gc.cra.prism.infrastructure.time;

import ca.gc.cra.prism.application.port.ClockPort;
import java.time.Clock;
import java.util.Objects;

/**
 * {@link ClockPort} backed by a {@link Clock}, the system UTC clock by default.
 *
 * @since PRISM 0.1
 */
public final class SystemClockAdapter implements ClockPort {
  private final Clock clock;

  public SystemClockAdapter() {
    this(Clock.systemUTC());
  }

  /**
   * Creates an adapter over an arbitrary clock, e.g. {@link Clock#fixed} in tests.
   *
   * @param clock source clock
   */
  public SystemClockAdapter(Clock clock) {
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  @Override
  public long nowMillis() {
    return clock.millis();
  }
}
