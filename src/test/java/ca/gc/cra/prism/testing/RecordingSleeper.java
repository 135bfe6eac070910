package ca.gc.cra.prism.testing;

import ca.gc.cra.prism.application.port.Sleeper;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Sleeper that records requested delays and returns immediately. When a clock is attached it is advanced by
 * each delay so deadline loops make progress.
 */
public final class RecordingSleeper implements Sleeper {
  private final List<Duration> delays = Collections.synchronizedList(new ArrayList<>());
  private final MutableClock clock;

  public RecordingSleeper() {
    this(null);
  }

  public RecordingSleeper(MutableClock clock) {
    this.clock = clock;
  }

  @Override
  public void sleep(Duration delay) {
    delays.add(delay);
    if (clock != null) {
      clock.advance(delay);
    }
  }

  public List<Duration> delays() {
    return List.copyOf(delays);
  }

  public Duration total() {
    Duration total = Duration.ZERO;
    for (Duration delay : delays()) {
      total = total.plus(delay);
    }
    return total;
  }
}
