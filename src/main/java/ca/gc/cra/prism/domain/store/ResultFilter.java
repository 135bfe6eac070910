package ca.gc.cra.prism.domain.store;

import ca.gc.cra.prism.domain.chain.AggregateWindow;
import java.util.Objects;
import java.util.Optional;

/**
 * Criteria for listing stored results. Empty criteria match everything.
 *
 * @param keyPrefix required key prefix
 * @param window required aggregate window
 * @since PRISM 0.1
 */
public record ResultFilter(Optional<String> keyPrefix, Optional<AggregateWindow> window) {

  /** Filter matching every result. */
  public static final ResultFilter ALL = new ResultFilter(Optional.empty(), Optional.empty());

  public ResultFilter {
    Objects.requireNonNull(keyPrefix, "keyPrefix");
    Objects.requireNonNull(window, "window");
  }

  /**
   * Tests a summary against this filter.
   *
   * @param summary candidate
   * @return {@code true} when every present criterion matches
   */
  public boolean matches(ResultSummary summary) {
    if (keyPrefix.isPresent() && !summary.key().startsWith(keyPrefix.get())) {
      return false;
    }
    return window.isEmpty() || window.get().label().equals(summary.metadata().get(StoredResult.WINDOW));
  }
}
