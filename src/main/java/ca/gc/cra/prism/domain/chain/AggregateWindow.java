package ca.gc.cra.prism.domain.chain;

import java.util.Locale;

/**
 * Reporting window an aggregate was computed for.
 *
 * @since PRISM 0.1
 */
public enum AggregateWindow {
  HOUR,
  DAY,
  WEEK;

  /**
   * Parses a window name case-insensitively.
   *
   * @param raw window label such as {@code hour}; must not be blank
   * @return matching window
   * @throws IllegalArgumentException if the label is blank or unknown
   */
  public static AggregateWindow parse(String raw) {
    if (raw == null || raw.isBlank()) {
      throw new IllegalArgumentException("window must not be blank");
    }
    try {
      return valueOf(raw.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException("window must be one of hour, day, week (was " + raw + ")", ex);
    }
  }

  /**
   * Returns the lowercase label used in metadata and JSON output.
   *
   * @return lowercase window label
   */
  public String label() {
    return name().toLowerCase(Locale.ROOT);
  }
}
