package ca.gc.cra.prism.validation;

import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.Locale;

/**
 * Parses the duration notation accepted in configuration files and CLI arguments.
 *
 * <p>Accepts ISO-8601 ({@code PT30S}), a number with a unit suffix ({@code 250ms}, {@code 10s}, {@code 5m},
 * {@code 1h}, {@code 2d}), or a bare number of milliseconds.</p>
 *
 * @since PRISM 0.1
 */
public final class Durations {
  private Durations() {
    // Utility
  }

  /**
   * Parses {@code raw} as a non-negative duration.
   *
   * @param name logical name used in exception messages
   * @param raw textual duration
   * @return parsed duration
   * @throws IllegalArgumentException if the value is blank, malformed, or negative
   */
  public static Duration parse(String name, String raw) {
    String text = Strings.requireNonBlank(name, raw).toLowerCase(Locale.ROOT);
    Duration parsed;
    try {
      if (text.startsWith("pt") || text.startsWith("p")) {
        parsed = Duration.parse(text.toUpperCase(Locale.ROOT));
      } else if (text.endsWith("ms")) {
        parsed = Duration.ofMillis(Long.parseLong(text.substring(0, text.length() - 2).trim()));
      } else if (text.endsWith("s")) {
        parsed = Duration.ofSeconds(Long.parseLong(stripUnit(text)));
      } else if (text.endsWith("m")) {
        parsed = Duration.ofMinutes(Long.parseLong(stripUnit(text)));
      } else if (text.endsWith("h")) {
        parsed = Duration.ofHours(Long.parseLong(stripUnit(text)));
      } else if (text.endsWith("d")) {
        parsed = Duration.ofDays(Long.parseLong(stripUnit(text)));
      } else {
        parsed = Duration.ofMillis(Long.parseLong(text));
      }
    } catch (NumberFormatException | DateTimeParseException ex) {
      throw new IllegalArgumentException(name + " must be a duration such as 500ms, 10s or PT1M (was " + raw + ")", ex);
    }
    if (parsed.isNegative()) {
      throw new IllegalArgumentException(name + " must not be negative (was " + raw + ")");
    }
    return parsed;
  }

  /**
   * Renders a duration in the short suffix notation understood by {@link #parse(String, String)}.
   *
   * @param duration value to format
   * @return text such as {@code 1500ms}, {@code 10s} or {@code 2h}
   */
  public static String format(Duration duration) {
    long millis = duration.toMillis();
    if (millis % 3_600_000L == 0 && millis != 0) {
      return (millis / 3_600_000L) + "h";
    }
    if (millis % 60_000L == 0 && millis != 0) {
      return (millis / 60_000L) + "m";
    }
    if (millis % 1_000L == 0) {
      return (millis / 1_000L) + "s";
    }
    return millis + "ms";
  }

  private static String stripUnit(String text) {
    return text.substring(0, text.length() - 1).trim();
  }
}
