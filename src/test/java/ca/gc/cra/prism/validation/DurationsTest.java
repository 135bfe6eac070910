package ca.gc.cra.prism.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.time.Duration;
import org.junit.jupiter.api.Test;

class DurationsTest {

  @Test
  void parsesSuffixNotation() {
    assertEquals(Duration.ofMillis(250), Durations.parse("d", "250ms"));
    assertEquals(Duration.ofSeconds(10), Durations.parse("d", "10s"));
    assertEquals(Duration.ofMinutes(5), Durations.parse("d", "5M"));
    assertEquals(Duration.ofHours(1), Durations.parse("d", " 1h "));
    assertEquals(Duration.ofDays(2), Durations.parse("d", "2d"));
  }

  @Test
  void parsesIsoAndBareMillis() {
    assertEquals(Duration.ofSeconds(30), Durations.parse("d", "PT30S"));
    assertEquals(Duration.ofMillis(1500), Durations.parse("d", "1500"));
  }

  @Test
  void rejectsMalformedAndNegative() {
    assertThrows(IllegalArgumentException.class, () -> Durations.parse("d", "soon"));
    assertThrows(IllegalArgumentException.class, () -> Durations.parse("d", "-5s"));
    assertThrows(IllegalArgumentException.class, () -> Durations.parse("d", " "));
  }

  @Test
  void formatPicksLargestWholeUnit() {
    assertEquals("2h", Durations.format(Duration.ofHours(2)));
    assertEquals("1m", Durations.format(Duration.ofSeconds(60)));
    assertEquals("10s", Durations.format(Duration.ofSeconds(10)));
    assertEquals("1500ms", Durations.format(Duration.ofMillis(1500)));
    assertEquals("0s", Durations.format(Duration.ZERO));
  }

  @Test
  void formatOutputParsesBack() {
    Duration value = Duration.ofMillis(90_000);

    assertEquals(value, Durations.parse("d", Durations.format(value)));
  }
}
