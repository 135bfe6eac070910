package ca.gc.cra.prism.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import org.junit.jupiter.api.Test;

class NumbersTest {

  @Test
  void requireRangeAcceptsBounds() {
    assertEquals(1, Numbers.requireRange("workers", 1, 1, 64));
    assertEquals(64, Numbers.requireRange("workers", 64, 1, 64));
  }

  @Test
  void requireRangeNamesTheValue() {
    IllegalArgumentException error = assertThrows(IllegalArgumentException.class,
        () -> Numbers.requireRange("workers", 65, 1, 64));

    assertTrue(error.getMessage().startsWith("workers must be between 1 and 64"));
  }

  @Test
  void requirePositiveRejectsZeroAndNegative() {
    assertThrows(IllegalArgumentException.class, () -> Numbers.requirePositive("timeout", Duration.ZERO));
    assertThrows(IllegalArgumentException.class, () -> Numbers.requirePositive("timeout", Duration.ofSeconds(-1)));
    assertEquals(Duration.ofSeconds(1), Numbers.requirePositive("timeout", Duration.ofSeconds(1)));
  }
}
