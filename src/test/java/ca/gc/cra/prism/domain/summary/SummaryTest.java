package ca.gc.cra.prism.domain.summary;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.Map;
import org.junit.jupiter.api.Test;

class SummaryTest {

  @Test
  void embeddingValuesMustBeNormalized() {
    assertDoesNotThrow(() -> new Summary(Map.of("shielded_ratio", 0.0, "tx_count_log", 1.0), "ok"));
    assertThrows(IllegalArgumentException.class, () -> new Summary(Map.of("shielded_ratio", 1.5), "bad"));
    assertThrows(IllegalArgumentException.class, () -> new Summary(Map.of("shielded_ratio", Double.NaN), "bad"));
  }

  @Test
  void textMustStayUnderLimit() {
    String tooLong = "x".repeat(Summary.MAX_TEXT_LENGTH);

    assertThrows(IllegalArgumentException.class, () -> new Summary(Map.of(), tooLong));
    assertDoesNotThrow(() -> new Summary(Map.of(), tooLong.substring(1)));
  }
}
