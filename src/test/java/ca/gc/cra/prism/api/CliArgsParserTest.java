package ca.gc.cra.prism.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Map;
import org.junit.jupiter.api.Test;

class CliArgsParserTest {
  @Test
  void parsesKeyValuePairs() {
    Map<String, String> map = CliArgsParser.toMap(new String[] {"range=10-20", "source.chain=zcash"});

    assertEquals("10-20", map.get("range"));
    assertEquals("zcash", map.get("source.chain"));
  }

  @Test
  void splitsOnFirstEquals() {
    Map<String, String> map = CliArgsParser.toMap(new String[] {"jobKey=a=b"});

    assertEquals("a=b", map.get("jobKey"));
  }

  @Test
  void stripsLeadingDashes() {
    Map<String, String> map = CliArgsParser.toMap(new String[] {"--window=week", "-range=1-2"});

    assertEquals("week", map.get("window"));
    assertEquals("1-2", map.get("range"));
  }

  @Test
  void nullAndBlankArgumentsAreSkipped() {
    assertTrue(CliArgsParser.toMap(null).isEmpty());
    assertTrue(CliArgsParser.toMap(new String[] {null, "  "}).isEmpty());
  }

  @Test
  void rejectsBareWords() {
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"range"}));
  }

  @Test
  void rejectsMissingValue() {
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"range="}));
  }

  @Test
  void rejectsDuplicateKeys() {
    assertThrows(IllegalArgumentException.class,
        () -> CliArgsParser.toMap(new String[] {"window=day", "--window=week"}));
  }

  @Test
  void rejectsInvalidKeyCharacters() {
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"bad key=1"}));
  }

  @Test
  void rejectsControlCharactersInValues() {
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"jobKey=a\u0007b"}));
  }
}
