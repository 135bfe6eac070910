package ca.gc.cra.prism.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.io.StringReader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class YamlConfigLoaderTest {

  @TempDir Path tempDir;

  @Test
  void modeSectionOverridesCommon() throws IOException {
    Path yaml = tempDir.resolve("prism.yaml");
    Files.writeString(yaml, """
        common:
          source:
            chain: zcash
            maxAttempts: 3
        analyze:
          source:
            maxAttempts: 7
          window: week
        """);

    Map<String, String> map = YamlConfigLoader.load(yaml, "analyze").orElseThrow();

    assertEquals("zcash", map.get("source.chain"));
    assertEquals("7", map.get("source.maxAttempts"));
    assertEquals("week", map.get("window"));
  }

  @Test
  void otherModeSectionsAreIgnored() {
    Map<String, String> map = YamlConfigLoader.read(new StringReader("""
        aggregate:
          window: hour
        results:
          window: week
        """), "aggregate", "inline");

    assertEquals(Map.of("window", "hour"), map);
  }

  @Test
  void nullValuesBecomeEmptyStrings() {
    Map<String, String> map = YamlConfigLoader.read(new StringReader("""
        common:
          otelEndpoint:
        """), "results", "inline");

    assertEquals("", map.get("otelEndpoint"));
  }

  @Test
  void emptyDocumentYieldsEmptyMap() {
    assertTrue(YamlConfigLoader.read(new StringReader(""), "analyze", "inline").isEmpty());
  }

  @Test
  void missingFileReturnsEmptyOptional() throws IOException {
    Optional<Map<String, String>> result = YamlConfigLoader.load(tempDir.resolve("missing.yaml"), "analyze");

    assertFalse(result.isPresent());
  }

  @Test
  void arraysAreRejected() {
    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.read(new StringReader("""
        common:
          source:
            chain: [zcash, bitcoin]
        """), "aggregate", "inline"));
  }

  @Test
  void nonMappingRootIsRejected() {
    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.read(new StringReader("""
        - analyze:
            window: day
        """), "analyze", "inline"));
  }

  @Test
  void malformedYamlIsRejected() {
    IllegalArgumentException error = assertThrows(IllegalArgumentException.class,
        () -> YamlConfigLoader.read(new StringReader("common: [unclosed"), "analyze", "broken.yaml"));

    assertTrue(error.getMessage().contains("broken.yaml"));
  }

  @Test
  void bundledReferenceOnlyUsesKnownKeys() throws IOException {
    for (String mode : new String[] {"aggregate", "analyze", "results"}) {
      Map<String, String> bundled = YamlConfigLoader.loadResource("prism-defaults.yaml", mode).orElseThrow();
      Map<String, String> defaults = DefaultsForMode.asFlatMap(mode);

      for (String key : bundled.keySet()) {
        assertTrue(defaults.containsKey(key), mode + " does not declare " + key);
      }
    }
  }

  @Test
  void bundledReferenceMergesIntoAValidConfig() throws IOException {
    Map<String, String> bundled = YamlConfigLoader.loadResource("prism-defaults.yaml", "analyze").orElseThrow();
    Map<String, String> effective = ConfigMerger.buildEffectiveConfig(
        "analyze", Optional.of(bundled), Map.of("range", "1-2"), DefaultsForMode.asFlatMap("analyze"), msg -> {});

    PrismConfig config = PrismConfig.fromMap(effective);

    assertEquals(PrismConfig.defaults().source().baseUrl(), config.source().baseUrl());
    assertEquals(PrismConfig.StoreMode.FILE, config.store().mode());
  }

  @Test
  void absentResourceReturnsEmptyOptional() throws IOException {
    assertFalse(YamlConfigLoader.loadResource("no-such.yaml", "analyze").isPresent());
  }
}
