package ca.gc.cra.prism.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Map;
import org.junit.jupiter.api.Test;

class DefaultsForModeTest {

  @Test
  void everyModeCarriesCommonKeys() {
    for (String mode : new String[] {"aggregate", "analyze", "results"}) {
      Map<String, String> defaults = DefaultsForMode.asFlatMap(mode);

      assertEquals("zcash", defaults.get("source.chain"), mode);
      assertEquals("none", defaults.get("metricsExporter"), mode);
      assertEquals("DYNAMIC_MAX", defaults.get("codec.bucketPolicy"), mode);
    }
  }

  @Test
  void analyzeDefaultsCoverPipelineAndStore() {
    Map<String, String> defaults = DefaultsForMode.asFlatMap("Analyze");

    assertEquals("LOCAL", defaults.get("gateway.mode"));
    assertEquals("3", defaults.get("pipeline.stageMaxAttempts"));
    assertEquals("FILE", defaults.get("store.mode"));
    assertEquals("500ms", defaults.get("pollInterval"));
    assertEquals("", defaults.get("range"));
  }

  @Test
  void aggregateDefaultsOmitGatewayAndStore() {
    Map<String, String> defaults = DefaultsForMode.asFlatMap("aggregate");

    assertFalse(defaults.containsKey("gateway.mode"));
    assertFalse(defaults.containsKey("store.mode"));
    assertTrue(defaults.containsKey("range"));
  }

  @Test
  void defaultsRoundTripThroughTypedConfig() {
    PrismConfig parsed = PrismConfig.fromMap(DefaultsForMode.asFlatMap("analyze"));
    PrismConfig defaults = PrismConfig.defaults();

    assertEquals(defaults.source(), parsed.source());
    assertEquals(defaults.codec(), parsed.codec());
    assertEquals(defaults.gateway(), parsed.gateway());
    assertEquals(defaults.orchestrator(), parsed.orchestrator());
  }

  @Test
  void unsupportedModeThrows() {
    assertThrows(IllegalArgumentException.class, () -> DefaultsForMode.asFlatMap("capture"));
  }
}
