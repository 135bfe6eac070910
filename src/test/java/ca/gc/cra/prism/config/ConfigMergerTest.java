package ca.gc.cra.prism.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class ConfigMergerTest {

  @Test
  void cliOverridesYamlAndEmitsWarning() {
    Map<String, String> yaml = Map.of("window", "week", "source.chain", "zcash-testnet");
    Map<String, String> cli = Map.of("window", "hour", "range", "10-20");
    List<String> warnings = new ArrayList<>();

    Map<String, String> merged = ConfigMerger.buildEffectiveConfig(
        "aggregate", Optional.of(yaml), cli, DefaultsForMode.asFlatMap("aggregate"), warnings::add);

    assertEquals("hour", merged.get("window"));
    assertEquals("zcash-testnet", merged.get("source.chain"));
    assertEquals("10-20", merged.get("range"));
    assertEquals(List.of("CLI overrides YAML for key: window"), warnings);
  }

  @Test
  void defaultsFillUnsetKeys() {
    Map<String, String> merged = ConfigMerger.buildEffectiveConfig(
        "aggregate", Optional.empty(), Map.of("range", "1-1"), DefaultsForMode.asFlatMap("aggregate"), msg -> {});

    assertEquals("day", merged.get("window"));
    assertEquals("zcash", merged.get("source.chain"));
  }

  @Test
  void unknownKeyIsRejected() {
    IllegalArgumentException error = assertThrows(IllegalArgumentException.class,
        () -> ConfigMerger.buildEffectiveConfig(
            "results",
            Optional.empty(),
            Map.of("gateway.mode", "REMOTE"),
            DefaultsForMode.asFlatMap("results"),
            msg -> {}));

    assertTrue(error.getMessage().contains("gateway.mode"));
  }

  @Test
  void unknownYamlKeyIsRejected() {
    assertThrows(IllegalArgumentException.class,
        () -> ConfigMerger.buildEffectiveConfig(
            "aggregate",
            Optional.of(Map.of("sourc.chain", "zcash")),
            Map.of("range", "1-2"),
            DefaultsForMode.asFlatMap("aggregate"),
            msg -> {}));
  }

  @Test
  void remoteGatewayRequiresEndpoint() {
    assertThrows(IllegalArgumentException.class,
        () -> ConfigMerger.buildEffectiveConfig(
            "analyze",
            Optional.empty(),
            Map.of("range", "1-2", "gateway.mode", "remote"),
            DefaultsForMode.asFlatMap("analyze"),
            msg -> {}));
  }

  @Test
  void staticBucketingRequiresWidth() {
    assertThrows(IllegalArgumentException.class,
        () -> ConfigMerger.buildEffectiveConfig(
            "aggregate",
            Optional.of(Map.of("codec.bucketWidth", "")),
            Map.of("range", "1-2", "codec.bucketPolicy", "static"),
            DefaultsForMode.asFlatMap("aggregate"),
            msg -> {}));
  }

  @Test
  void fileStoreRequiresDirectory() {
    assertThrows(IllegalArgumentException.class,
        () -> ConfigMerger.buildEffectiveConfig(
            "results",
            Optional.of(Map.of("store.directory", "")),
            Map.of(),
            DefaultsForMode.asFlatMap("results"),
            msg -> {}));
  }

  @Test
  void rangeIsRequiredForPipelineModes() {
    assertThrows(IllegalArgumentException.class,
        () -> ConfigMerger.buildEffectiveConfig(
            "analyze", Optional.empty(), Map.of(), DefaultsForMode.asFlatMap("analyze"), msg -> {}));
    assertThrows(IllegalArgumentException.class,
        () -> ConfigMerger.buildEffectiveConfig(
            "aggregate", Optional.empty(), Map.of(), DefaultsForMode.asFlatMap("aggregate"), msg -> {}));
  }

  @Test
  void resultsModeNeedsNoRange() {
    Map<String, String> merged = ConfigMerger.buildEffectiveConfig(
        "results", Optional.empty(), Map.of(), DefaultsForMode.asFlatMap("results"), msg -> {});

    assertEquals("FILE", merged.get("store.mode"));
  }
}
