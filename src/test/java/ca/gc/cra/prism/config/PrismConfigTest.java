package ca.gc.cra.prism.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.prism.application.pipeline.ShieldedPolicies;
import ca.gc.cra.prism.domain.aggregate.BucketPolicy;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import org.junit.jupiter.api.Test;

class PrismConfigTest {

  @Test
  void emptyMapYieldsDefaults() {
    PrismConfig config = PrismConfig.fromMap(Map.of());

    assertEquals("https://sandbox-api.3xpl.com", config.source().baseUrl());
    assertEquals(5, config.source().maxAttempts());
    assertEquals(1_000_000L, config.codec().scalingFactor());
    assertEquals(BucketPolicy.DYNAMIC_MAX, config.codec().bucketPolicy());
    assertEquals(PrismConfig.GatewayMode.LOCAL, config.gateway().mode());
    assertEquals(PrismConfig.StoreMode.MEMORY, config.store().mode());
    assertTrue(config.metrics().disabled());
  }

  @Test
  void overridesAreParsed() {
    PrismConfig config = PrismConfig.fromMap(Map.of(
        "source.baseUrl", "http://explorer.local:8080/",
        "source.maxAttempts", "7",
        "source.baseDelay", "250ms",
        "codec.bucketPolicy", "static",
        "codec.bucketWidth", "0.0005",
        "codec.shieldedPolicy", "flag",
        "codec.scalingFactor", "1_000",
        "gateway.mode", "REMOTE",
        "gateway.endpoint", "https://compute.local/",
        "pipeline.workers", "2"));

    assertEquals("http://explorer.local:8080", config.source().baseUrl());
    assertEquals(7, config.source().maxAttempts());
    assertEquals(Duration.ofMillis(250), config.source().baseDelay());
    assertEquals(BucketPolicy.STATIC, config.codec().bucketPolicy());
    assertEquals(0.0005, config.codec().bucketWidth());
    assertEquals(ShieldedPolicies.FLAG, config.codec().shieldedPolicy());
    assertEquals(1_000L, config.codec().scalingFactor());
    assertEquals("https://compute.local", config.gateway().endpoint());
    assertEquals(2, config.orchestrator().workers());
  }

  @Test
  void storeDirectoryIsAbsolute() {
    PrismConfig config = PrismConfig.fromMap(Map.of("store.mode", "file", "store.directory", "results"));

    assertEquals(PrismConfig.StoreMode.FILE, config.store().mode());
    assertEquals(Path.of("results").toAbsolutePath().normalize(), config.store().directory());
  }

  @Test
  void rejectsNonHttpScheme() {
    assertThrows(IllegalArgumentException.class,
        () -> PrismConfig.fromMap(Map.of("source.baseUrl", "ftp://explorer.local")));
  }

  @Test
  void rejectsUrlWithoutHost() {
    assertThrows(IllegalArgumentException.class,
        () -> PrismConfig.fromMap(Map.of("source.baseUrl", "https:///zcash")));
  }

  @Test
  void rejectsOutOfRangeAttempts() {
    assertThrows(IllegalArgumentException.class,
        () -> PrismConfig.fromMap(Map.of("source.maxAttempts", "0")));
    assertThrows(IllegalArgumentException.class,
        () -> PrismConfig.fromMap(Map.of("pipeline.stageMaxAttempts", "21")));
  }

  @Test
  void rejectsNonNumericValues() {
    assertThrows(IllegalArgumentException.class,
        () -> PrismConfig.fromMap(Map.of("codec.bucketCount", "ten")));
    assertThrows(IllegalArgumentException.class,
        () -> PrismConfig.fromMap(Map.of("summary.feeReference", "NaN")));
  }

  @Test
  void rejectsMaxDelayBelowBaseDelay() {
    assertThrows(IllegalArgumentException.class,
        () -> PrismConfig.fromMap(Map.of("source.baseDelay", "10s", "source.maxDelay", "1s")));
  }

  @Test
  void remoteGatewayNeedsEndpoint() {
    assertThrows(IllegalArgumentException.class,
        () -> PrismConfig.fromMap(Map.of("gateway.mode", "remote")));
  }

  @Test
  void rejectsUnknownEnumValues() {
    assertThrows(IllegalArgumentException.class,
        () -> PrismConfig.fromMap(Map.of("store.mode", "s3")));
    assertThrows(IllegalArgumentException.class,
        () -> PrismConfig.fromMap(Map.of("metricsExporter", "prometheus")));
  }
}
