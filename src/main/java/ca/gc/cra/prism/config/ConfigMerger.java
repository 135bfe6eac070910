package ca.gc.cra.prism.config;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Merges configuration from defaults, YAML, and CLI sources while enforcing precedence and invariants.
 */
public final class ConfigMerger {

  private ConfigMerger() {}

  /**
   * Builds an effective configuration map using precedence CLI > YAML > defaults.
   *
   * <p>Every key must be one the mode's defaults declare; an unknown key is almost always a typo and would
   * otherwise be silently ignored.</p>
   *
   * @param mode active CLI mode
   * @param yaml optional YAML-derived settings for the mode
   * @param cli CLI key/value overrides (may be empty)
   * @param defaults embedded defaults for the mode
   * @param warn consumer invoked when a CLI key overrides a YAML key
   * @return immutable merged configuration map
   * @throws IllegalArgumentException when a key is unknown or validation fails
   */
  public static Map<String, String> buildEffectiveConfig(
      String mode,
      Optional<Map<String, String>> yaml,
      Map<String, String> cli,
      Map<String, String> defaults,
      Consumer<String> warn) {
    Objects.requireNonNull(mode, "mode");
    Objects.requireNonNull(yaml, "yaml");
    Map<String, String> defaultsCopy = defaults == null ? Map.of() : defaults;
    Map<String, String> yamlCopy = yaml.orElse(Map.of());
    Map<String, String> cliCopy = cli == null ? Map.of() : cli;

    Map<String, String> merged = new LinkedHashMap<>(defaultsCopy);
    for (Map.Entry<String, String> entry : yamlCopy.entrySet()) {
      requireKnown(mode, "YAML", entry.getKey(), defaultsCopy);
      merged.put(entry.getKey(), entry.getValue());
    }
    for (Map.Entry<String, String> entry : cliCopy.entrySet()) {
      String key = entry.getKey();
      if (key == null) {
        continue;
      }
      requireKnown(mode, "CLI", key, defaultsCopy);
      if (yamlCopy.containsKey(key) && warn != null) {
        warn.accept("CLI overrides YAML for key: " + key);
      }
      if (entry.getValue() != null) {
        merged.put(key, entry.getValue());
      }
    }

    validate(mode, merged);
    return Map.copyOf(merged);
  }

  private static void requireKnown(String mode, String origin, String key, Map<String, String> defaults) {
    if (!defaults.isEmpty() && !defaults.containsKey(key)) {
      throw new IllegalArgumentException(
          "Unknown " + origin + " configuration key for " + mode + ": " + key);
    }
  }

  private static void validate(String mode, Map<String, String> effective) {
    String gatewayMode = trim(effective.get(PrismConfig.GATEWAY_MODE));
    if (gatewayMode.equalsIgnoreCase("remote") && trim(effective.get(PrismConfig.GATEWAY_ENDPOINT)).isEmpty()) {
      throw new IllegalArgumentException("gateway.endpoint is required when gateway.mode=REMOTE");
    }

    String policy = trim(effective.get(PrismConfig.CODEC_BUCKET_POLICY)).toUpperCase(Locale.ROOT);
    if (policy.equals("STATIC") && trim(effective.get(PrismConfig.CODEC_BUCKET_WIDTH)).isEmpty()) {
      throw new IllegalArgumentException("codec.bucketWidth is required when codec.bucketPolicy=STATIC");
    }

    String storeMode = trim(effective.get(PrismConfig.STORE_MODE));
    if (storeMode.equalsIgnoreCase("file") && trim(effective.get(PrismConfig.STORE_DIRECTORY)).isEmpty()) {
      throw new IllegalArgumentException("store.directory is required when store.mode=FILE");
    }

    if ("aggregate".equalsIgnoreCase(mode) || "analyze".equalsIgnoreCase(mode)) {
      if (trim(effective.get(DefaultsForMode.RANGE)).isEmpty()) {
        throw new IllegalArgumentException("range is required for " + mode + " (e.g. range=2500000-2500010)");
      }
    }
  }

  private static String trim(String value) {
    return value == null ? "" : value.trim();
  }
}
