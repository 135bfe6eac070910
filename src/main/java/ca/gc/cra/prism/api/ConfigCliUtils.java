package ca.gc.cra.prism.api;

import ca.gc.cra.prism.config.ConfigMerger;
import ca.gc.cra.prism.config.DefaultsForMode;
import ca.gc.cra.prism.config.PrismConfig;
import ca.gc.cra.prism.config.YamlConfigLoader;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Shared steps every CLI runs before wiring: pull out {@code config=PATH}, load the YAML, merge with defaults and
 * arguments, then parse the typed configuration.
 */
final class ConfigCliUtils {
  private static final Logger log = LoggerFactory.getLogger(ConfigCliUtils.class);

  private ConfigCliUtils() {}

  /**
   * Resolves the effective configuration for {@code mode}.
   *
   * @param mode CLI mode
   * @param args parsed {@code key=value} arguments; {@code config} is removed from the map
   * @return merged flat map plus the typed view of it
   * @throws IOException if the YAML file cannot be read
   * @throws IllegalArgumentException if the YAML file is missing or any value is invalid
   */
  static Resolved resolve(String mode, Map<String, String> args) throws IOException {
    String configPath = extractConfigPath(args);
    Optional<Map<String, String>> yaml = Optional.empty();
    if (configPath != null) {
      Path yamlPath = Path.of(configPath);
      if (!Files.exists(yamlPath)) {
        throw new IllegalArgumentException("Configuration file does not exist: " + yamlPath);
      }
      yaml = YamlConfigLoader.load(yamlPath, mode);
      log.debug("Loaded {} YAML keys from {}", yaml.map(Map::size).orElse(0), yamlPath);
    }
    Map<String, String> effective = ConfigMerger.buildEffectiveConfig(
        mode, yaml, args, DefaultsForMode.asFlatMap(mode), log::warn);
    return new Resolved(effective, PrismConfig.fromMap(effective));
  }

  static String extractConfigPath(Map<String, String> args) {
    if (args == null || args.isEmpty()) {
      return null;
    }
    String value = args.remove("config");
    if (value != null && !value.isBlank()) {
      return value.trim();
    }
    return null;
  }

  record Resolved(Map<String, String> effective, PrismConfig config) {
    String get(String key) {
      String value = effective.get(key);
      return value == null ? "" : value.trim();
    }
  }
}
