package ca.gc.cra.prism.config;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Loads PRISM configuration from a YAML document and flattens sections into dotted key/value maps.
 *
 * <p>A document holds a {@code common} section plus one optional section per CLI mode; the mode section wins
 * over {@code common}. Nested mappings flatten to dotted keys, so {@code source: {chain: zcash}} becomes
 * {@code source.chain=zcash}.</p>
 */
public final class YamlConfigLoader {
  private static final Logger log = LoggerFactory.getLogger(YamlConfigLoader.class);
  private static final Set<String> SECTIONS = Set.of("common", "aggregate", "analyze", "results");

  private YamlConfigLoader() {}

  /**
   * Loads YAML from {@code path} and merges the {@code common} section with the requested {@code mode} section.
   *
   * @param path location of the YAML configuration
   * @param mode CLI mode (aggregate, analyze, results)
   * @return flat map of merged configuration, or empty when the file does not exist
   * @throws IOException when the file cannot be read
   * @throws IllegalArgumentException when the YAML structure is invalid
   */
  public static Optional<Map<String, String>> load(Path path, String mode) throws IOException {
    Objects.requireNonNull(path, "path");
    Objects.requireNonNull(mode, "mode");
    if (!Files.exists(path)) {
      return Optional.empty();
    }
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      return Optional.of(read(reader, mode, path.toString()));
    }
  }

  /**
   * Loads a YAML document bundled on the classpath.
   *
   * @param resource classpath resource name, for example {@code prism-defaults.yaml}
   * @param mode CLI mode
   * @return flat map of merged configuration, or empty when the resource is absent
   * @throws IOException when the resource cannot be read
   */
  public static Optional<Map<String, String>> loadResource(String resource, String mode) throws IOException {
    Objects.requireNonNull(resource, "resource");
    Objects.requireNonNull(mode, "mode");
    InputStream in = YamlConfigLoader.class.getClassLoader().getResourceAsStream(resource);
    if (in == null) {
      return Optional.empty();
    }
    try (Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
      return Optional.of(read(reader, mode, "classpath:" + resource));
    }
  }

  static Map<String, String> read(Reader reader, String mode, String origin) {
    String normalizedMode = mode.trim().toLowerCase(Locale.ROOT);
    Object document;
    try {
      document = new Yaml(new SafeConstructor(new LoaderOptions())).load(reader);
    } catch (YAMLException ex) {
      throw new IllegalArgumentException("Failed to parse YAML config at " + origin, ex);
    }
    if (document == null) {
      return Map.of();
    }
    Map<String, Object> root = asMap(document, "root");
    for (String section : root.keySet()) {
      if (!SECTIONS.contains(section.trim().toLowerCase(Locale.ROOT))) {
        log.warn("Ignoring unknown section '{}' in {}", section, origin);
      }
    }

    Map<String, String> flattened = new LinkedHashMap<>();
    Object common = findSection(root, "common");
    if (common != null) {
      flatten(asMap(common, "common"), "", flattened);
    }
    Object modeSection = findSection(root, normalizedMode);
    if (modeSection != null) {
      flatten(asMap(modeSection, normalizedMode), "", flattened);
    }
    return Map.copyOf(flattened);
  }

  private static Map<String, Object> asMap(Object node, String context) {
    if (!(node instanceof Map<?, ?> raw)) {
      throw new IllegalArgumentException(context + " section must be a mapping");
    }
    Map<String, Object> map = new LinkedHashMap<>();
    for (Map.Entry<?, ?> entry : raw.entrySet()) {
      if (!(entry.getKey() instanceof String key)) {
        throw new IllegalArgumentException(context + " section contains non-string key");
      }
      map.put(key, entry.getValue());
    }
    return map;
  }

  private static Object findSection(Map<String, Object> root, String name) {
    for (Map.Entry<String, Object> entry : root.entrySet()) {
      if (entry.getKey().trim().toLowerCase(Locale.ROOT).equals(name)) {
        return entry.getValue();
      }
    }
    return null;
  }

  private static void flatten(Map<String, Object> source, String prefix, Map<String, String> target) {
    for (Map.Entry<String, Object> entry : source.entrySet()) {
      String key = entry.getKey().trim();
      if (key.isEmpty()) {
        throw new IllegalArgumentException("YAML contains blank keys");
      }
      String composite = prefix.isEmpty() ? key : prefix + '.' + key;
      Object value = entry.getValue();
      if (value == null) {
        target.put(composite, "");
      } else if (value instanceof Map<?, ?> nested) {
        flatten(asMap(nested, composite), composite, target);
      } else if (value instanceof Iterable<?>) {
        throw new IllegalArgumentException("YAML arrays are not supported for key " + composite);
      } else {
        target.put(composite, value.toString());
      }
    }
  }
}
