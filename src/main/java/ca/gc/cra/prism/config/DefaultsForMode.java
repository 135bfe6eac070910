package ca.gc.cra.prism.config;

import ca.gc.cra.prism.validation.Durations;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Supplies flattened default configuration maps for each PRISM CLI mode.
 *
 * <p>The defaults remain the single source of truth for optional YAML keys; every key documented for a mode
 * appears here so {@link ConfigMerger} can tell a typo from a real override.</p>
 */
public final class DefaultsForMode {
  /** Mode keys: the block range to fetch. */
  public static final String RANGE = "range";
  /** Mode keys: the reporting window label. */
  public static final String WINDOW = "window";
  /** Mode keys: an explicit job key. */
  public static final String JOB_KEY = "jobKey";
  /** Mode keys: a stored result key. */
  public static final String KEY = "key";
  /** Mode keys: how often the analyze CLI polls job status. */
  public static final String POLL_INTERVAL = "pollInterval";
  /** Mode keys: how long the analyze CLI waits for a terminal status. */
  public static final String WAIT_TIMEOUT = "waitTimeout";

  private static final Map<String, String> COMMON_DEFAULTS = buildCommonDefaults();

  private DefaultsForMode() {}

  /**
   * Returns a flattened map of defaults for the requested mode merged with common defaults.
   *
   * @param mode target CLI mode (aggregate, analyze, results)
   * @return unmodifiable map of default key/value pairs as strings
   */
  public static Map<String, String> asFlatMap(String mode) {
    Objects.requireNonNull(mode, "mode");
    String normalized = mode.trim().toLowerCase(Locale.ROOT);
    Map<String, String> defaults = new LinkedHashMap<>(COMMON_DEFAULTS);
    defaults.putAll(switch (normalized) {
      case "aggregate" -> buildAggregateDefaults();
      case "analyze" -> buildAnalyzeDefaults();
      case "results" -> buildResultsDefaults();
      default -> throw new IllegalArgumentException("Unsupported mode: " + mode);
    });
    return Map.copyOf(defaults);
  }

  private static Map<String, String> buildCommonDefaults() {
    PrismConfig defaults = PrismConfig.defaults();
    Map<String, String> map = new LinkedHashMap<>();
    map.put(PrismConfig.SOURCE_BASE_URL, defaults.source().baseUrl());
    map.put(PrismConfig.SOURCE_CHAIN, defaults.source().chain());
    map.put(PrismConfig.SOURCE_REQUEST_TIMEOUT, Durations.format(defaults.source().requestTimeout()));
    map.put(PrismConfig.SOURCE_MAX_ATTEMPTS, Integer.toString(defaults.source().maxAttempts()));
    map.put(PrismConfig.SOURCE_BASE_DELAY, Durations.format(defaults.source().baseDelay()));
    map.put(PrismConfig.SOURCE_MAX_DELAY, Durations.format(defaults.source().maxDelay()));
    map.put(PrismConfig.SOURCE_CACHE_TTL, Durations.format(defaults.source().cacheTtl()));
    map.put(PrismConfig.SOURCE_CACHE_MAX_ENTRIES, Long.toString(defaults.source().cacheMaxEntries()));
    map.put(PrismConfig.CODEC_SCALING_FACTOR, Long.toString(defaults.codec().scalingFactor()));
    map.put(PrismConfig.CODEC_BUCKET_COUNT, Integer.toString(defaults.codec().bucketCount()));
    map.put(PrismConfig.CODEC_BUCKET_POLICY, defaults.codec().bucketPolicy().name());
    map.put(PrismConfig.CODEC_BUCKET_WIDTH, Double.toString(defaults.codec().bucketWidth()));
    map.put(PrismConfig.CODEC_SHIELDED_POLICY, defaults.codec().shieldedPolicy().name());
    map.put(PrismConfig.SUMMARY_FEE_REFERENCE, Double.toString(defaults.summaryFeeReference()));
    map.put(PrismConfig.METRICS_EXPORTER, defaults.metrics().exporter());
    map.put(PrismConfig.OTEL_ENDPOINT, defaults.metrics().endpoint());
    map.put(PrismConfig.METRICS_INTERVAL, Durations.format(defaults.metrics().interval()));
    map.put("verbose", "false");
    return Map.copyOf(map);
  }

  private static Map<String, String> buildAggregateDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put(RANGE, "");
    map.put(WINDOW, "day");
    return map;
  }

  private static Map<String, String> buildAnalyzeDefaults() {
    PrismConfig defaults = PrismConfig.defaults();
    Map<String, String> map = new LinkedHashMap<>();
    map.put(RANGE, "");
    map.put(WINDOW, "day");
    map.put(JOB_KEY, "");
    map.put(POLL_INTERVAL, "500ms");
    map.put(WAIT_TIMEOUT, "10m");
    map.put(PrismConfig.GATEWAY_MODE, defaults.gateway().mode().name());
    map.put(PrismConfig.GATEWAY_ENDPOINT, defaults.gateway().endpoint());
    map.put(PrismConfig.GATEWAY_REQUEST_TIMEOUT, Durations.format(defaults.gateway().requestTimeout()));
    map.put(PrismConfig.GATEWAY_MAX_POLLS, Integer.toString(defaults.gateway().maxPolls()));
    map.put(PrismConfig.GATEWAY_POLL_BASE_DELAY, Durations.format(defaults.gateway().pollBaseDelay()));
    map.put(PrismConfig.GATEWAY_POLL_MAX_DELAY, Durations.format(defaults.gateway().pollMaxDelay()));
    map.put(
        PrismConfig.GATEWAY_SIMULATED_PENDING_POLLS,
        Integer.toString(defaults.gateway().simulatedPendingPolls()));
    map.put(PrismConfig.GATEWAY_MAX_VECTOR_LENGTH, Integer.toString(defaults.gateway().maxVectorLength()));
    map.put(PrismConfig.PIPELINE_WORKERS, Integer.toString(defaults.orchestrator().workers()));
    map.put(PrismConfig.PIPELINE_STAGE_MAX_ATTEMPTS, Integer.toString(defaults.orchestrator().stageMaxAttempts()));
    map.put(PrismConfig.PIPELINE_STAGE_BASE_DELAY, Durations.format(defaults.orchestrator().stageBaseDelay()));
    map.put(PrismConfig.PIPELINE_STAGE_MAX_DELAY, Durations.format(defaults.orchestrator().stageMaxDelay()));
    map.put(PrismConfig.PIPELINE_JOB_TTL, Durations.format(defaults.orchestrator().jobTtl()));
    map.putAll(storeDefaults());
    return map;
  }

  private static Map<String, String> buildResultsDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put(KEY, "");
    map.put(JOB_KEY, "");
    map.put(WINDOW, "");
    map.putAll(storeDefaults());
    return map;
  }

  // CLI runs persist to disk so that results written by analyze are visible to a later results invocation.
  private static Map<String, String> storeDefaults() {
    PrismConfig defaults = PrismConfig.defaults();
    Map<String, String> map = new LinkedHashMap<>();
    map.put(PrismConfig.STORE_MODE, PrismConfig.StoreMode.FILE.name());
    map.put(PrismConfig.STORE_DIRECTORY, defaults.store().directory().toString());
    map.put(PrismConfig.STORE_CACHE_TTL, Durations.format(defaults.store().cacheTtl()));
    map.put(PrismConfig.STORE_CACHE_MAX_ENTRIES, Long.toString(defaults.store().cacheMaxEntries()));
    return map;
  }
}
