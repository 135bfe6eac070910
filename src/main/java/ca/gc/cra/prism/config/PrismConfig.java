package ca.gc.cra.prism.config;

import ca.gc.cra.prism.application.pipeline.OrchestratorSettings;
import ca.gc.cra.prism.application.pipeline.ShieldedPolicies;
import ca.gc.cra.prism.domain.aggregate.BucketPolicy;
import ca.gc.cra.prism.validation.Durations;
import ca.gc.cra.prism.validation.Numbers;
import ca.gc.cra.prism.validation.Strings;
import java.net.URI;
import java.net.URISyntaxException;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> Typed, validated view of the flattened PRISM configuration.
 * <p><strong>Why:</strong> CLI arguments, YAML sections and embedded defaults all arrive as strings; this class is
 * the single place they are parsed and range-checked before any adapter is built.</p>
 * <p><strong>Role:</strong> Configuration aggregate consumed by {@link CompositionRoot}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Group settings per collaborator: source, codec, gateway, store, orchestrator, metrics.</li>
 *   <li>Fall back to {@link #defaults()} for keys that are absent or blank.</li>
 *   <li>Enforce cross-field rules, such as a remote gateway requiring an endpoint.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Immutable once constructed.</p>
 *
 * @since 0.1.0
 * @see DefaultsForMode
 */
public final class PrismConfig {
  static final String SOURCE_BASE_URL = "source.baseUrl";
  static final String SOURCE_CHAIN = "source.chain";
  static final String SOURCE_REQUEST_TIMEOUT = "source.requestTimeout";
  static final String SOURCE_MAX_ATTEMPTS = "source.maxAttempts";
  static final String SOURCE_BASE_DELAY = "source.baseDelay";
  static final String SOURCE_MAX_DELAY = "source.maxDelay";
  static final String SOURCE_CACHE_TTL = "source.cacheTtl";
  static final String SOURCE_CACHE_MAX_ENTRIES = "source.cacheMaxEntries";
  static final String CODEC_SCALING_FACTOR = "codec.scalingFactor";
  static final String CODEC_BUCKET_COUNT = "codec.bucketCount";
  static final String CODEC_BUCKET_POLICY = "codec.bucketPolicy";
  static final String CODEC_BUCKET_WIDTH = "codec.bucketWidth";
  static final String CODEC_SHIELDED_POLICY = "codec.shieldedPolicy";
  static final String GATEWAY_MODE = "gateway.mode";
  static final String GATEWAY_ENDPOINT = "gateway.endpoint";
  static final String GATEWAY_REQUEST_TIMEOUT = "gateway.requestTimeout";
  static final String GATEWAY_MAX_POLLS = "gateway.maxPolls";
  static final String GATEWAY_POLL_BASE_DELAY = "gateway.pollBaseDelay";
  static final String GATEWAY_POLL_MAX_DELAY = "gateway.pollMaxDelay";
  static final String GATEWAY_SIMULATED_PENDING_POLLS = "gateway.simulatedPendingPolls";
  static final String GATEWAY_MAX_VECTOR_LENGTH = "gateway.maxVectorLength";
  static final String STORE_MODE = "store.mode";
  static final String STORE_DIRECTORY = "store.directory";
  static final String STORE_CACHE_TTL = "store.cacheTtl";
  static final String STORE_CACHE_MAX_ENTRIES = "store.cacheMaxEntries";
  static final String PIPELINE_WORKERS = "pipeline.workers";
  static final String PIPELINE_STAGE_MAX_ATTEMPTS = "pipeline.stageMaxAttempts";
  static final String PIPELINE_STAGE_BASE_DELAY = "pipeline.stageBaseDelay";
  static final String PIPELINE_STAGE_MAX_DELAY = "pipeline.stageMaxDelay";
  static final String PIPELINE_JOB_TTL = "pipeline.jobTtl";
  static final String SUMMARY_FEE_REFERENCE = "summary.feeReference";
  static final String METRICS_EXPORTER = "metricsExporter";
  static final String OTEL_ENDPOINT = "otelEndpoint";
  static final String METRICS_INTERVAL = "metricsInterval";

  private static final int MAX_URL_LENGTH = 2_048;
  private static final int MAX_ATTEMPTS = 20;
  private static final int MAX_BUCKETS = 4_096;
  private static final int MAX_POLLS = 10_000;
  private static final int MAX_WORKERS = 64;

  private final SourceSettings source;
  private final CodecSettings codec;
  private final GatewaySettings gateway;
  private final StoreSettings store;
  private final OrchestratorSettings orchestrator;
  private final MetricsSettings metrics;
  private final double summaryFeeReference;

  /**
   * Creates a configuration from already-validated groups.
   *
   * @param source upstream explorer settings
   * @param codec aggregation and encoding settings
   * @param gateway computation gateway settings
   * @param store result store settings
   * @param orchestrator job orchestration settings
   * @param metrics metrics exporter settings
   * @param summaryFeeReference fee scale used to normalize summary embeddings; positive
   */
  public PrismConfig(
      SourceSettings source,
      CodecSettings codec,
      GatewaySettings gateway,
      StoreSettings store,
      OrchestratorSettings orchestrator,
      MetricsSettings metrics,
      double summaryFeeReference) {
    this.source = Objects.requireNonNull(source, "source");
    this.codec = Objects.requireNonNull(codec, "codec");
    this.gateway = Objects.requireNonNull(gateway, "gateway");
    this.store = Objects.requireNonNull(store, "store");
    this.orchestrator = Objects.requireNonNull(orchestrator, "orchestrator");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    if (!(summaryFeeReference > 0) || !Double.isFinite(summaryFeeReference)) {
      throw new IllegalArgumentException("summary.feeReference must be positive (was " + summaryFeeReference + ")");
    }
    this.summaryFeeReference = summaryFeeReference;
  }

  /**
   * Returns the embedded defaults: the public 3xpl sandbox for zcash, a local simulator, an in-memory store and
   * metrics export disabled.
   *
   * @return default configuration
   */
  public static PrismConfig defaults() {
    return new PrismConfig(
        new SourceSettings(
            "https://sandbox-api.3xpl.com",
            "zcash",
            Duration.ofSeconds(10),
            5,
            Duration.ofSeconds(1),
            Duration.ofSeconds(30),
            Duration.ofSeconds(60),
            10_000),
        new CodecSettings(1_000_000L, 10, BucketPolicy.DYNAMIC_MAX, 0.0001d, ShieldedPolicies.ANY),
        new GatewaySettings(
            GatewayMode.LOCAL,
            "",
            Duration.ofSeconds(10),
            30,
            Duration.ofMillis(200),
            Duration.ofSeconds(5),
            2,
            4_096),
        new StoreSettings(StoreMode.MEMORY, defaultStoreDirectory(), Duration.ofMinutes(10), 1_000),
        OrchestratorSettings.defaults(),
        new MetricsSettings("none", "", Duration.ofSeconds(60)),
        0.0001d);
  }

  /**
   * Builds a configuration from flattened {@code key=value} pairs, falling back to {@link #defaults()}.
   *
   * @param args flattened configuration; must not be {@code null}
   * @return validated configuration
   * @throws IllegalArgumentException if a value is malformed or out of range
   */
  public static PrismConfig fromMap(Map<String, String> args) {
    Objects.requireNonNull(args, "args");
    PrismConfig d = defaults();

    SourceSettings source = new SourceSettings(
        httpUrl(SOURCE_BASE_URL, stringOr(args, SOURCE_BASE_URL, d.source.baseUrl())),
        Strings.requirePrintableAscii(SOURCE_CHAIN, stringOr(args, SOURCE_CHAIN, d.source.chain()), 64),
        durationOr(args, SOURCE_REQUEST_TIMEOUT, d.source.requestTimeout()),
        intOr(args, SOURCE_MAX_ATTEMPTS, d.source.maxAttempts(), 1, MAX_ATTEMPTS),
        durationOr(args, SOURCE_BASE_DELAY, d.source.baseDelay()),
        durationOr(args, SOURCE_MAX_DELAY, d.source.maxDelay()),
        durationOr(args, SOURCE_CACHE_TTL, d.source.cacheTtl()),
        longOr(args, SOURCE_CACHE_MAX_ENTRIES, d.source.cacheMaxEntries(), 1, 10_000_000));

    CodecSettings codec = new CodecSettings(
        longOr(args, CODEC_SCALING_FACTOR, d.codec.scalingFactor(), 1, 1_000_000_000_000L),
        intOr(args, CODEC_BUCKET_COUNT, d.codec.bucketCount(), 1, MAX_BUCKETS),
        isBlank(args.get(CODEC_BUCKET_POLICY)) ? d.codec.bucketPolicy() : BucketPolicy.parse(args.get(CODEC_BUCKET_POLICY)),
        doubleOr(args, CODEC_BUCKET_WIDTH, d.codec.bucketWidth()),
        isBlank(args.get(CODEC_SHIELDED_POLICY))
            ? d.codec.shieldedPolicy()
            : ShieldedPolicies.parse(args.get(CODEC_SHIELDED_POLICY)));

    GatewayMode gatewayMode = isBlank(args.get(GATEWAY_MODE))
        ? d.gateway.mode()
        : GatewayMode.fromString(args.get(GATEWAY_MODE));
    String endpoint = stringOr(args, GATEWAY_ENDPOINT, d.gateway.endpoint());
    GatewaySettings gateway = new GatewaySettings(
        gatewayMode,
        endpoint.isBlank() ? "" : httpUrl(GATEWAY_ENDPOINT, endpoint),
        durationOr(args, GATEWAY_REQUEST_TIMEOUT, d.gateway.requestTimeout()),
        intOr(args, GATEWAY_MAX_POLLS, d.gateway.maxPolls(), 1, MAX_POLLS),
        durationOr(args, GATEWAY_POLL_BASE_DELAY, d.gateway.pollBaseDelay()),
        durationOr(args, GATEWAY_POLL_MAX_DELAY, d.gateway.pollMaxDelay()),
        intOr(args, GATEWAY_SIMULATED_PENDING_POLLS, d.gateway.simulatedPendingPolls(), 0, MAX_POLLS),
        intOr(args, GATEWAY_MAX_VECTOR_LENGTH, d.gateway.maxVectorLength(), 1, 1_000_000));

    StoreSettings store = new StoreSettings(
        isBlank(args.get(STORE_MODE)) ? d.store.mode() : StoreMode.fromString(args.get(STORE_MODE)),
        isBlank(args.get(STORE_DIRECTORY)) ? d.store.directory() : parsePath(STORE_DIRECTORY, args.get(STORE_DIRECTORY)),
        durationOr(args, STORE_CACHE_TTL, d.store.cacheTtl()),
        longOr(args, STORE_CACHE_MAX_ENTRIES, d.store.cacheMaxEntries(), 1, 10_000_000));

    OrchestratorSettings orchestrator = new OrchestratorSettings(
        intOr(args, PIPELINE_WORKERS, d.orchestrator.workers(), 1, MAX_WORKERS),
        intOr(args, PIPELINE_STAGE_MAX_ATTEMPTS, d.orchestrator.stageMaxAttempts(), 1, MAX_ATTEMPTS),
        durationOr(args, PIPELINE_STAGE_BASE_DELAY, d.orchestrator.stageBaseDelay()),
        durationOr(args, PIPELINE_STAGE_MAX_DELAY, d.orchestrator.stageMaxDelay()),
        durationOr(args, PIPELINE_JOB_TTL, d.orchestrator.jobTtl()));

    MetricsSettings metrics = new MetricsSettings(
        stringOr(args, METRICS_EXPORTER, d.metrics.exporter()),
        stringOr(args, OTEL_ENDPOINT, d.metrics.endpoint()),
        durationOr(args, METRICS_INTERVAL, d.metrics.interval()));

    return new PrismConfig(
        source, codec, gateway, store, orchestrator, metrics,
        doubleOr(args, SUMMARY_FEE_REFERENCE, d.summaryFeeReference));
  }

  public SourceSettings source() {
    return source;
  }

  public CodecSettings codec() {
    return codec;
  }

  public GatewaySettings gateway() {
    return gateway;
  }

  public StoreSettings store() {
    return store;
  }

  public OrchestratorSettings orchestrator() {
    return orchestrator;
  }

  public MetricsSettings metrics() {
    return metrics;
  }

  public double summaryFeeReference() {
    return summaryFeeReference;
  }

  /**
   * Upstream block explorer settings.
   *
   * @param baseUrl explorer base URL
   * @param chain chain segment of the request path
   * @param requestTimeout per-request timeout
   * @param maxAttempts fetch attempts per block, including the first
   * @param baseDelay first retry delay
   * @param maxDelay cap on a single retry delay
   * @param cacheTtl lifetime of cached pages
   * @param cacheMaxEntries bound on cached pages
   */
  public record SourceSettings(
      String baseUrl,
      String chain,
      Duration requestTimeout,
      int maxAttempts,
      Duration baseDelay,
      Duration maxDelay,
      Duration cacheTtl,
      long cacheMaxEntries) {
    public SourceSettings {
      Strings.requireNonBlank("source.baseUrl", baseUrl);
      Strings.requireNonBlank("source.chain", chain);
      Numbers.requirePositive("source.requestTimeout", requestTimeout);
      Numbers.requirePositive("source.cacheTtl", cacheTtl);
      Objects.requireNonNull(baseDelay, "baseDelay");
      Objects.requireNonNull(maxDelay, "maxDelay");
      if (maxDelay.compareTo(baseDelay) < 0) {
        throw new IllegalArgumentException("source.maxDelay must be >= source.baseDelay");
      }
    }
  }

  /**
   * Aggregation and encoding settings.
   *
   * @param scalingFactor fixed-point multiplier applied to real-valued fields
   * @param bucketCount number of fee histogram buckets
   * @param bucketPolicy how bucket boundaries are chosen
   * @param bucketWidth bucket width for {@link BucketPolicy#STATIC}
   * @param shieldedPolicy predicate deciding whether a transaction counts as shielded
   */
  public record CodecSettings(
      long scalingFactor,
      int bucketCount,
      BucketPolicy bucketPolicy,
      double bucketWidth,
      ShieldedPolicies shieldedPolicy) {
    public CodecSettings {
      Objects.requireNonNull(bucketPolicy, "bucketPolicy");
      Objects.requireNonNull(shieldedPolicy, "shieldedPolicy");
      if (scalingFactor <= 0) {
        throw new IllegalArgumentException("codec.scalingFactor must be positive");
      }
      if (bucketCount < 1) {
        throw new IllegalArgumentException("codec.bucketCount must be >= 1");
      }
      if (bucketPolicy == BucketPolicy.STATIC && !(bucketWidth > 0 && Double.isFinite(bucketWidth))) {
        throw new IllegalArgumentException("codec.bucketWidth must be positive for STATIC bucketing");
      }
    }
  }

  /**
   * Computation gateway settings.
   *
   * @param mode local simulator or remote HTTP service
   * @param endpoint remote service base URL; blank for {@link GatewayMode#LOCAL}
   * @param requestTimeout per-request timeout against the remote service
   * @param maxPolls polls allowed before a computation times out
   * @param pollBaseDelay spacing after the first pending poll
   * @param pollMaxDelay cap on poll spacing
   * @param simulatedPendingPolls pending replies the local simulator returns before completing
   * @param maxVectorLength longest vector the local simulator accepts
   */
  public record GatewaySettings(
      GatewayMode mode,
      String endpoint,
      Duration requestTimeout,
      int maxPolls,
      Duration pollBaseDelay,
      Duration pollMaxDelay,
      int simulatedPendingPolls,
      int maxVectorLength) {
    public GatewaySettings {
      Objects.requireNonNull(mode, "mode");
      endpoint = endpoint == null ? "" : endpoint.trim();
      if (mode == GatewayMode.REMOTE && endpoint.isEmpty()) {
        throw new IllegalArgumentException("gateway.endpoint is required when gateway.mode=REMOTE");
      }
      Numbers.requirePositive("gateway.requestTimeout", requestTimeout);
      Objects.requireNonNull(pollBaseDelay, "pollBaseDelay");
      Objects.requireNonNull(pollMaxDelay, "pollMaxDelay");
      if (maxPolls < 1) {
        throw new IllegalArgumentException("gateway.maxPolls must be >= 1");
      }
    }
  }

  /**
   * Result store settings.
   *
   * @param mode durable backend
   * @param directory root of the file backend
   * @param cacheTtl read cache lifetime
   * @param cacheMaxEntries read cache bound
   */
  public record StoreSettings(StoreMode mode, Path directory, Duration cacheTtl, long cacheMaxEntries) {
    public StoreSettings {
      Objects.requireNonNull(mode, "mode");
      Objects.requireNonNull(directory, "directory");
      Numbers.requirePositive("store.cacheTtl", cacheTtl);
      if (cacheMaxEntries < 1) {
        throw new IllegalArgumentException("store.cacheMaxEntries must be >= 1");
      }
    }
  }

  /**
   * Metrics exporter settings.
   *
   * @param exporter {@code otlp} or {@code none}; blank defers to {@code OTEL_METRICS_EXPORTER}
   * @param endpoint OTLP endpoint; blank defers to {@code OTEL_EXPORTER_OTLP_ENDPOINT}
   * @param interval export interval
   */
  public record MetricsSettings(String exporter, String endpoint, Duration interval) {
    public MetricsSettings {
      exporter = exporter == null ? "" : exporter.trim().toLowerCase(Locale.ROOT);
      if (!exporter.isEmpty() && !exporter.equals("otlp") && !exporter.equals("none")) {
        throw new IllegalArgumentException("metricsExporter must be 'otlp' or 'none'");
      }
      endpoint = endpoint == null ? "" : endpoint.trim();
      Numbers.requirePositive("metricsInterval", interval);
    }

    /**
     * Returns {@code true} when metrics export is explicitly disabled.
     *
     * @return whether the exporter is {@code none}
     */
    public boolean disabled() {
      return exporter.equals("none");
    }
  }

  /** Computation backend selection. */
  public enum GatewayMode {
    /** In-process deterministic simulator. */
    LOCAL,
    /** HTTP computation service. */
    REMOTE;

    static GatewayMode fromString(String raw) {
      return parseEnum(GatewayMode.class, GATEWAY_MODE, raw);
    }
  }

  /** Durable result backend selection. */
  public enum StoreMode {
    /** Process-local map; results vanish on exit. */
    MEMORY,
    /** One JSON document per key under {@code store.directory}. */
    FILE;

    static StoreMode fromString(String raw) {
      return parseEnum(StoreMode.class, STORE_MODE, raw);
    }
  }

  private static <E extends Enum<E>> E parseEnum(Class<E> type, String key, String raw) {
    try {
      return Enum.valueOf(type, Strings.requireNonBlank(key, raw).toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException(key + " has unsupported value: " + raw, ex);
    }
  }

  private static boolean isBlank(String value) {
    return value == null || value.isBlank();
  }

  private static String stringOr(Map<String, String> kv, String key, String fallback) {
    String raw = kv.get(key);
    return isBlank(raw) ? fallback : raw.trim();
  }

  private static Duration durationOr(Map<String, String> kv, String key, Duration fallback) {
    String raw = kv.get(key);
    return isBlank(raw) ? fallback : Durations.parse(key, raw);
  }

  private static int intOr(Map<String, String> kv, String key, int fallback, int min, int max) {
    return Math.toIntExact(longOr(kv, key, fallback, min, max));
  }

  private static long longOr(Map<String, String> kv, String key, long fallback, long min, long max) {
    String raw = kv.get(key);
    if (isBlank(raw)) {
      return Numbers.requireRange(key, fallback, min, max);
    }
    try {
      return Numbers.requireRange(key, Long.parseLong(raw.trim().replace("_", "")), min, max);
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(key + " must be an integer between " + min + " and " + max, ex);
    }
  }

  private static double doubleOr(Map<String, String> kv, String key, double fallback) {
    String raw = kv.get(key);
    if (isBlank(raw)) {
      return fallback;
    }
    try {
      double parsed = Double.parseDouble(raw.trim());
      if (!Double.isFinite(parsed)) {
        throw new IllegalArgumentException(key + " must be finite");
      }
      return parsed;
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(key + " must be a number (was " + raw + ")", ex);
    }
  }

  private static String httpUrl(String key, String raw) {
    String value = Strings.requirePrintableAscii(key, raw, MAX_URL_LENGTH);
    try {
      URI uri = new URI(value);
      String scheme = uri.getScheme();
      if (scheme == null || (!scheme.equalsIgnoreCase("http") && !scheme.equalsIgnoreCase("https"))) {
        throw new IllegalArgumentException(key + " must use http or https scheme");
      }
      if (uri.getHost() == null || uri.getHost().isBlank()) {
        throw new IllegalArgumentException(key + " must include a host");
      }
    } catch (URISyntaxException ex) {
      throw new IllegalArgumentException(key + " must be a valid URI", ex);
    }
    return value.endsWith("/") ? value.substring(0, value.length() - 1) : value;
  }

  private static Path parsePath(String name, String value) {
    try {
      return Path.of(Strings.requireNonBlank(name, value).trim()).toAbsolutePath().normalize();
    } catch (InvalidPathException ex) {
      throw new IllegalArgumentException(name + " is not a valid path: " + value, ex);
    }
  }

  static Path defaultStoreDirectory() {
    String userHome = System.getProperty("user.home", ".");
    return Path.of(userHome, ".prism", "results");
  }
}
