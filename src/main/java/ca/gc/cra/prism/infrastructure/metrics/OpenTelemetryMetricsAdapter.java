package ca.gc.cra.prism.infrastructure.metrics;

import ca.gc.cra.prism.application.port.MetricsPort;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.LongHistogram;
import io.opentelemetry.api.metrics.Meter;
import java.time.Duration;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Forwards PRISM counters and observations to OpenTelemetry instruments.
 *
 * <p>Dotted PRISM keys map one-to-one onto instrument names after sanitizing characters OpenTelemetry rejects.
 * Observations become histograms; keys ending in {@code Millis} carry unit {@code ms}.</p>
 *
 * @since PRISM 0.1
 */
public final class OpenTelemetryMetricsAdapter implements MetricsPort, AutoCloseable {
  private final OpenTelemetryBootstrap.BootstrapResult bootstrap;
  private final Meter meter;
  private final ConcurrentMap<String, LongCounter> counters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, LongHistogram> histograms = new ConcurrentHashMap<>();

  /**
   * Creates an adapter exporting through OTLP.
   *
   * @param exporter {@code otlp} or {@code none}; blank defers to {@code OTEL_METRICS_EXPORTER}
   * @param endpoint OTLP endpoint; blank defers to {@code OTEL_EXPORTER_OTLP_ENDPOINT}
   * @param interval export interval
   */
  public OpenTelemetryMetricsAdapter(String exporter, String endpoint, Duration interval) {
    this(OpenTelemetryBootstrap.initialize(exporter, endpoint, interval));
  }

  OpenTelemetryMetricsAdapter(OpenTelemetryBootstrap.BootstrapResult bootstrap) {
    this.bootstrap = Objects.requireNonNull(bootstrap, "bootstrap");
    this.meter = bootstrap.meter();
  }

  @Override
  public void increment(String key) {
    counters.computeIfAbsent(Objects.requireNonNull(key, "key"), this::counter).add(1);
  }

  @Override
  public void observe(String key, long value) {
    histograms.computeIfAbsent(Objects.requireNonNull(key, "key"), this::histogram).record(value);
  }

  /**
   * Whether metrics are actually exported.
   *
   * @return {@code false} when running on the no-op meter
   */
  public boolean exporting() {
    return !bootstrap.isNoop();
  }

  void forceFlush() {
    bootstrap.forceFlush();
  }

  @Override
  public void close() {
    bootstrap.close();
  }

  private LongCounter counter(String key) {
    return meter.counterBuilder(sanitize(key))
        .setUnit("1")
        .setDescription("PRISM counter " + key)
        .build();
  }

  private LongHistogram histogram(String key) {
    return meter.histogramBuilder(sanitize(key))
        .ofLongs()
        .setUnit(key.endsWith("Millis") ? "ms" : "1")
        .setDescription("PRISM observation " + key)
        .build();
  }

  static String sanitize(String key) {
    String trimmed = key.trim();
    if (trimmed.isEmpty()) {
      return "prism.metric";
    }
    StringBuilder name = new StringBuilder(trimmed.length() + 1);
    if (!Character.isLetter(trimmed.charAt(0))) {
      name.append('m');
    }
    for (char c : trimmed.toCharArray()) {
      name.append(Character.isLetterOrDigit(c) || c == '_' || c == '-' || c == '.' ? c : '_');
    }
    return name.toString().toLowerCase(Locale.ROOT);
  }
}
