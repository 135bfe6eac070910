package ca.gc.cra.prism.infrastructure.metrics;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.common.AttributesBuilder;
import io.opentelemetry.api.metrics.Meter;
import io.opentelemetry.api.metrics.MeterProvider;
import io.opentelemetry.exporter.otlp.metrics.OtlpGrpcMetricExporter;
import io.opentelemetry.sdk.common.CompletableResultCode;
import io.opentelemetry.sdk.metrics.SdkMeterProvider;
import io.opentelemetry.sdk.metrics.export.MetricReader;
import io.opentelemetry.sdk.metrics.export.PeriodicMetricReader;
import io.opentelemetry.sdk.resources.Resource;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.time.Duration;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds the OpenTelemetry meter provider PRISM reports through.
 *
 * <p>Exporter selection comes from configuration first and then from {@code OTEL_METRICS_EXPORTER} /
 * {@code OTEL_EXPORTER_OTLP_ENDPOINT}. Any initialization failure degrades to a no-op meter.</p>
 */
final class OpenTelemetryBootstrap {
  private static final Logger log = LoggerFactory.getLogger(OpenTelemetryBootstrap.class);
  static final String INSTRUMENTATION_SCOPE = "ca.gc.cra.prism";
  private static final String DEFAULT_ENDPOINT = "http://localhost:4317";
  private static final AttributeKey<String> SERVICE_NAME = AttributeKey.stringKey("service.name");
  private static final AttributeKey<String> SERVICE_NAMESPACE = AttributeKey.stringKey("service.namespace");
  private static final AttributeKey<String> SERVICE_INSTANCE_ID = AttributeKey.stringKey("service.instance.id");

  private OpenTelemetryBootstrap() {}

  static BootstrapResult initialize(String exporter, String endpoint, Duration interval) {
    String mode = firstNonBlank(exporter, System.getenv("OTEL_METRICS_EXPORTER"), "otlp").toLowerCase(Locale.ROOT);
    if (mode.equals("none")) {
      log.info("OpenTelemetry metrics exporter disabled (exporter=none)");
      return BootstrapResult.noop();
    }
    if (!mode.equals("otlp")) {
      log.warn("Unknown metrics exporter '{}'; defaulting to otlp", mode);
    }
    String target = firstNonBlank(endpoint, System.getenv("OTEL_EXPORTER_OTLP_ENDPOINT"), DEFAULT_ENDPOINT);
    try {
      OtlpGrpcMetricExporter otlp = OtlpGrpcMetricExporter.builder().setEndpoint(target).build();
      MetricReader reader = PeriodicMetricReader.builder(otlp).setInterval(interval).build();
      BootstrapResult result = build(reader);
      log.info("OpenTelemetry metrics exporting to {} every {}", target, interval);
      return result;
    } catch (RuntimeException ex) {
      log.error("Failed to initialize OpenTelemetry metrics; using noop meter", ex);
      return BootstrapResult.noop();
    }
  }

  static BootstrapResult forTesting(MetricReader reader) {
    return build(Objects.requireNonNull(reader, "reader"));
  }

  private static BootstrapResult build(MetricReader reader) {
    SdkMeterProvider provider = SdkMeterProvider.builder()
        .setResource(resource())
        .registerMetricReader(reader)
        .build();
    return new BootstrapResult(provider.get(INSTRUMENTATION_SCOPE), provider);
  }

  private static Resource resource() {
    AttributesBuilder builder = Attributes.builder()
        .put(SERVICE_NAME, "prism")
        .put(SERVICE_NAMESPACE, "ca.gc.cra");
    String instance = instanceId();
    if (!instance.isBlank()) {
      builder.put(SERVICE_INSTANCE_ID, instance);
    }
    return Resource.getDefault().merge(Resource.create(builder.build()));
  }

  private static String instanceId() {
    try {
      return InetAddress.getLocalHost().getHostName();
    } catch (UnknownHostException ex) {
      log.debug("Host name unavailable for service.instance.id", ex);
      return "";
    }
  }

  private static String firstNonBlank(String first, String second, String fallback) {
    if (first != null && !first.isBlank()) {
      return first.trim();
    }
    if (second != null && !second.isBlank()) {
      return second.trim();
    }
    return fallback;
  }

  static final class BootstrapResult implements AutoCloseable {
    private final Meter meter;
    private final SdkMeterProvider provider;

    private BootstrapResult(Meter meter, SdkMeterProvider provider) {
      this.meter = meter;
      this.provider = provider;
    }

    static BootstrapResult noop() {
      return new BootstrapResult(MeterProvider.noop().get(INSTRUMENTATION_SCOPE), null);
    }

    Meter meter() {
      return meter;
    }

    boolean isNoop() {
      return provider == null;
    }

    void forceFlush() {
      if (provider == null) {
        return;
      }
      CompletableResultCode flush = provider.forceFlush().join(5, TimeUnit.SECONDS);
      if (!flush.isSuccess()) {
        log.warn("OpenTelemetry metrics flush did not complete within timeout");
      }
    }

    @Override
    public void close() {
      if (provider == null) {
        return;
      }
      CompletableResultCode shutdown = provider.shutdown().join(5, TimeUnit.SECONDS);
      if (!shutdown.isSuccess()) {
        log.warn("Timed out waiting for OpenTelemetry meter provider shutdown");
      }
    }
  }
}
