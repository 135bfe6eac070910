package ca.gc.cra.prism.infrastructure.metrics;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.sdk.metrics.data.HistogramPointData;
import io.opentelemetry.sdk.metrics.data.LongPointData;
import io.opentelemetry.sdk.metrics.data.MetricData;
import io.opentelemetry.sdk.metrics.data.MetricDataType;
import io.opentelemetry.sdk.testing.exporter.InMemoryMetricReader;
import java.time.Duration;
import java.util.Collection;
import java.util.Optional;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class OpenTelemetryMetricsAdapterTest {
  private InMemoryMetricReader reader;
  private OpenTelemetryMetricsAdapter adapter;

  @BeforeEach
  void setUp() {
    reader = InMemoryMetricReader.create();
    adapter = new OpenTelemetryMetricsAdapter(OpenTelemetryBootstrap.forTesting(reader));
  }

  @AfterEach
  void tearDown() {
    if (adapter != null) {
      adapter.close();
    }
  }

  @Test
  void incrementRecordsCounterWithServiceResource() {
    adapter.increment("source.fetch.retry");
    adapter.increment("source.fetch.retry");
    adapter.increment("source.fetch.retry");
    adapter.forceFlush();

    MetricData counter = find(reader.collectAllMetrics(), "source.fetch.retry").orElseThrow();
    assertEquals(MetricDataType.LONG_SUM, counter.getType());
    LongPointData point = counter.getLongSumData().getPoints().iterator().next();
    assertEquals(3L, point.getValue());

    assertEquals("prism", counter.getResource().getAttribute(AttributeKey.stringKey("service.name")));
    assertEquals("ca.gc.cra", counter.getResource().getAttribute(AttributeKey.stringKey("service.namespace")));
    String instance = counter.getResource().getAttribute(AttributeKey.stringKey("service.instance.id"));
    assertTrue(instance != null && !instance.isBlank(), "Service instance id should be provided");
  }

  @Test
  void observeRecordsHistogram() {
    adapter.observe("pipeline.stage.latencyMillis", 40);
    adapter.observe("pipeline.stage.latencyMillis", 60);
    adapter.forceFlush();

    MetricData histogram = find(reader.collectAllMetrics(), "pipeline.stage.latencymillis").orElseThrow();
    assertEquals(MetricDataType.HISTOGRAM, histogram.getType());
    assertEquals("ms", histogram.getUnit());
    HistogramPointData point = histogram.getHistogramData().getPoints().iterator().next();
    assertEquals(2L, point.getCount());
    assertEquals(100.0, point.getSum(), 1e-9);
  }

  @Test
  void sanitizeProducesValidInstrumentNames() {
    assertEquals("store.cache.hit", OpenTelemetryMetricsAdapter.sanitize("store.cache.hit"));
    assertEquals("m9lives", OpenTelemetryMetricsAdapter.sanitize("9lives"));
    assertEquals("a_b", OpenTelemetryMetricsAdapter.sanitize("a b"));
    assertEquals("prism.metric", OpenTelemetryMetricsAdapter.sanitize("  "));
  }

  @Test
  void disabledExporterIsNoop() {
    OpenTelemetryMetricsAdapter noop = new OpenTelemetryMetricsAdapter("none", "", Duration.ofSeconds(60));
    try {
      noop.increment("ignored");
      assertFalse(noop.exporting());
    } finally {
      noop.close();
    }
  }

  private static Optional<MetricData> find(Collection<MetricData> metrics, String name) {
    return metrics.stream().filter(metric -> metric.getName().equals(name)).findFirst();
  }
}
