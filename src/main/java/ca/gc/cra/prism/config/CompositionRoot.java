package ca.gc.cra.prism.config;

import ca.gc.cra.prism.application.pipeline.Aggregator;
import ca.gc.cra.prism.application.pipeline.Backoff;
import ca.gc.cra.prism.application.pipeline.ComputationPoller;
import ca.gc.cra.prism.application.pipeline.PipelineOrchestrator;
import ca.gc.cra.prism.application.pipeline.VectorCodec;
import ca.gc.cra.prism.application.port.ClockPort;
import ca.gc.cra.prism.application.port.ComputationGateway;
import ca.gc.cra.prism.application.port.DurableStorePort;
import ca.gc.cra.prism.application.port.MetricsPort;
import ca.gc.cra.prism.application.port.Sleeper;
import ca.gc.cra.prism.application.port.SourceClient;
import ca.gc.cra.prism.application.port.SummaryGenerator;
import ca.gc.cra.prism.application.store.ResultStore;
import ca.gc.cra.prism.infrastructure.compute.HttpComputationGateway;
import ca.gc.cra.prism.infrastructure.compute.LocalComputationSimulator;
import ca.gc.cra.prism.infrastructure.exec.ExecutorFactories;
import ca.gc.cra.prism.infrastructure.http.HttpTransport;
import ca.gc.cra.prism.infrastructure.http.JdkHttpTransport;
import ca.gc.cra.prism.infrastructure.metrics.NoOpMetricsAdapter;
import ca.gc.cra.prism.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import ca.gc.cra.prism.infrastructure.source.RetryingSourceClient;
import ca.gc.cra.prism.infrastructure.store.FileDurableStore;
import ca.gc.cra.prism.infrastructure.store.InMemoryDurableStore;
import ca.gc.cra.prism.infrastructure.summary.TemplateSummaryGenerator;
import ca.gc.cra.prism.infrastructure.time.SystemClockAdapter;
import java.io.IOException;
import java.time.Duration;
import java.util.Objects;
import java.util.Random;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Central composition root that wires PRISM use cases to concrete adapters.
 * <p><strong>Why:</strong> Provides a single place to translate {@link PrismConfig} into a runnable pipeline; no
 * other class branches on a configured mode.</p>
 * <p><strong>Role:</strong> Adapter composition root spanning source, codec, computation and store.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Select exactly one {@link SourceClient}, {@link ComputationGateway} and {@link DurableStorePort}
 *   implementation at construction time.</li>
 *   <li>Own the worker pool and poll scheduler and release them on {@link #close()}.</li>
 *   <li>Expose shared adapters such as metrics and clock providers.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Collaborators are built once in the constructor; accessors are safe from any
 * thread.</p>
 * <p><strong>Observability:</strong> Supplies one {@link MetricsPort} to every collaborator; logs the selected
 * adapters at INFO.</p>
 *
 * @since 0.1.0
 */
public final class CompositionRoot implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(CompositionRoot.class);
  private static final Duration CONNECT_TIMEOUT = Duration.ofSeconds(5);
  private static final long SHUTDOWN_WAIT_MILLIS = 5_000L;

  private final PrismConfig config;
  private final MetricsPort metrics;
  private final ClockPort clock;
  private final Sleeper sleeper;
  private final Random random;
  private final ExecutorService workers;
  private final ScheduledExecutorService pollScheduler;
  private final SourceClient source;
  private final Aggregator aggregator;
  private final VectorCodec codec;
  private final ComputationGateway gateway;
  private final ComputationPoller poller;
  private final ResultStore resultStore;
  private final SummaryGenerator summaries;
  private final PipelineOrchestrator orchestrator;

  /**
   * Creates a composition root using the JDK HTTP client and the configured metrics exporter.
   *
   * @param config effective configuration; must not be {@code null}
   * @throws IOException if the file store directory cannot be prepared
   */
  public CompositionRoot(PrismConfig config) throws IOException {
    this(config, newMetrics(config), new JdkHttpTransport(CONNECT_TIMEOUT), new SystemClockAdapter(),
        Sleeper.SYSTEM);
  }

  /**
   * Creates a composition root with explicit infrastructure overrides, typically from tests.
   *
   * @param config effective configuration
   * @param metrics metrics adapter shared by all collaborators
   * @param http transport used by the source client and the remote gateway
   * @param clock time source
   * @param sleeper pause used between retries
   * @throws IOException if the file store directory cannot be prepared
   */
  public CompositionRoot(
      PrismConfig config, MetricsPort metrics, HttpTransport http, ClockPort clock, Sleeper sleeper)
      throws IOException {
    this.config = Objects.requireNonNull(config, "config");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
    Objects.requireNonNull(http, "http");
    this.random = new Random();

    PrismConfig.SourceSettings sourceSettings = config.source();
    this.source = new RetryingSourceClient(
        http,
        new RetryingSourceClient.Options(
            sourceSettings.baseUrl(),
            sourceSettings.chain(),
            sourceSettings.requestTimeout(),
            sourceSettings.cacheTtl(),
            sourceSettings.cacheMaxEntries()),
        new Backoff(sourceSettings.baseDelay(), sourceSettings.maxDelay(), sourceSettings.maxAttempts(), random),
        sleeper,
        clock,
        metrics);

    PrismConfig.CodecSettings codecSettings = config.codec();
    this.aggregator = new Aggregator(
        codecSettings.shieldedPolicy(),
        codecSettings.bucketPolicy(),
        codecSettings.bucketCount(),
        codecSettings.bucketWidth(),
        clock);
    this.codec = new VectorCodec(codecSettings.scalingFactor(), codecSettings.bucketCount());

    PrismConfig.GatewaySettings gatewaySettings = config.gateway();
    this.gateway = switch (gatewaySettings.mode()) {
      case LOCAL -> new LocalComputationSimulator(
          gatewaySettings.simulatedPendingPolls(), gatewaySettings.maxVectorLength());
      case REMOTE -> new HttpComputationGateway(
          http, gatewaySettings.endpoint(), gatewaySettings.requestTimeout());
    };

    DurableStorePort durable = switch (config.store().mode()) {
      case MEMORY -> new InMemoryDurableStore();
      case FILE -> new FileDurableStore(config.store().directory());
    };
    this.resultStore = new ResultStore(
        durable, config.store().cacheTtl(), config.store().cacheMaxEntries(), clock, metrics);
    this.summaries = new TemplateSummaryGenerator(config.summaryFeeReference());

    Thread.UncaughtExceptionHandler handler =
        (thread, error) -> log.error("Uncaught failure on {}", thread.getName(), error);
    this.workers = ExecutorFactories.newWorkerPool(config.orchestrator().workers(), "prism-worker", handler);
    this.pollScheduler = ExecutorFactories.newPollScheduler("prism-poll", handler);
    this.poller = new ComputationPoller(
        gateway,
        pollScheduler,
        new Backoff(
            gatewaySettings.pollBaseDelay(), gatewaySettings.pollMaxDelay(), gatewaySettings.maxPolls(), random),
        metrics);
    this.orchestrator = new PipelineOrchestrator(
        new PipelineOrchestrator.Collaborators(
            source, aggregator, codec, gateway, poller, resultStore, summaries, clock, sleeper, metrics),
        config.orchestrator(),
        workers,
        random);

    log.info(
        "PRISM wired: source={} gateway={} store={} workers={}",
        source.sourceId(),
        gatewaySettings.mode(),
        config.store().mode(),
        config.orchestrator().workers());
  }

  public PrismConfig config() {
    return config;
  }

  public MetricsPort metrics() {
    return metrics;
  }

  public ClockPort clock() {
    return clock;
  }

  public SourceClient sourceClient() {
    return source;
  }

  public Aggregator aggregator() {
    return aggregator;
  }

  public VectorCodec vectorCodec() {
    return codec;
  }

  public ComputationGateway computationGateway() {
    return gateway;
  }

  public ResultStore resultStore() {
    return resultStore;
  }

  public SummaryGenerator summaryGenerator() {
    return summaries;
  }

  public PipelineOrchestrator orchestrator() {
    return orchestrator;
  }

  /**
   * Stops the worker pool and poll scheduler, then closes the metrics adapter. Jobs still running are
   * interrupted after a bounded wait.
   */
  @Override
  public void close() {
    workers.shutdown();
    try {
      if (!workers.awaitTermination(SHUTDOWN_WAIT_MILLIS, TimeUnit.MILLISECONDS)) {
        log.warn("Worker pool did not drain within {} ms; interrupting", SHUTDOWN_WAIT_MILLIS);
        workers.shutdownNow();
      }
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      workers.shutdownNow();
    }
    // Running jobs may still be polling, so the scheduler goes after the workers.
    pollScheduler.shutdownNow();
    if (metrics instanceof AutoCloseable closeable) {
      try {
        closeable.close();
      } catch (Exception ex) {
        log.warn("Failed to close metrics adapter", ex);
      }
    }
  }

  private static MetricsPort newMetrics(PrismConfig config) {
    PrismConfig.MetricsSettings settings = Objects.requireNonNull(config, "config").metrics();
    if (settings.disabled()) {
      return new NoOpMetricsAdapter();
    }
    return new OpenTelemetryMetricsAdapter(settings.exporter(), settings.endpoint(), settings.interval());
  }
}
