package ca.gc.cra.prism.infrastructure.source;

import ca.gc.cra.prism.application.pipeline.Backoff;
import ca.gc.cra.prism.application.port.ClockPort;
import ca.gc.cra.prism.application.port.MetricsPort;
import ca.gc.cra.prism.application.port.Sleeper;
import ca.gc.cra.prism.application.port.SourceClient;
import ca.gc.cra.prism.domain.chain.TransactionRecord;
import ca.gc.cra.prism.domain.error.FetchExhaustedException;
import ca.gc.cra.prism.domain.error.PipelineException;
import ca.gc.cra.prism.domain.error.TransientFetchException;
import ca.gc.cra.prism.infrastructure.http.HttpReply;
import ca.gc.cra.prism.infrastructure.http.HttpTransport;
import ca.gc.cra.prism.logging.Logs;
import ca.gc.cra.prism.validation.Strings;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import java.io.IOException;
import java.net.URI;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link SourceClient} reading one block per page from a 3xpl-style explorer API.
 * <p><strong>Retry:</strong> Connection failures, 429 and 5xx replies and unreadable bodies are transient and
 * retried with {@link Backoff}; once {@link Backoff#maxAttempts()} attempts fail the call raises
 * {@link FetchExhaustedException}. Other 4xx replies are not retried.</p>
 * <p><strong>Missing blocks:</strong> 404 yields an empty batch flagged as missing.</p>
 * <p><strong>Cache:</strong> Successful and missing pages are cached per {@code chain/height} for the configured TTL;
 * cache hits skip the network and the retry loop entirely.</p>
 * <p><strong>Thread-safety:</strong> Thread-safe; concurrent misses for the same page may both reach upstream.</p>
 * <p><strong>Observability:</strong> Emits {@code source.fetch.attempt}, {@code source.fetch.retry},
 * {@code source.cache.hit} and {@code source.fetch.exhausted}.</p>
 *
 * @since PRISM 0.1
 */
public final class RetryingSourceClient implements SourceClient {
  private static final Logger log = LoggerFactory.getLogger(RetryingSourceClient.class);
  private static final int BODY_PREVIEW = 200;

  private final HttpTransport http;
  private final Options options;
  private final Backoff backoff;
  private final Sleeper sleeper;
  private final MetricsPort metrics;
  private final TransactionJsonParser parser = new TransactionJsonParser();
  private final Cache<String, Page> cache;

  /**
   * Creates a client.
   *
   * @param http transport
   * @param options endpoint, timeout and cache settings
   * @param backoff retry policy
   * @param sleeper pause between attempts
   * @param clock time source for cache expiry
   * @param metrics metrics sink
   */
  public RetryingSourceClient(
      HttpTransport http,
      Options options,
      Backoff backoff,
      Sleeper sleeper,
      ClockPort clock,
      MetricsPort metrics) {
    this.http = Objects.requireNonNull(http, "http");
    this.options = Objects.requireNonNull(options, "options");
    this.backoff = Objects.requireNonNull(backoff, "backoff");
    this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    Objects.requireNonNull(clock, "clock");
    this.cache = Caffeine.newBuilder()
        .expireAfterWrite(options.cacheTtl())
        .maximumSize(options.cacheMaxEntries())
        .ticker(() -> clock.nowMillis() * 1_000_000L)
        .build();
  }

  @Override
  public Batch fetchBatch(BatchCursor cursor) throws PipelineException, InterruptedException {
    Objects.requireNonNull(cursor, "cursor");
    long height = cursor.height();
    String key = options.chain() + "/" + height;
    Page cached = cache.getIfPresent(key);
    if (cached != null) {
      metrics.increment("source.cache.hit");
      log.debug("Cache hit for block {}", key);
      return new Batch(cached.records(), cursor.next(), cached.missing());
    }
    Page page = fetchWithRetry(height);
    cache.put(key, page);
    return new Batch(page.records(), cursor.next(), page.missing());
  }

  @Override
  public String sourceId() {
    return options.baseUrl() + "/" + options.chain();
  }

  private Page fetchWithRetry(long height) throws PipelineException, InterruptedException {
    URI uri = pageUri(height);
    int attempt = 0;
    while (true) {
      metrics.increment("source.fetch.attempt");
      TransientFetchException failure;
      try {
        return fetchOnce(uri, height);
      } catch (TransientFetchException ex) {
        failure = ex;
      }
      int made = attempt + 1;
      if (!backoff.canRetry(made)) {
        metrics.increment("source.fetch.exhausted");
        log.error("Giving up on {} after {} attempts: {}", uri, made, failure.getMessage());
        throw new FetchExhaustedException("fetch of block " + height + " failed", made, failure);
      }
      Duration delay = backoff.delayFor(attempt);
      metrics.increment("source.fetch.retry");
      log.warn("Attempt {} for {} failed ({}); retrying in {} ms", made, uri, failure.getMessage(), delay.toMillis());
      sleeper.sleep(delay);
      attempt = made;
    }
  }

  private Page fetchOnce(URI uri, long height) throws PipelineException, InterruptedException {
    HttpReply reply;
    try {
      reply = http.get(uri, Map.of(), options.requestTimeout());
    } catch (IOException ex) {
      throw new TransientFetchException("GET " + uri + " failed: " + ex.getMessage(), ex);
    }
    int status = reply.status();
    if (status == 404) {
      log.debug("Block {} not found upstream; treating as empty", height);
      return new Page(List.of(), true);
    }
    if (status == 429 || reply.serverError()) {
      throw new TransientFetchException("GET " + uri + " returned " + status);
    }
    if (!reply.success()) {
      throw new FetchExhaustedException(
          "GET " + uri + " returned non-retryable " + status + ": "
              + Logs.truncate(reply.bodyText(), BODY_PREVIEW), 1, null);
    }
    try {
      List<TransactionRecord> records = parser.parse(reply.body(), height);
      log.debug("Fetched {} transactions for block {}", records.size(), height);
      return new Page(records, false);
    } catch (IllegalArgumentException ex) {
      throw new TransientFetchException(
          "unreadable body from " + uri + ": " + Logs.truncate(reply.bodyText(), BODY_PREVIEW), ex);
    }
  }

  private URI pageUri(long height) {
    return URI.create(options.baseUrl() + "/" + options.chain() + "/block/" + height + "/transactions");
  }

  /**
   * Endpoint and cache settings.
   *
   * @param baseUrl explorer base URL, e.g. {@code https://sandbox-api.3xpl.com}
   * @param chain chain path segment, e.g. {@code zcash}
   * @param requestTimeout per-request timeout
   * @param cacheTtl response cache lifetime
   * @param cacheMaxEntries response cache bound
   */
  public record Options(String baseUrl, String chain, Duration requestTimeout, Duration cacheTtl, long cacheMaxEntries) {
    public Options {
      baseUrl = Strings.requireNonBlank("baseUrl", baseUrl);
      while (baseUrl.endsWith("/")) {
        baseUrl = baseUrl.substring(0, baseUrl.length() - 1);
      }
      chain = Strings.requireNonBlank("chain", chain);
      Objects.requireNonNull(requestTimeout, "requestTimeout");
      Objects.requireNonNull(cacheTtl, "cacheTtl");
      if (cacheTtl.isZero() || cacheTtl.isNegative()) {
        throw new IllegalArgumentException("cacheTtl must be positive");
      }
      if (cacheMaxEntries <= 0) {
        throw new IllegalArgumentException("cacheMaxEntries must be positive");
      }
    }
  }

  private record Page(List<TransactionRecord> records, boolean missing) {}
}
