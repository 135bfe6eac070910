package ca.gc.cra.prism.application.store;

import ca.gc.cra.prism.application.port.ClockPort;
import ca.gc.cra.prism.application.port.DurableStorePort;
import ca.gc.cra.prism.application.port.MetricsPort;
import ca.gc.cra.prism.domain.error.NotFoundException;
import ca.gc.cra.prism.domain.error.StorageConflictException;
import ca.gc.cra.prism.domain.store.Provenance;
import ca.gc.cra.prism.domain.store.ResultFilter;
import ca.gc.cra.prism.domain.store.ResultSummary;
import ca.gc.cra.prism.domain.store.StoredResult;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import java.io.IOException;
import java.security.SecureRandom;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Keyed result storage with a TTL cache in front of a durable backing store.
 * <p><strong>Reads:</strong> cache first, then the backing store; a backing-store hit repopulates the cache.</p>
 * <p><strong>Writes:</strong> backing store first, then the cache, both on the calling thread. Without the overwrite
 * flag a key accepts at most one successful write; later writes fail with {@link StorageConflictException}.</p>
 * <p><strong>Expiry:</strong> Caffeine expires entries after write using a ticker derived from {@link ClockPort};
 * expiry is evaluated on access and during Caffeine's amortized maintenance, no sweeper thread is started.</p>
 * <p><strong>Thread-safety:</strong> Thread-safe; conflict detection relies on
 * {@link DurableStorePort#create(StoredResult)} being atomic.</p>
 * <p><strong>Observability:</strong> Emits {@code store.put.success}, {@code store.put.conflict},
 * {@code store.cache.hit} and {@code store.cache.miss}.</p>
 *
 * @since PRISM 0.1
 */
public final class ResultStore {
  private static final Logger log = LoggerFactory.getLogger(ResultStore.class);
  private static final HexFormat HEX = HexFormat.of();

  private final DurableStorePort durable;
  private final Cache<String, StoredResult> cache;
  private final ClockPort clock;
  private final MetricsPort metrics;
  private final SecureRandom random = new SecureRandom();

  /**
   * Creates a result store.
   *
   * @param durable backing store
   * @param ttl cache entry lifetime after write; positive
   * @param maxEntries cache size bound; positive
   * @param clock time source for the cache ticker and {@code storedAt}
   * @param metrics metrics sink
   */
  public ResultStore(
      DurableStorePort durable, Duration ttl, long maxEntries, ClockPort clock, MetricsPort metrics) {
    this.durable = Objects.requireNonNull(durable, "durable");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    Objects.requireNonNull(ttl, "ttl");
    if (ttl.isNegative() || ttl.isZero()) {
      throw new IllegalArgumentException("cache ttl must be positive");
    }
    if (maxEntries <= 0) {
      throw new IllegalArgumentException("cache maxEntries must be positive");
    }
    this.cache = Caffeine.newBuilder()
        .expireAfterWrite(ttl)
        .maximumSize(maxEntries)
        .ticker(() -> clock.nowMillis() * 1_000_000L)
        .build();
  }

  /**
   * Builds a result with a fresh reference id and the current time.
   *
   * @param key store key
   * @param payload opaque payload
   * @param metadata flat metadata
   * @param provenance origin of the result
   * @return unsaved result
   */
  public StoredResult newResult(String key, byte[] payload, Map<String, String> metadata, Provenance provenance) {
    return new StoredResult(key, newReferenceId(), payload, metadata, provenance, clock.now());
  }

  /**
   * Writes a result whose key must not exist yet.
   *
   * @param key store key; must equal {@code result.key()}
   * @param result result to store
   * @throws StorageConflictException if the key already holds a result
   * @throws IOException if the backing store fails
   */
  public void put(String key, StoredResult result) throws StorageConflictException, IOException {
    put(key, result, false);
  }

  /**
   * Writes a result.
   *
   * @param key store key; must equal {@code result.key()}
   * @param result result to store
   * @param overwrite replace an existing result instead of failing
   * @throws StorageConflictException if the key exists and {@code overwrite} is {@code false}
   * @throws IOException if the backing store fails
   */
  public void put(String key, StoredResult result, boolean overwrite) throws StorageConflictException, IOException {
    Objects.requireNonNull(key, "key");
    Objects.requireNonNull(result, "result");
    if (!key.equals(result.key())) {
      throw new IllegalArgumentException("key " + key + " does not match result key " + result.key());
    }
    if (overwrite) {
      durable.replace(result);
    } else if (!durable.create(result)) {
      metrics.increment("store.put.conflict");
      boolean finalized = durable.get(key).isPresent();
      log.debug("Write conflict for key {} (finalized={})", key, finalized);
      throw new StorageConflictException(key, finalized, finalized
          ? "key " + key + " already holds a result"
          : "concurrent write race on key " + key);
    }
    cache.put(key, result);
    metrics.increment("store.put.success");
  }

  /**
   * Reads a result.
   *
   * @param key store key
   * @return stored result
   * @throws NotFoundException if no result exists for {@code key}
   * @throws IOException if the backing store fails
   */
  public StoredResult get(String key) throws NotFoundException, IOException {
    return find(key).orElseThrow(() -> new NotFoundException("no result stored under " + key));
  }

  /**
   * Reads a result if present.
   *
   * @param key store key
   * @return stored result, or empty
   * @throws IOException if the backing store fails
   */
  public Optional<StoredResult> find(String key) throws IOException {
    Objects.requireNonNull(key, "key");
    StoredResult cached = cache.getIfPresent(key);
    if (cached != null) {
      metrics.increment("store.cache.hit");
      return Optional.of(cached);
    }
    metrics.increment("store.cache.miss");
    Optional<StoredResult> loaded = durable.get(key);
    loaded.ifPresent(result -> cache.put(key, result));
    return loaded;
  }

  /**
   * Lists summaries of the results matching {@code filter}.
   *
   * @param filter listing criteria
   * @return matching summaries in key order
   * @throws IOException if the backing store fails
   */
  public List<ResultSummary> list(ResultFilter filter) throws IOException {
    Objects.requireNonNull(filter, "filter");
    List<ResultSummary> matching = new ArrayList<>();
    for (ResultSummary summary : durable.list()) {
      if (filter.matches(summary)) {
        matching.add(summary);
      }
    }
    return matching;
  }

  /**
   * Deletes a result from both layers.
   *
   * @param key store key
   * @return {@code true} if the backing store held a result
   * @throws IOException if the backing store fails
   */
  public boolean delete(String key) throws IOException {
    Objects.requireNonNull(key, "key");
    cache.invalidate(key);
    return durable.delete(key);
  }

  /**
   * Generates a reference id of the form {@code ref_} plus 24 hex characters.
   *
   * @return random reference id
   */
  public String newReferenceId() {
    byte[] bytes = new byte[12];
    random.nextBytes(bytes);
    return "ref_" + HEX.formatHex(bytes);
  }
}
