package ca.gc.cra.prism.infrastructure.store;

import ca.gc.cra.prism.application.port.DurableStorePort;
import ca.gc.cra.prism.domain.store.ResultSummary;
import ca.gc.cra.prism.domain.store.StoredResult;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentSkipListMap;

/**
 * {@link DurableStorePort} held in a concurrent sorted map; contents are lost on exit.
 *
 * @since PRISM 0.1
 */
public final class InMemoryDurableStore implements DurableStorePort {
  private final ConcurrentSkipListMap<String, StoredResult> entries = new ConcurrentSkipListMap<>();

  @Override
  public boolean create(StoredResult result) {
    Objects.requireNonNull(result, "result");
    return entries.putIfAbsent(result.key(), result) == null;
  }

  @Override
  public void replace(StoredResult result) {
    Objects.requireNonNull(result, "result");
    entries.put(result.key(), result);
  }

  @Override
  public Optional<StoredResult> get(String key) {
    return Optional.ofNullable(entries.get(key));
  }

  @Override
  public List<ResultSummary> list() {
    return entries.values().stream().map(StoredResult::summary).toList();
  }

  @Override
  public boolean delete(String key) {
    return entries.remove(key) != null;
  }
}
