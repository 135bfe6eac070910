package ca.gc.cra.prism.application.port;

import ca.gc.cra.prism.domain.store.ResultSummary;
import ca.gc.cra.prism.domain.store.StoredResult;
import java.io.IOException;
import java.util.List;
import java.util.Optional;

/**
 * <strong>What:</strong> Port for the durable key/value layer underneath the result store.
 * <p><strong>Why:</strong> The result store owns caching and conflict rules; the backing store only needs atomic
 * create-if-absent plus plain get/list/delete.</p>
 * <p><strong>Thread-safety:</strong> Implementations must be thread-safe and {@link #create} must be atomic per key.</p>
 * <p><strong>Consistency:</strong> No multi-key guarantees are required.</p>
 *
 * @since 0.1.0
 */
public interface DurableStorePort {
  /**
   * Writes {@code result} only if its key is absent.
   *
   * @param result result to write
   * @return {@code true} if written, {@code false} when the key already exists
   * @throws IOException if the store cannot be written
   */
  boolean create(StoredResult result) throws IOException;

  /**
   * Writes {@code result}, replacing any existing value under its key.
   *
   * @param result result to write
   * @throws IOException if the store cannot be written
   */
  void replace(StoredResult result) throws IOException;

  /**
   * Reads the result stored under {@code key}.
   *
   * @param key store key
   * @return stored result, or empty
   * @throws IOException if the store cannot be read
   */
  Optional<StoredResult> get(String key) throws IOException;

  /**
   * Lists summaries of every stored result.
   *
   * @return summaries in key order
   * @throws IOException if the store cannot be read
   */
  List<ResultSummary> list() throws IOException;

  /**
   * Removes the result stored under {@code key}.
   *
   * @param key store key
   * @return {@code true} if a result was removed
   * @throws IOException if the store cannot be written
   */
  boolean delete(String key) throws IOException;
}
