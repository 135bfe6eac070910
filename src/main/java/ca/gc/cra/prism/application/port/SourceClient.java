package ca.gc.cra.prism.application.port;

import ca.gc.cra.prism.domain.chain.BlockRange;
import ca.gc.cra.prism.domain.chain.TransactionRecord;
import ca.gc.cra.prism.domain.error.PipelineException;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Port for paginated reads of transaction records from an upstream data provider.
 * <p><strong>Why:</strong> Ingestion depends only on {@link #fetchBatch(BatchCursor)}; transport, retry and
 * caching live behind the port.</p>
 * <p><strong>Role:</strong> Input port on the ingest side; implemented by {@code RetryingSourceClient}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Return one page of records together with the cursor of the next page, if any.</li>
 *   <li>Retry transient failures with backoff and surface
 *   {@link ca.gc.cra.prism.domain.error.FetchExhaustedException} once the budget is spent.</li>
 *   <li>Report missing pages as empty batches flagged {@link Batch#missing()}.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Implementations must be safe for concurrent calls from several jobs.</p>
 * <p><strong>Observability:</strong> Implementations emit {@code source.*} metrics.</p>
 *
 * @since 0.1.0
 */
public interface SourceClient {
  /**
   * Fetches the page addressed by {@code cursor}.
   *
   * @param cursor page position; must not be {@code null}
   * @return records of the page and the cursor of the following page
   * @throws PipelineException on exhausted retries or terminal upstream errors
   * @throws InterruptedException if interrupted while backing off
   */
  Batch fetchBatch(BatchCursor cursor) throws PipelineException, InterruptedException;

  /**
   * Identifies the upstream for provenance, e.g. its base URL and chain.
   *
   * @return source identifier
   */
  String sourceId();

  /**
   * Returns a lazy, restartable sequence of pages covering {@code range}. Each call to
   * {@link BatchSequence#start()} begins again at the first block.
   *
   * @param range block range to read
   * @return page sequence
   */
  default BatchSequence batches(BlockRange range) {
    return new BatchSequence(this, range);
  }

  /**
   * Position of one page inside a block range.
   *
   * @param range range being read
   * @param height block height of the page
   */
  record BatchCursor(BlockRange range, long height) {
    public BatchCursor {
      Objects.requireNonNull(range, "range");
      if (!range.contains(height)) {
        throw new IllegalArgumentException("cursor height " + height + " outside " + range);
      }
    }

    /**
     * Cursor of the first page of {@code range}.
     *
     * @param range block range
     * @return first cursor
     */
    public static BatchCursor first(BlockRange range) {
      return new BatchCursor(range, range.start());
    }

    /**
     * Cursor of the following page.
     *
     * @return next cursor, or empty past the end of the range
     */
    public Optional<BatchCursor> next() {
      return height >= range.end() ? Optional.empty() : Optional.of(new BatchCursor(range, height + 1));
    }
  }

  /**
   * One page of records.
   *
   * @param records records on the page
   * @param nextCursor cursor of the following page; empty on the last page
   * @param missing whether the upstream reported the page as absent
   */
  record Batch(List<TransactionRecord> records, Optional<BatchCursor> nextCursor, boolean missing) {
    public Batch {
      records = List.copyOf(records);
      Objects.requireNonNull(nextCursor, "nextCursor");
    }
  }

  /**
   * Cursor-driven page sequence over a fixed range.
   */
  final class BatchSequence {
    private final SourceClient client;
    private final BlockRange range;

    BatchSequence(SourceClient client, BlockRange range) {
      this.client = Objects.requireNonNull(client, "client");
      this.range = Objects.requireNonNull(range, "range");
    }

    /**
     * Starts a fresh walk over the range.
     *
     * @return iterator positioned before the first page
     */
    public Walk start() {
      return new Walk(client, BatchCursor.first(range));
    }

    /** Single pass over the pages; pages are fetched only when {@link #next()} is called. */
    public static final class Walk {
      private final SourceClient client;
      private Optional<BatchCursor> cursor;

      private Walk(SourceClient client, BatchCursor first) {
        this.client = client;
        this.cursor = Optional.of(first);
      }

      public boolean hasNext() {
        return cursor.isPresent();
      }

      /**
       * Fetches the next page.
       *
       * @return next page
       * @throws PipelineException when the fetch fails
       * @throws InterruptedException if interrupted while backing off
       */
      public Batch next() throws PipelineException, InterruptedException {
        BatchCursor current = cursor.orElseThrow(() -> new IllegalStateException("sequence exhausted"));
        Batch batch = client.fetchBatch(current);
        cursor = batch.nextCursor();
        return batch;
      }
    }
  }
}
