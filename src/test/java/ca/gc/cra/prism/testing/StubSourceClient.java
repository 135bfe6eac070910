package ca.gc.cra.prism.testing;

import ca.gc.cra.prism.application.port.SourceClient;
import ca.gc.cra.prism.domain.chain.TransactionRecord;
import ca.gc.cra.prism.domain.error.PipelineException;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory block source. Heights without a page answer as missing. Failures queued with
 * {@link #failNext(PipelineException)} are thrown by the next fetches.
 */
public final class StubSourceClient implements SourceClient {
  private final Map<Long, List<TransactionRecord>> pages = new HashMap<>();
  private final Deque<PipelineException> failures = new ArrayDeque<>();
  private final AtomicInteger fetches = new AtomicInteger();

  public StubSourceClient page(long height, TransactionRecord... records) {
    pages.put(height, List.of(records));
    return this;
  }

  public synchronized StubSourceClient failNext(PipelineException failure) {
    failures.add(failure);
    return this;
  }

  @Override
  public Batch fetchBatch(BatchCursor cursor) throws PipelineException {
    fetches.incrementAndGet();
    PipelineException failure;
    synchronized (this) {
      failure = failures.poll();
    }
    if (failure != null) {
      throw failure;
    }
    List<TransactionRecord> records = pages.get(cursor.height());
    return records == null
        ? new Batch(List.of(), cursor.next(), true)
        : new Batch(records, cursor.next(), false);
  }

  @Override
  public String sourceId() {
    return "stub://zcash";
  }

  public int fetches() {
    return fetches.get();
  }
}
