package ca.gc.cra.prism.application.pipeline;

import ca.gc.cra.prism.application.port.ClockPort;
import ca.gc.cra.prism.application.port.SourceClient;
import ca.gc.cra.prism.domain.aggregate.AggregateRecord;
import ca.gc.cra.prism.domain.aggregate.BucketPolicy;
import ca.gc.cra.prism.domain.aggregate.HistogramSpec;
import ca.gc.cra.prism.domain.chain.AggregateWindow;
import ca.gc.cra.prism.domain.chain.BlockRange;
import ca.gc.cra.prism.domain.chain.TransactionRecord;
import ca.gc.cra.prism.domain.error.NotFoundException;
import ca.gc.cra.prism.domain.error.PipelineException;
import java.util.Arrays;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * <strong>What:</strong> Folds transaction records into a single {@link AggregateRecord}.
 * <p><strong>Why:</strong> Aggregates are the only representation of chain data that is encoded and submitted.</p>
 * <p><strong>Bucketing:</strong> The policy is fixed per instance. {@link BucketPolicy#STATIC} buckets each fee as
 * it arrives; {@link BucketPolicy#DYNAMIC_MAX} derives {@code width = maxFee / bucketCount} once the batch is
 * complete. Either way the resulting {@link HistogramSpec} is recorded on the aggregate.</p>
 * <p><strong>Thread-safety:</strong> The aggregator is immutable and shareable; each {@link Accumulator} belongs to
 * one caller.</p>
 *
 * @since PRISM 0.1
 */
public final class Aggregator {
  private static final double EMPTY_DYNAMIC_WIDTH = 1.0;

  private final Predicate<TransactionRecord> shielded;
  private final BucketPolicy policy;
  private final int bucketCount;
  private final double staticWidth;
  private final ClockPort clock;

  /**
   * Creates an aggregator.
   *
   * @param shielded predicate deciding whether a transaction is shielded
   * @param policy bucketing policy
   * @param bucketCount number of histogram buckets; at least one
   * @param staticWidth bucket width for {@link BucketPolicy#STATIC}; ignored for dynamic bucketing
   * @param clock time source for aggregate timestamps
   */
  public Aggregator(
      Predicate<TransactionRecord> shielded,
      BucketPolicy policy,
      int bucketCount,
      double staticWidth,
      ClockPort clock) {
    this.shielded = Objects.requireNonNull(shielded, "shielded");
    this.policy = Objects.requireNonNull(policy, "policy");
    this.clock = Objects.requireNonNull(clock, "clock");
    if (bucketCount < 1) {
      throw new IllegalArgumentException("bucketCount must be >= 1 (was " + bucketCount + ")");
    }
    if (policy == BucketPolicy.STATIC && !(staticWidth > 0 && Double.isFinite(staticWidth))) {
      throw new IllegalArgumentException("static bucket width must be positive (was " + staticWidth + ")");
    }
    this.bucketCount = bucketCount;
    this.staticWidth = staticWidth;
  }

  /**
   * Aggregates a complete batch in one pass.
   *
   * @param records transactions to fold
   * @param window reporting window
   * @param source upstream identifier
   * @return aggregate with a populated histogram
   */
  public AggregateRecord aggregate(Iterable<TransactionRecord> records, AggregateWindow window, String source) {
    Accumulator accumulator = newAccumulator();
    for (TransactionRecord record : records) {
      accumulator.accept(record);
    }
    return accumulator.finish(window, source);
  }

  /**
   * Fetches every block in {@code range} from {@code source} and folds the transactions page by page.
   *
   * <p>Missing blocks contribute nothing. A range in which every block is missing is an error rather than an
   * empty aggregate.</p>
   *
   * @param source upstream client
   * @param range blocks to fetch
   * @param window reporting window recorded on the aggregate
   * @return aggregate over all fetched transactions
   * @throws NotFoundException if no block in the range exists upstream
   * @throws PipelineException if a page cannot be fetched
   * @throws InterruptedException if interrupted while waiting between fetch attempts
   */
  public AggregateRecord ingest(SourceClient source, BlockRange range, AggregateWindow window)
      throws PipelineException, InterruptedException {
    Objects.requireNonNull(source, "source");
    Objects.requireNonNull(window, "window");
    Accumulator accumulator = newAccumulator();
    SourceClient.BatchSequence.Walk walk = source.batches(range).start();
    long pages = 0;
    long missing = 0;
    while (walk.hasNext()) {
      SourceClient.Batch batch = walk.next();
      pages++;
      if (batch.missing()) {
        missing++;
      }
      batch.records().forEach(accumulator::accept);
    }
    if (pages == missing) {
      throw new NotFoundException("no blocks found in range " + range);
    }
    return accumulator.finish(window, source.sourceId());
  }

  /**
   * Starts an incremental aggregation, used when records arrive page by page.
   *
   * @return empty accumulator
   */
  public Accumulator newAccumulator() {
    return new Accumulator();
  }

  public BucketPolicy policy() {
    return policy;
  }

  /** Mutable running totals for one aggregation. Not thread-safe. */
  public final class Accumulator {
    private long txCount;
    private long shieldedCount;
    private double totalFees;
    private double feeSumSq;
    private double maxFee;
    private final long[] staticBuckets = new long[bucketCount];
    private double[] fees = new double[64];
    private boolean finished;

    private Accumulator() {}

    /**
     * Folds one transaction into the totals.
     *
     * @param tx transaction
     */
    public void accept(TransactionRecord tx) {
      Objects.requireNonNull(tx, "tx");
      if (finished) {
        throw new IllegalStateException("accumulator already finished");
      }
      double fee = tx.fee();
      if (policy == BucketPolicy.DYNAMIC_MAX) {
        if (txCount == fees.length) {
          fees = Arrays.copyOf(fees, fees.length * 2);
        }
        fees[(int) txCount] = fee;
      } else {
        staticBuckets[staticIndex(fee)]++;
      }
      txCount++;
      if (shielded.test(tx)) {
        shieldedCount++;
      }
      totalFees += fee;
      feeSumSq += fee * fee;
      maxFee = Math.max(maxFee, fee);
    }

    public long txCount() {
      return txCount;
    }

    /**
     * Produces the aggregate. The accumulator cannot be reused afterwards.
     *
     * @param window reporting window
     * @param source upstream identifier
     * @return aggregate
     */
    public AggregateRecord finish(AggregateWindow window, String source) {
      finished = true;
      HistogramSpec spec;
      long[] buckets;
      if (policy == BucketPolicy.DYNAMIC_MAX) {
        double width = maxFee > 0 ? maxFee / bucketCount : EMPTY_DYNAMIC_WIDTH;
        spec = new HistogramSpec(policy, bucketCount, width);
        buckets = new long[bucketCount];
        for (int i = 0; i < txCount; i++) {
          buckets[spec.bucketIndex(fees[i])]++;
        }
      } else {
        spec = new HistogramSpec(policy, bucketCount, staticWidth);
        buckets = staticBuckets;
      }
      Map<Integer, Long> histogram = new HashMap<>();
      for (int i = 0; i < buckets.length; i++) {
        if (buckets[i] > 0) {
          histogram.put(i, buckets[i]);
        }
      }
      return new AggregateRecord(
          txCount, shieldedCount, totalFees, feeSumSq, histogram, spec, window, clock.now(), source);
    }

    private int staticIndex(double fee) {
      if (fee <= 0) {
        return 0;
      }
      double raw = Math.floor(fee / staticWidth);
      return raw >= bucketCount - 1 ? bucketCount - 1 : (int) raw;
    }
  }
}
