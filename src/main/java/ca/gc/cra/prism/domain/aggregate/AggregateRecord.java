package ca.gc.cra.prism.domain.aggregate;

import ca.gc.cra.prism.domain.chain.AggregateWindow;
import java.time.Instant;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * <strong>What:</strong> Statistical reduction of one batch of transactions.
 * <p><strong>Why:</strong> The only shape of chain data that leaves the ingestion stage; everything downstream
 * (encoding, external computation, summaries, storage) works on aggregates, never on raw transactions.</p>
 * <p><strong>Invariants:</strong>
 * <ul>
 *   <li>{@code shieldedCount <= txCount}.</li>
 *   <li>Histogram keys are bucket indexes in {@code [0, histogramSpec.bucketCount())}.</li>
 *   <li>Histogram counts sum to {@code txCount}, or to zero when the histogram was never populated.</li>
 * </ul>
 * <p><strong>Dispersion:</strong> {@link #feeVariance()} is the population variance. Standard deviation is only
 * available through {@link #feeStdDev()}.</p>
 *
 * @param txCount number of transactions folded into the aggregate
 * @param shieldedCount number of transactions the shielded predicate accepted
 * @param totalFees sum of fees
 * @param feeSumSq sum of squared fees
 * @param feeHistogram bucket index to transaction count; copied into an ordered immutable map
 * @param histogramSpec bucketing used for {@code feeHistogram}
 * @param window reporting window
 * @param timestamp time the aggregate was produced
 * @param source upstream the transactions came from
 * @since PRISM 0.1
 */
public record AggregateRecord(
    long txCount,
    long shieldedCount,
    double totalFees,
    double feeSumSq,
    Map<Integer, Long> feeHistogram,
    HistogramSpec histogramSpec,
    AggregateWindow window,
    Instant timestamp,
    String source) {

  public AggregateRecord {
    Objects.requireNonNull(feeHistogram, "feeHistogram");
    Objects.requireNonNull(histogramSpec, "histogramSpec");
    Objects.requireNonNull(window, "window");
    Objects.requireNonNull(timestamp, "timestamp");
    Objects.requireNonNull(source, "source");
    if (txCount < 0 || shieldedCount < 0) {
      throw new IllegalArgumentException("counts must be non-negative");
    }
    if (shieldedCount > txCount) {
      throw new IllegalArgumentException(
          "shieldedCount must not exceed txCount (" + shieldedCount + " > " + txCount + ")");
    }
    requireNonNegativeFinite("totalFees", totalFees);
    requireNonNegativeFinite("feeSumSq", feeSumSq);
    long sum = 0;
    for (Map.Entry<Integer, Long> entry : feeHistogram.entrySet()) {
      int key = Objects.requireNonNull(entry.getKey(), "histogram key");
      long count = Objects.requireNonNull(entry.getValue(), "histogram count");
      if (key < 0 || key >= histogramSpec.bucketCount()) {
        throw new IllegalArgumentException("histogram bucket out of range: " + key);
      }
      if (count < 0) {
        throw new IllegalArgumentException("histogram counts must be non-negative");
      }
      sum += count;
    }
    if (sum != 0 && sum != txCount) {
      throw new IllegalArgumentException(
          "histogram counts must sum to txCount (" + sum + " != " + txCount + ")");
    }
    feeHistogram = Collections.unmodifiableMap(new TreeMap<>(feeHistogram));
  }

  private static void requireNonNegativeFinite(String name, double value) {
    if (!Double.isFinite(value) || value < 0) {
      throw new IllegalArgumentException(name + " must be finite and non-negative (was " + value + ")");
    }
  }

  /**
   * Returns {@code shieldedCount / txCount}, or zero for an empty aggregate.
   *
   * @return shielded ratio in {@code [0, 1]}
   */
  public double shieldedRatio() {
    return txCount == 0 ? 0.0 : (double) shieldedCount / txCount;
  }

  /**
   * Returns the mean fee, or zero for an empty aggregate.
   *
   * @return average fee
   */
  public double averageFee() {
    return txCount == 0 ? 0.0 : totalFees / txCount;
  }

  /**
   * Population variance of fees, clamped to zero to absorb rounding.
   *
   * @return non-negative variance
   */
  public double feeVariance() {
    if (txCount == 0) {
      return 0.0;
    }
    double mean = averageFee();
    return Math.max(0.0, feeSumSq / txCount - mean * mean);
  }

  /**
   * Standard deviation of fees.
   *
   * @return square root of {@link #feeVariance()}
   */
  public double feeStdDev() {
    return Math.sqrt(feeVariance());
  }

  /**
   * Total count across all histogram buckets.
   *
   * @return histogram sum
   */
  public long histogramTotal() {
    long sum = 0;
    for (long count : feeHistogram.values()) {
      sum += count;
    }
    return sum;
  }

  /**
   * Whether every transaction has been placed into a histogram bucket.
   *
   * @return {@code true} when the histogram sum equals {@code txCount}
   */
  public boolean histogramPopulated() {
    return histogramTotal() == txCount;
  }

  /**
   * Returns the count for one bucket, zero when absent.
   *
   * @param index bucket index
   * @return bucket count
   */
  public long bucketCount(int index) {
    return feeHistogram.getOrDefault(index, 0L);
  }
}
