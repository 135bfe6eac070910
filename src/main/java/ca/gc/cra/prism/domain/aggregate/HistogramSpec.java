package ca.gc.cra.prism.domain.aggregate;

import java.util.Objects;

/**
 * Bucketing parameters a fee histogram was built with.
 *
 * @param policy policy that produced {@code bucketWidth}
 * @param bucketCount number of buckets; at least one
 * @param bucketWidth width of each bucket in coin units; strictly positive
 * @since PRISM 0.1
 */
public record HistogramSpec(BucketPolicy policy, int bucketCount, double bucketWidth) {
  public HistogramSpec {
    Objects.requireNonNull(policy, "policy");
    if (bucketCount <= 0) {
      throw new IllegalArgumentException("bucketCount must be positive (was " + bucketCount + ")");
    }
    if (!Double.isFinite(bucketWidth) || bucketWidth <= 0) {
      throw new IllegalArgumentException("bucketWidth must be positive (was " + bucketWidth + ")");
    }
  }

  /**
   * Maps a fee to its bucket, clamping overflow into the last bucket.
   *
   * @param fee non-negative fee
   * @return bucket index in {@code [0, bucketCount)}
   */
  public int bucketIndex(double fee) {
    if (fee <= 0) {
      return 0;
    }
    double raw = Math.floor(fee / bucketWidth);
    if (raw >= bucketCount - 1) {
      return bucketCount - 1;
    }
    return (int) raw;
  }

  /**
   * Returns the lower fee bound of a bucket.
   *
   * @param index bucket index
   * @return {@code index * bucketWidth}
   */
  public double lowerBound(int index) {
    if (index < 0 || index >= bucketCount) {
      throw new IllegalArgumentException("bucket index out of range: " + index);
    }
    return index * bucketWidth;
  }

  /**
   * Derives the spec for the same fee span split into a different number of buckets.
   *
   * <p>The policy is kept but the width is always recomputed from the span, for {@link BucketPolicy#STATIC} too:
   * a resized static spec no longer carries the configured width. Consumers must read the width from the
   * returned spec (the encoder records it in the vector metadata) rather than from configuration.</p>
   *
   * @param newCount target bucket count
   * @return spec covering {@code bucketCount * bucketWidth} with {@code newCount} buckets
   */
  public HistogramSpec resize(int newCount) {
    if (newCount == bucketCount) {
      return this;
    }
    return new HistogramSpec(policy, newCount, bucketCount * bucketWidth / newCount);
  }
}
