package ca.gc.cra.prism.domain.vector;

import ca.gc.cra.prism.domain.aggregate.BucketPolicy;
import ca.gc.cra.prism.domain.aggregate.HistogramSpec;
import ca.gc.cra.prism.domain.chain.AggregateWindow;
import java.time.Instant;
import java.util.Objects;

/**
 * Everything a decoder needs to interpret an {@link EncodedVector} without consulting configuration.
 *
 * @param scalingFactor fixed-point multiplier applied to every value; positive
 * @param bucketCount number of histogram slots following the four scalar slots
 * @param bucketWidth histogram bucket width in coin units
 * @param bucketPolicy policy that produced {@code bucketWidth}
 * @param dispersion dispersion convention of the decoded statistics
 * @param sourceTimestamp timestamp of the aggregate that was encoded
 * @param window reporting window of the aggregate
 * @param source upstream identifier of the aggregate
 * @param layoutVersion vector layout revision; see {@link #LAYOUT_VERSION}
 * @since PRISM 0.1
 */
public record VectorMetadata(
    long scalingFactor,
    int bucketCount,
    double bucketWidth,
    BucketPolicy bucketPolicy,
    DispersionConvention dispersion,
    Instant sourceTimestamp,
    AggregateWindow window,
    String source,
    int layoutVersion) {

  /** Current layout: {@code [tx_count, shielded_count, total_fees, fee_sum_sq, bucket_0 .. bucket_{B-1}]}. */
  public static final int LAYOUT_VERSION = 1;

  /** Number of scalar slots preceding the histogram. */
  public static final int SCALAR_SLOTS = 4;

  public VectorMetadata {
    Objects.requireNonNull(bucketPolicy, "bucketPolicy");
    Objects.requireNonNull(dispersion, "dispersion");
    Objects.requireNonNull(sourceTimestamp, "sourceTimestamp");
    Objects.requireNonNull(window, "window");
    Objects.requireNonNull(source, "source");
  }

  /**
   * Expected vector length for this metadata.
   *
   * @return {@code 4 + bucketCount}
   */
  public int expectedLength() {
    return SCALAR_SLOTS + bucketCount;
  }

  /**
   * Rebuilds the histogram spec recorded at encode time.
   *
   * @return histogram spec
   * @throws IllegalArgumentException if the recorded bucket parameters are invalid
   */
  public HistogramSpec histogramSpec() {
    return new HistogramSpec(bucketPolicy, bucketCount, bucketWidth);
  }
}
