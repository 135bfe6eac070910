package ca.gc.cra.prism.application.pipeline;

import ca.gc.cra.prism.domain.aggregate.AggregateRecord;
import ca.gc.cra.prism.domain.aggregate.HistogramSpec;
import ca.gc.cra.prism.domain.error.DecodeMismatchException;
import ca.gc.cra.prism.domain.error.EncodingOverflowException;
import ca.gc.cra.prism.domain.vector.DispersionConvention;
import ca.gc.cra.prism.domain.vector.EncodedVector;
import ca.gc.cra.prism.domain.vector.VectorMetadata;
import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HashMap;
import java.util.HexFormat;
import java.util.Map;

/**
 * <strong>What:</strong> Bidirectional mapping between {@link AggregateRecord} and fixed-point {@link EncodedVector}.
 * <p><strong>Layout:</strong> {@code [tx_count, shielded_count, total_fees, fee_sum_sq, bucket_0 .. bucket_{B-1}]},
 * every slot multiplied by one scaling factor and rounded half away from zero.</p>
 * <p><strong>Invariants:</strong>
 * <ul>
 *   <li>{@code length == 4 + bucketCount}, checked on encode and decode.</li>
 *   <li>Bucket policy and width travel in {@link VectorMetadata}; decode never re-derives them.</li>
 *   <li>Decoded histograms sum to {@code tx_count}, or are empty.</li>
 *   <li>{@code decode(encode(a))} matches {@code a} within {@code 1 / scalingFactor} on every scalar.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Immutable and thread-safe.</p>
 *
 * @since PRISM 0.1
 */
public final class VectorCodec {
  private final long defaultScalingFactor;
  private final int defaultBucketCount;

  /**
   * Creates a codec with deployment defaults.
   *
   * @param defaultScalingFactor scaling factor used by {@link #encode(AggregateRecord)}; positive
   * @param defaultBucketCount bucket count used by {@link #encode(AggregateRecord)}; positive
   */
  public VectorCodec(long defaultScalingFactor, int defaultBucketCount) {
    requireScale(defaultScalingFactor);
    if (defaultBucketCount < 1) {
      throw new IllegalArgumentException("bucketCount must be >= 1 (was " + defaultBucketCount + ")");
    }
    this.defaultScalingFactor = defaultScalingFactor;
    this.defaultBucketCount = defaultBucketCount;
  }

  /**
   * Encodes with the deployment defaults.
   *
   * @param aggregate aggregate to encode
   * @return encoded vector
   * @throws EncodingOverflowException if a scaled value does not fit in a signed 64-bit integer
   */
  public EncodedVector encode(AggregateRecord aggregate) throws EncodingOverflowException {
    return encode(aggregate, defaultScalingFactor, defaultBucketCount);
  }

  /**
   * Encodes an aggregate.
   *
   * @param aggregate aggregate to encode
   * @param scalingFactor fixed-point multiplier; positive
   * @param bucketCount histogram slots in the output; the histogram is re-bucketed when it differs
   * @return encoded vector
   * @throws EncodingOverflowException if a scaled value does not fit in a signed 64-bit integer
   */
  public EncodedVector encode(AggregateRecord aggregate, long scalingFactor, int bucketCount)
      throws EncodingOverflowException {
    requireScale(scalingFactor);
    if (bucketCount < 1) {
      throw new IllegalArgumentException("bucketCount must be >= 1 (was " + bucketCount + ")");
    }
    HistogramSpec source = aggregate.histogramSpec();
    HistogramSpec target = source.resize(bucketCount);
    long[] buckets = rebucket(aggregate, source, target);

    long[] values = new long[VectorMetadata.SCALAR_SLOTS + bucketCount];
    values[0] = scaleCount("tx_count", aggregate.txCount(), scalingFactor);
    values[1] = scaleCount("shielded_count", aggregate.shieldedCount(), scalingFactor);
    values[2] = scaleReal("total_fees", aggregate.totalFees(), scalingFactor);
    values[3] = scaleReal("fee_sum_sq", aggregate.feeSumSq(), scalingFactor);
    for (int i = 0; i < bucketCount; i++) {
      values[VectorMetadata.SCALAR_SLOTS + i] = scaleCount("bucket_" + i, buckets[i], scalingFactor);
    }

    VectorMetadata metadata = new VectorMetadata(
        scalingFactor,
        bucketCount,
        target.bucketWidth(),
        target.policy(),
        DispersionConvention.VARIANCE,
        aggregate.timestamp(),
        aggregate.window(),
        aggregate.source(),
        VectorMetadata.LAYOUT_VERSION);
    EncodedVector vector = new EncodedVector(values, metadata);
    if (!vector.layoutMatches()) {
      throw new IllegalStateException("encoded vector length " + vector.length() + " != " + metadata.expectedLength());
    }
    return vector;
  }

  /**
   * Decodes a vector back into an aggregate.
   *
   * @param vector encoded vector
   * @return aggregate reconstructed from the vector and its metadata
   * @throws DecodeMismatchException if the vector does not match the layout its metadata declares
   */
  public AggregateRecord decode(EncodedVector vector) throws DecodeMismatchException {
    VectorMetadata metadata = vector.metadata();
    if (metadata.layoutVersion() != VectorMetadata.LAYOUT_VERSION) {
      throw new DecodeMismatchException("unsupported layout version " + metadata.layoutVersion());
    }
    if (metadata.scalingFactor() <= 0) {
      throw new DecodeMismatchException("scaling factor must be positive (was " + metadata.scalingFactor() + ")");
    }
    if (metadata.bucketCount() < 1) {
      throw new DecodeMismatchException("bucket count must be positive (was " + metadata.bucketCount() + ")");
    }
    if (!vector.layoutMatches()) {
      throw new DecodeMismatchException(
          "vector length " + vector.length() + " does not match 4 + " + metadata.bucketCount());
    }
    HistogramSpec spec;
    try {
      spec = metadata.histogramSpec();
    } catch (IllegalArgumentException ex) {
      throw new DecodeMismatchException("invalid histogram metadata: " + ex.getMessage(), ex);
    }

    long scale = metadata.scalingFactor();
    long txCount = unscaleCount("tx_count", vector.value(0), scale);
    long shieldedCount = unscaleCount("shielded_count", vector.value(1), scale);
    if (shieldedCount > txCount) {
      throw new DecodeMismatchException("shielded_count " + shieldedCount + " exceeds tx_count " + txCount);
    }
    double totalFees = unscaleReal("total_fees", vector.value(2), scale);
    double feeSumSq = unscaleReal("fee_sum_sq", vector.value(3), scale);

    Map<Integer, Long> histogram = new HashMap<>();
    long sum = 0;
    for (int i = 0; i < metadata.bucketCount(); i++) {
      long count = unscaleCount("bucket_" + i, vector.value(VectorMetadata.SCALAR_SLOTS + i), scale);
      if (count > 0) {
        histogram.put(i, count);
        sum += count;
      }
    }
    if (sum != 0 && sum != txCount) {
      throw new DecodeMismatchException("histogram sums to " + sum + " but tx_count is " + txCount);
    }

    try {
      return new AggregateRecord(
          txCount,
          shieldedCount,
          totalFees,
          feeSumSq,
          histogram,
          spec,
          metadata.window(),
          metadata.sourceTimestamp(),
          metadata.source());
    } catch (IllegalArgumentException ex) {
      throw new DecodeMismatchException("decoded aggregate is invalid: " + ex.getMessage(), ex);
    }
  }

  /**
   * Content hash of a vector, used as the computation idempotency key.
   *
   * @param vector encoded vector
   * @return 64 lowercase hex characters of SHA-256 over the values and metadata
   */
  public static String contentHash(EncodedVector vector) {
    VectorMetadata metadata = vector.metadata();
    ByteBuffer buffer = ByteBuffer.allocate(Long.BYTES * vector.length());
    for (int i = 0; i < vector.length(); i++) {
      buffer.putLong(vector.value(i));
    }
    String header = metadata.layoutVersion() + "|" + metadata.scalingFactor() + "|" + metadata.bucketCount()
        + "|" + Double.toString(metadata.bucketWidth()) + "|" + metadata.bucketPolicy() + "|"
        + metadata.dispersion() + "|" + metadata.sourceTimestamp() + "|" + metadata.window() + "|"
        + metadata.source();
    try {
      MessageDigest digest = MessageDigest.getInstance("SHA-256");
      digest.update(header.getBytes(StandardCharsets.UTF_8));
      digest.update(buffer.array());
      return HexFormat.of().formatHex(digest.digest());
    } catch (NoSuchAlgorithmException ex) {
      throw new IllegalStateException("SHA-256 unavailable", ex);
    }
  }

  private static long[] rebucket(AggregateRecord aggregate, HistogramSpec source, HistogramSpec target) {
    long[] buckets = new long[target.bucketCount()];
    int sourceCount = source.bucketCount();
    int targetCount = target.bucketCount();
    for (Map.Entry<Integer, Long> entry : aggregate.feeHistogram().entrySet()) {
      int index = sourceCount == targetCount
          ? entry.getKey()
          : (int) Math.min((long) entry.getKey() * targetCount / sourceCount, targetCount - 1L);
      buckets[index] += entry.getValue();
    }
    return buckets;
  }

  private static long scaleCount(String field, long count, long scale) throws EncodingOverflowException {
    try {
      return Math.multiplyExact(count, scale);
    } catch (ArithmeticException ex) {
      throw new EncodingOverflowException(field + "=" + count + " overflows at scale " + scale, ex);
    }
  }

  private static long scaleReal(String field, double value, long scale) throws EncodingOverflowException {
    if (!Double.isFinite(value)) {
      throw new EncodingOverflowException(field + " is not finite (" + value + ")");
    }
    BigDecimal scaled = BigDecimal.valueOf(value)
        .multiply(BigDecimal.valueOf(scale))
        .setScale(0, RoundingMode.HALF_UP);
    try {
      return scaled.longValueExact();
    } catch (ArithmeticException ex) {
      throw new EncodingOverflowException(field + "=" + value + " overflows at scale " + scale, ex);
    }
  }

  private static long unscaleCount(String field, long value, long scale) throws DecodeMismatchException {
    if (value < 0) {
      throw new DecodeMismatchException(field + " is negative (" + value + ")");
    }
    return BigDecimal.valueOf(value)
        .divide(BigDecimal.valueOf(scale), 0, RoundingMode.HALF_UP)
        .longValueExact();
  }

  private static double unscaleReal(String field, long value, long scale) throws DecodeMismatchException {
    if (value < 0) {
      throw new DecodeMismatchException(field + " is negative (" + value + ")");
    }
    return BigDecimal.valueOf(value).divide(BigDecimal.valueOf(scale), MathContext.DECIMAL64).doubleValue();
  }

  private static void requireScale(long scalingFactor) {
    if (scalingFactor <= 0) {
      throw new IllegalArgumentException("scalingFactor must be positive (was " + scalingFactor + ")");
    }
  }
}
