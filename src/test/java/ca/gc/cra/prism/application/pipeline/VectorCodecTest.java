package ca.gc.cra.prism.application.pipeline;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.prism.domain.aggregate.AggregateRecord;
import ca.gc.cra.prism.domain.aggregate.BucketPolicy;
import ca.gc.cra.prism.domain.aggregate.HistogramSpec;
import ca.gc.cra.prism.domain.chain.AggregateWindow;
import ca.gc.cra.prism.domain.error.DecodeMismatchException;
import ca.gc.cra.prism.domain.error.EncodingOverflowException;
import ca.gc.cra.prism.domain.vector.DispersionConvention;
import ca.gc.cra.prism.domain.vector.EncodedVector;
import ca.gc.cra.prism.domain.vector.VectorMetadata;
import ca.gc.cra.prism.testing.Fixtures;
import java.util.Arrays;
import java.util.HashMap;
import java.util.Map;
import java.util.Random;
import org.junit.jupiter.api.Test;

class VectorCodecTest {
  private static final long SCALE = 1_000_000L;
  private final VectorCodec codec = new VectorCodec(SCALE, 4);

  @Test
  void encodesScalarsAtFixedScale() throws Exception {
    AggregateRecord aggregate = Fixtures.aggregate(1250, 892, 0.125, 0.00000125, Map.of(), 4);

    EncodedVector vector = codec.encode(aggregate, SCALE, 4);

    assertEquals(8, vector.length());
    assertEquals(1_250_000_000L, vector.value(0));
    assertEquals(892_000_000L, vector.value(1));
    assertEquals(125_000L, vector.value(2));
    assertEquals(1L, vector.value(3));
    assertArrayEquals(new long[] {0, 0, 0, 0}, Arrays.copyOfRange(vector.values(), 4, 8));
    assertEquals(SCALE, vector.metadata().scalingFactor());
    assertEquals(DispersionConvention.VARIANCE, vector.metadata().dispersion());
    assertEquals(AggregateWindow.DAY, vector.metadata().window());
  }

  @Test
  void decodesShieldedRatio() throws Exception {
    EncodedVector vector = new EncodedVector(
        new long[] {1_250_000_000L, 892_000_000L, 125_000L, 1_250L, 0, 0, 0, 0}, metadata(4));

    AggregateRecord decoded = codec.decode(vector);

    assertEquals(1250, decoded.txCount());
    assertEquals(892, decoded.shieldedCount());
    assertEquals(0.7136, decoded.shieldedRatio(), 0.0001);
    assertEquals(0.125, decoded.totalFees(), 1e-12);
    assertEquals(0.00125, decoded.feeSumSq(), 1e-12);
  }

  @Test
  void decodeRestoresEncodedAggregate() throws Exception {
    AggregateRecord aggregate = Fixtures.aggregate(1250, 892, 0.125, 0.0000325, Map.of(0, 600L, 3, 650L), 4);

    AggregateRecord decoded = codec.decode(codec.encode(aggregate));

    assertEquals(aggregate.txCount(), decoded.txCount());
    assertEquals(aggregate.shieldedCount(), decoded.shieldedCount());
    assertEquals(aggregate.feeHistogram(), decoded.feeHistogram());
    assertEquals(aggregate.totalFees(), decoded.totalFees(), 1.0 / SCALE);
    assertEquals(aggregate.feeSumSq(), decoded.feeSumSq(), 1.0 / SCALE);
    assertEquals(aggregate.timestamp(), decoded.timestamp());
    assertEquals(aggregate.source(), decoded.source());
  }

  @Test
  void rebucketsToRequestedCount() throws Exception {
    AggregateRecord aggregate = Fixtures.aggregate(2, 0, 0.001, 0.0000005, Map.of(0, 1L, 9, 1L), 10);

    EncodedVector vector = codec.encode(aggregate, SCALE, 5);

    assertEquals(9, vector.length());
    assertEquals(SCALE, vector.value(4));
    assertEquals(SCALE, vector.value(8));
    assertEquals(0.0002, vector.metadata().bucketWidth(), 1e-12);
  }

  @Test
  void randomAggregatesSurviveEncodeAndDecode() throws Exception {
    Random random = new Random(20240501L);
    long[] scales = {1_000L, 1_000_000L, 100_000_000L};
    for (int round = 0; round < 500; round++) {
      AggregateRecord aggregate = randomAggregate(random);
      long scale = scales[random.nextInt(scales.length)];
      int targetBuckets = 1 + random.nextInt(12);
      String label = "round " + round + ": " + aggregate + " at scale " + scale + " into " + targetBuckets;

      EncodedVector vector = codec.encode(aggregate, scale, targetBuckets);
      AggregateRecord decoded = codec.decode(vector);

      double tolerance = 1.0 / scale;
      assertEquals(DispersionConvention.VARIANCE, vector.metadata().dispersion(), label);
      assertEquals(aggregate.txCount(), decoded.txCount(), label);
      assertEquals(aggregate.shieldedCount(), decoded.shieldedCount(), label);
      assertEquals(aggregate.totalFees(), decoded.totalFees(), tolerance, label);
      assertEquals(aggregate.feeSumSq(), decoded.feeSumSq(), tolerance, label);
      assertEquals(aggregate.feeVariance(), decoded.feeVariance(), tolerance, label);
      assertEquals(aggregate.histogramSpec().policy(), decoded.histogramSpec().policy(), label);
      assertEquals(targetBuckets, decoded.histogramSpec().bucketCount(), label);
      assertEquals(aggregate.txCount(), decoded.histogramTotal(), label);
      if (targetBuckets == aggregate.histogramSpec().bucketCount()) {
        assertEquals(aggregate.feeHistogram(), decoded.feeHistogram(), label);
      }
    }
  }

  @Test
  void emptyAggregateEncodesToZeros() throws Exception {
    AggregateRecord empty = Fixtures.aggregate(0, 0, 0.0, 0.0, Map.of(), 4);

    EncodedVector vector = codec.encode(empty, SCALE, 6);
    AggregateRecord decoded = codec.decode(vector);

    assertArrayEquals(new long[10], vector.values());
    assertEquals(0, decoded.txCount());
    assertEquals(0.0, decoded.feeVariance());
    assertEquals(0.0, decoded.shieldedRatio());
    assertTrue(decoded.feeHistogram().isEmpty());
  }

  @Test
  void overflowIsReportedNotWrapped() {
    AggregateRecord huge = Fixtures.aggregate(Long.MAX_VALUE / 2, 0, 0.0, 0.0, Map.of(), 4);

    assertThrows(EncodingOverflowException.class, () -> codec.encode(huge));
  }

  @Test
  void rejectsLengthThatDisagreesWithMetadata() {
    EncodedVector shortVector = new EncodedVector(new long[] {1, 0, 0, 0, 0, 0, 0}, metadata(4));

    assertThrows(DecodeMismatchException.class, () -> codec.decode(shortVector));
  }

  @Test
  void rejectsInconsistentCounts() {
    EncodedVector moreShielded = new EncodedVector(
        new long[] {SCALE, 2 * SCALE, 0, 0, 0, 0, 0, 0}, metadata(4));
    EncodedVector badHistogram = new EncodedVector(
        new long[] {3 * SCALE, 0, 0, 0, SCALE, SCALE, 0, 0}, metadata(4));
    EncodedVector negative = new EncodedVector(new long[] {SCALE, 0, -5, 0, 0, 0, 0, 0}, metadata(4));

    assertThrows(DecodeMismatchException.class, () -> codec.decode(moreShielded));
    assertThrows(DecodeMismatchException.class, () -> codec.decode(badHistogram));
    assertThrows(DecodeMismatchException.class, () -> codec.decode(negative));
  }

  @Test
  void contentHashTracksValuesAndMetadata() throws Exception {
    AggregateRecord aggregate = Fixtures.aggregate(10, 5, 0.01, 0.00001, Map.of(), 4);
    EncodedVector vector = codec.encode(aggregate);

    assertEquals(VectorCodec.contentHash(vector), VectorCodec.contentHash(codec.encode(aggregate)));
    assertNotEquals(VectorCodec.contentHash(vector),
        VectorCodec.contentHash(codec.encode(Fixtures.aggregate(10, 6, 0.01, 0.00001, Map.of(), 4))));
    assertNotEquals(VectorCodec.contentHash(vector), VectorCodec.contentHash(codec.encode(aggregate, 1000L, 4)));
  }

  // Builds an aggregate the way the aggregator would from a batch of random fees.
  private static AggregateRecord randomAggregate(Random random) {
    int txCount = random.nextInt(5) == 0 ? 0 : 1 + random.nextInt(60);
    double[] fees = new double[txCount];
    double maxFee = 0.0;
    for (int i = 0; i < txCount; i++) {
      fees[i] = random.nextInt(4) == 0 ? 0.0 : random.nextInt(200_000) / 1e8;
      maxFee = Math.max(maxFee, fees[i]);
    }
    int bucketCount = 1 + random.nextInt(12);
    BucketPolicy policy = random.nextBoolean() ? BucketPolicy.STATIC : BucketPolicy.DYNAMIC_MAX;
    double width = policy == BucketPolicy.STATIC || maxFee == 0.0 ? 0.0001 : maxFee / bucketCount;
    HistogramSpec spec = new HistogramSpec(policy, bucketCount, width);

    long shielded = 0;
    double total = 0.0;
    double sumSq = 0.0;
    Map<Integer, Long> histogram = new HashMap<>();
    for (double fee : fees) {
      if (random.nextBoolean()) {
        shielded++;
      }
      total += fee;
      sumSq += fee * fee;
      histogram.merge(spec.bucketIndex(fee), 1L, Long::sum);
    }
    return new AggregateRecord(
        txCount, shielded, total, sumSq, histogram, spec, AggregateWindow.DAY, Fixtures.OBSERVED_AT, "stub://zcash");
  }

  private static VectorMetadata metadata(int buckets) {
    HistogramSpec spec = new HistogramSpec(BucketPolicy.STATIC, buckets, 0.0001);
    return new VectorMetadata(
        SCALE,
        spec.bucketCount(),
        spec.bucketWidth(),
        spec.policy(),
        DispersionConvention.VARIANCE,
        Fixtures.OBSERVED_AT,
        AggregateWindow.DAY,
        "stub://zcash",
        VectorMetadata.LAYOUT_VERSION);
  }
}
