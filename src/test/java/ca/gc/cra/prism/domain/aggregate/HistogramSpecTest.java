package ca.gc.cra.prism.domain.aggregate;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class HistogramSpecTest {

  @Test
  void bucketIndexUsesLowerBoundsAndClampsOverflow() {
    HistogramSpec spec = new HistogramSpec(BucketPolicy.STATIC, 4, 0.5);

    assertEquals(0, spec.bucketIndex(0.0));
    assertEquals(0, spec.bucketIndex(0.49));
    assertEquals(1, spec.bucketIndex(0.5));
    assertEquals(3, spec.bucketIndex(1.5));
    assertEquals(3, spec.bucketIndex(99.0));
    assertEquals(1.0, spec.lowerBound(2), 1e-12);
  }

  @Test
  void resizeKeepsCoveredRange() {
    HistogramSpec spec = new HistogramSpec(BucketPolicy.DYNAMIC_MAX, 10, 0.2);

    HistogramSpec resized = spec.resize(4);

    assertEquals(4, resized.bucketCount());
    assertEquals(0.5, resized.bucketWidth(), 1e-12);
    assertSame(spec, spec.resize(10));
  }

  @Test
  void resizedStaticSpecStaysStaticWithDerivedWidth() {
    HistogramSpec configured = new HistogramSpec(BucketPolicy.STATIC, 10, 0.0001);

    HistogramSpec resized = configured.resize(5);

    assertEquals(BucketPolicy.STATIC, resized.policy());
    assertEquals(0.0002, resized.bucketWidth(), 1e-12);
    assertEquals(configured.bucketCount() * configured.bucketWidth(),
        resized.bucketCount() * resized.bucketWidth(), 1e-12);
    assertEquals(4, resized.bucketIndex(0.00095));
  }

  @Test
  void rejectsInvalidShape() {
    assertThrows(IllegalArgumentException.class, () -> new HistogramSpec(BucketPolicy.STATIC, 0, 1.0));
    assertThrows(IllegalArgumentException.class, () -> new HistogramSpec(BucketPolicy.STATIC, 3, 0.0));
  }

  @Test
  void parsesPolicyAliases() {
    assertEquals(BucketPolicy.DYNAMIC_MAX, BucketPolicy.parse("dynamic"));
    assertEquals(BucketPolicy.DYNAMIC_MAX, BucketPolicy.parse("dynamic-max"));
    assertEquals(BucketPolicy.STATIC, BucketPolicy.parse(" static "));
    assertThrows(IllegalArgumentException.class, () -> BucketPolicy.parse("quantile"));
  }
}
