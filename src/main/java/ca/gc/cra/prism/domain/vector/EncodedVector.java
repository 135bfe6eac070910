package ca.gc.cra.prism.domain.vector;

import java.util.Arrays;
import java.util.Objects;

/**
 * Fixed-point integer vector ready for submission to an external computation service.
 *
 * <p>The layout invariant {@code values.length == 4 + metadata.bucketCount()} is checked by the codec at
 * both encode and decode time rather than here, so that malformed vectors received from outside can still be
 * represented and rejected with a precise error.</p>
 *
 * @param values scaled values; defensively copied on the way in and out
 * @param metadata interpretation metadata
 * @since PRISM 0.1
 */
public record EncodedVector(long[] values, VectorMetadata metadata) {
  public EncodedVector {
    Objects.requireNonNull(values, "values");
    Objects.requireNonNull(metadata, "metadata");
    values = values.clone();
  }

  @Override
  public long[] values() {
    return values.clone();
  }

  /**
   * Returns one slot without copying the backing array.
   *
   * @param index slot index
   * @return scaled value
   */
  public long value(int index) {
    return values[index];
  }

  /**
   * Number of slots.
   *
   * @return vector length
   */
  public int length() {
    return values.length;
  }

  /**
   * Whether the vector length agrees with its metadata.
   *
   * @return {@code true} when {@code length() == metadata.expectedLength()}
   */
  public boolean layoutMatches() {
    return values.length == metadata.expectedLength();
  }

  @Override
  public boolean equals(Object other) {
    if (this == other) {
      return true;
    }
    if (!(other instanceof EncodedVector that)) {
      return false;
    }
    return Arrays.equals(values, that.values) && metadata.equals(that.metadata);
  }

  @Override
  public int hashCode() {
    return 31 * Arrays.hashCode(values) + metadata.hashCode();
  }

  @Override
  public String toString() {
    return "EncodedVector[values=" + Arrays.toString(values) + ", metadata=" + metadata + "]";
  }
}
