package ca.gc.cra.prism.domain.aggregate;

import java.util.Locale;

/**
 * How the fee histogram bucket width is chosen.
 *
 * <p>The policy is fixed per deployment and travels with every encoded vector so the decoder
 * never has to guess which one produced a histogram.</p>
 *
 * @since PRISM 0.1
 */
public enum BucketPolicy {
  /** Width comes from configuration and is identical for every batch. */
  STATIC,
  /** Width is {@code maxFee / bucketCount} for the batch being aggregated. */
  DYNAMIC_MAX;

  /**
   * Parses a policy name, accepting {@code dynamic}, {@code dynamic-max} and {@code dynamic_max}.
   *
   * @param raw policy label
   * @return parsed policy
   * @throws IllegalArgumentException if the label is unknown
   */
  public static BucketPolicy parse(String raw) {
    if (raw == null || raw.isBlank()) {
      throw new IllegalArgumentException("bucketPolicy must not be blank");
    }
    String normalized = raw.trim().toUpperCase(Locale.ROOT).replace('-', '_');
    return switch (normalized) {
      case "STATIC" -> STATIC;
      case "DYNAMIC", "DYNAMIC_MAX" -> DYNAMIC_MAX;
      default -> throw new IllegalArgumentException("Unknown bucketPolicy: " + raw);
    };
  }
}
