package ca.gc.cra.prism.validation;

import java.time.Duration;
import java.util.Objects;

/**
 * <strong>What:</strong> Numeric validation helpers used by PRISM configuration parsing.
 * <p><strong>Why:</strong> Rejects unusable worker counts, retry budgets, and timeouts before components are built.</p>
 * <p><strong>Thread-safety:</strong> Stateless utility.</p>
 *
 * @since 0.1.0
 * @see Strings
 */
public final class Numbers {
  private Numbers() {
    // Utility
  }

  /**
   * Validates that a numeric value falls within an inclusive range.
   *
   * @param name parameter name included in diagnostics; defaults to {@code "value"} when blank
   * @param value candidate value
   * @param min minimum inclusive value
   * @param max maximum inclusive value
   * @return the validated value
   * @throws IllegalArgumentException if {@code value} lies outside {@code [min, max]}
   */
  public static long requireRange(String name, long value, long min, long max) {
    if (value < min || value > max) {
      throw new IllegalArgumentException(
          label(name) + " must be between " + min + " and " + max + " (was " + value + ")");
    }
    return value;
  }

  /**
   * Validates that a duration is strictly positive.
   *
   * @param name parameter name included in diagnostics
   * @param value candidate duration
   * @return the validated duration
   * @throws IllegalArgumentException if the duration is zero or negative
   */
  public static Duration requirePositive(String name, Duration value) {
    Objects.requireNonNull(value, label(name));
    if (value.isZero() || value.isNegative()) {
      throw new IllegalArgumentException(label(name) + " must be positive (was " + value + ")");
    }
    return value;
  }

  private static String label(String name) {
    return name == null || name.isBlank() ? "value" : name;
  }
}
