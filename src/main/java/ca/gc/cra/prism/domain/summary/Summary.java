package ca.gc.cra.prism.domain.summary;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Bounded embedding plus short text describing one aggregate.
 *
 * @param embedding named features, each in {@code [0, 1]}
 * @param text human-readable summary shorter than {@link #MAX_TEXT_LENGTH} characters
 * @since PRISM 0.1
 */
public record Summary(Map<String, Double> embedding, String text) {

  /** Exclusive upper bound on {@link #text()} length. */
  public static final int MAX_TEXT_LENGTH = 300;

  public Summary {
    Objects.requireNonNull(embedding, "embedding");
    Objects.requireNonNull(text, "text");
    for (Map.Entry<String, Double> entry : embedding.entrySet()) {
      Double value = Objects.requireNonNull(entry.getValue(), "embedding value");
      if (!(value >= 0.0 && value <= 1.0)) {
        throw new IllegalArgumentException("embedding " + entry.getKey() + " must be in [0,1] (was " + value + ")");
      }
    }
    if (text.length() >= MAX_TEXT_LENGTH) {
      throw new IllegalArgumentException("summary text must be shorter than " + MAX_TEXT_LENGTH + " characters");
    }
    embedding = Collections.unmodifiableMap(new TreeMap<>(embedding));
  }
}
