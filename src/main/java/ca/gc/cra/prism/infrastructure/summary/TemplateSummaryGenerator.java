package ca.gc.cra.prism.infrastructure.summary;

import ca.gc.cra.prism.application.port.SummaryGenerator;
import ca.gc.cra.prism.domain.aggregate.AggregateRecord;
import ca.gc.cra.prism.domain.summary.Summary;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * {@link SummaryGenerator} producing a fixed embedding and a one-sentence template summary.
 *
 * <p>Embedding features, each clamped to {@code [0,1]}:</p>
 * <ul>
 *   <li>{@code shielded_ratio}: shielded over total transactions.</li>
 *   <li>{@code fee_volatility}: fee standard deviation relative to the fee reference.</li>
 *   <li>{@code avg_fee_normalized}: average fee relative to the fee reference.</li>
 *   <li>{@code tx_count_log}: {@code log10(txCount) / 4}, saturating at 10,000 transactions.</li>
 * </ul>
 *
 * @since PRISM 0.1
 */
public final class TemplateSummaryGenerator implements SummaryGenerator {
  private final double feeReference;

  /**
   * Creates a generator.
   *
   * @param feeReference fee, in coin units, that maps to 1.0 in fee features; positive
   */
  public TemplateSummaryGenerator(double feeReference) {
    if (!(feeReference > 0) || !Double.isFinite(feeReference)) {
      throw new IllegalArgumentException("feeReference must be positive (was " + feeReference + ")");
    }
    this.feeReference = feeReference;
  }

  @Override
  public Summary summarize(AggregateRecord aggregate) {
    Map<String, Double> embedding = new LinkedHashMap<>();
    embedding.put("shielded_ratio", clamp(aggregate.shieldedRatio()));
    embedding.put("fee_volatility", clamp(aggregate.feeStdDev() / feeReference));
    embedding.put("avg_fee_normalized", clamp(aggregate.averageFee() / feeReference));
    embedding.put("tx_count_log", clamp(Math.log10(Math.max(aggregate.txCount(), 1)) / 4.0));
    return new Summary(embedding, text(aggregate));
  }

  private String text(AggregateRecord aggregate) {
    if (aggregate.txCount() == 0) {
      return "No transactions were observed in this " + aggregate.window().label() + " window.";
    }
    double ratio = aggregate.shieldedRatio();
    String privacy = ratio >= 0.5 ? "predominantly shielded" : ratio > 0 ? "mostly transparent" : "fully transparent";
    String text = String.format(Locale.ROOT,
        "%d transactions in this %s window were %s (%.1f%% shielded), with an average fee of %.8f and a fee "
            + "standard deviation of %.8f.",
        aggregate.txCount(),
        aggregate.window().label(),
        privacy,
        ratio * 100.0,
        aggregate.averageFee(),
        aggregate.feeStdDev());
    return text.length() < Summary.MAX_TEXT_LENGTH ? text : text.substring(0, Summary.MAX_TEXT_LENGTH - 1);
  }

  private static double clamp(double value) {
    if (Double.isNaN(value)) {
      return 0.0;
    }
    return Math.max(0.0, Math.min(1.0, value));
  }
}
