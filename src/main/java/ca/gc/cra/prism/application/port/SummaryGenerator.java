package ca.gc.cra.prism.application.port;

import ca.gc.cra.prism.domain.aggregate.AggregateRecord;
import ca.gc.cra.prism.domain.summary.Summary;

/**
 * <strong>What:</strong> Port turning a decoded aggregate into a bounded embedding and short text.
 * <p><strong>Why:</strong> The summarizing model is a black box; any implementation honouring the
 * {@link Summary} contract (embedding values in {@code [0,1]}, text under 300 characters) is acceptable.</p>
 * <p><strong>Thread-safety:</strong> Implementations must be thread-safe.</p>
 *
 * @since 0.1.0
 */
public interface SummaryGenerator {
  /**
   * Summarizes an aggregate.
   *
   * @param aggregate decoded aggregate
   * @return summary
   */
  Summary summarize(AggregateRecord aggregate);
}
