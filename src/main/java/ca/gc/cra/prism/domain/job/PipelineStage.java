package ca.gc.cra.prism.domain.job;

/**
 * Stages of a pipeline job, in execution order.
 *
 * <p>A job's stage names the last stage it completed. {@link #SUMMARIZED} and {@link #FAILED} are terminal.</p>
 *
 * @since PRISM 0.1
 */
public enum PipelineStage {
  /** Created; ingestion has not completed yet. */
  PENDING,
  INGESTED,
  ENCODED,
  SUBMITTED,
  COMPUTED,
  DECODED,
  STORED,
  SUMMARIZED,
  FAILED;

  /**
   * Whether no further transitions happen without an explicit restart.
   *
   * @return {@code true} for {@link #SUMMARIZED} and {@link #FAILED}
   */
  public boolean terminal() {
    return this == SUMMARIZED || this == FAILED;
  }

  /**
   * Stage reached after this one succeeds.
   *
   * @return successor stage
   * @throws IllegalStateException for terminal stages
   */
  public PipelineStage next() {
    return switch (this) {
      case PENDING -> INGESTED;
      case INGESTED -> ENCODED;
      case ENCODED -> SUBMITTED;
      case SUBMITTED -> COMPUTED;
      case COMPUTED -> DECODED;
      case DECODED -> STORED;
      case STORED -> SUMMARIZED;
      case SUMMARIZED, FAILED -> throw new IllegalStateException("No stage follows " + this);
    };
  }
}
