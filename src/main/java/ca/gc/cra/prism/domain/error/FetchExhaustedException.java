package ca.gc.cra.prism.domain.error;

/**
 * Raised once the upstream retry budget is spent; wraps the last transient failure.
 *
 * @since PRISM 0.1
 */
public final class FetchExhaustedException extends PipelineException {
  private static final long serialVersionUID = 1L;

  private final int attempts;

  public FetchExhaustedException(String message, int attempts, Throwable lastFailure) {
    super(ErrorKind.FETCH_EXHAUSTED, false, message + " after " + attempts + " attempts", lastFailure);
    this.attempts = attempts;
  }

  /**
   * Number of attempts made before giving up.
   *
   * @return attempt count
   */
  public int attempts() {
    return attempts;
  }
}
