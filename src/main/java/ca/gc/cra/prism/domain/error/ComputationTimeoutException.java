package ca.gc.cra.prism.domain.error;

/**
 * The computation stayed pending for the whole poll budget.
 *
 * @since PRISM 0.1
 */
public final class ComputationTimeoutException extends PipelineException {
  private static final long serialVersionUID = 1L;

  public ComputationTimeoutException(String message) {
    super(ErrorKind.COMPUTATION_TIMEOUT, false, message, null);
  }

  public ComputationTimeoutException(String message, Throwable cause) {
    super(ErrorKind.COMPUTATION_TIMEOUT, false, message, cause);
  }
}
