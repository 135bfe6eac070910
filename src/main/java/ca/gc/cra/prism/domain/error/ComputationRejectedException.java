package ca.gc.cra.prism.domain.error;

/**
 * The computation service refused the submission or reported the job as failed.
 *
 * @since PRISM 0.1
 */
public final class ComputationRejectedException extends PipelineException {
  private static final long serialVersionUID = 1L;

  public ComputationRejectedException(String message) {
    super(ErrorKind.COMPUTATION_REJECTED, false, message, null);
  }

  public ComputationRejectedException(String message, Throwable cause) {
    super(ErrorKind.COMPUTATION_REJECTED, false, message, cause);
  }
}
