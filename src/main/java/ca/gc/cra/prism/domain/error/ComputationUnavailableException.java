package ca.gc.cra.prism.domain.error;

/**
 * The computation service could not be reached or answered with a server error.
 *
 * @since PRISM 0.1
 */
public final class ComputationUnavailableException extends PipelineException {
  private static final long serialVersionUID = 1L;

  public ComputationUnavailableException(String message) {
    super(ErrorKind.COMPUTATION_UNAVAILABLE, true, message, null);
  }

  public ComputationUnavailableException(String message, Throwable cause) {
    super(ErrorKind.COMPUTATION_UNAVAILABLE, true, message, cause);
  }
}
