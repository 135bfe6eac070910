package ca.gc.cra.prism.domain.error;

/**
 * Requested data does not exist upstream. Never retried.
 *
 * @since PRISM 0.1
 */
public final class NotFoundException extends PipelineException {
  private static final long serialVersionUID = 1L;

  public NotFoundException(String message) {
    super(ErrorKind.NOT_FOUND, false, message, null);
  }

  public NotFoundException(String message, Throwable cause) {
    super(ErrorKind.NOT_FOUND, false, message, cause);
  }
}
