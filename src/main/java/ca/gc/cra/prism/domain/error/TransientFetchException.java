package ca.gc.cra.prism.domain.error;

/**
 * Upstream fetch failed in a way worth retrying (IO error, HTTP 5xx or 429).
 *
 * @since PRISM 0.1
 */
public final class TransientFetchException extends PipelineException {
  private static final long serialVersionUID = 1L;

  public TransientFetchException(String message) {
    super(ErrorKind.TRANSIENT_FETCH, true, message, null);
  }

  public TransientFetchException(String message, Throwable cause) {
    super(ErrorKind.TRANSIENT_FETCH, true, message, cause);
  }
}
