package ca.gc.cra.prism.domain.error;

/**
 * Decoded shape does not agree with the vector metadata; signals a layout or versioning bug.
 *
 * @since PRISM 0.1
 */
public final class DecodeMismatchException extends PipelineException {
  private static final long serialVersionUID = 1L;

  public DecodeMismatchException(String message) {
    super(ErrorKind.DECODE_MISMATCH, false, message, null);
  }

  public DecodeMismatchException(String message, Throwable cause) {
    super(ErrorKind.DECODE_MISMATCH, false, message, cause);
  }
}
