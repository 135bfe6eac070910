package ca.gc.cra.prism.domain.error;

/**
 * A scaled value exceeded the signed 64-bit range, which points at bad input magnitudes.
 *
 * @since PRISM 0.1
 */
public final class EncodingOverflowException extends PipelineException {
  private static final long serialVersionUID = 1L;

  public EncodingOverflowException(String message) {
    super(ErrorKind.ENCODING_OVERFLOW, false, message, null);
  }

  public EncodingOverflowException(String message, Throwable cause) {
    super(ErrorKind.ENCODING_OVERFLOW, false, message, cause);
  }
}
