package ca.gc.cra.prism.domain.error;

import java.util.Objects;

/**
 * <strong>What:</strong> Base of the PRISM failure taxonomy.
 * <p><strong>Why:</strong> Every stage reports failures through one checked type so the orchestrator can decide
 * between retrying and failing the job from {@link #retryable()} alone.</p>
 * <p><strong>Observability:</strong> {@link #describe()} is what a failed job reports as its last error.</p>
 *
 * @since PRISM 0.1
 */
public abstract class PipelineException extends Exception {
  private static final long serialVersionUID = 1L;

  private final ErrorKind kind;
  private final boolean retryable;

  protected PipelineException(ErrorKind kind, boolean retryable, String message, Throwable cause) {
    super(message, cause);
    this.kind = Objects.requireNonNull(kind, "kind");
    this.retryable = retryable;
  }

  /**
   * Failure classification.
   *
   * @return error kind
   */
  public ErrorKind kind() {
    return kind;
  }

  /**
   * Whether the failing operation may succeed if attempted again.
   *
   * @return {@code true} for transient failures
   */
  public boolean retryable() {
    return retryable;
  }

  /**
   * Renders {@code "KIND: message"}.
   *
   * @return description recorded on failed jobs
   */
  public String describe() {
    return kind.name() + ": " + getMessage();
  }
}
