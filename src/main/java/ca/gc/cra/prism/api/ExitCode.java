package ca.gc.cra.prism.api;

/**
 * <strong>What:</strong> Canonical exit codes shared by PRISM command-line tools.
 * <p><strong>Why:</strong> Provides consistent process status semantics so operators and automation can react
 * deterministically, including telling a failed job apart from a broken invocation.</p>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable and thread-safe.</p>
 *
 * @since 0.1.0
 */
public enum ExitCode {
  /** Successful execution. */
  SUCCESS(0),
  /** Command-line arguments were invalid. */
  INVALID_ARGS(2),
  /** IO failure occurred while running the CLI. */
  IO_ERROR(3),
  /** Configuration was missing or malformed. */
  CONFIG_ERROR(4),
  /** Unexpected runtime failure occurred. */
  RUNTIME_FAILURE(5),
  /** The pipeline ran but the job or fetch ended in a terminal failure. */
  PIPELINE_FAILED(6),
  /** The requested result key does not exist. */
  NOT_FOUND(7),
  /** Process was interrupted (e.g., SIGINT). */
  INTERRUPTED(130);

  private final int code;

  ExitCode(int code) {
    this.code = code;
  }

  /**
   * Returns the numeric value encoded by this exit code.
   *
   * @return numeric exit code
   */
  public int code() {
    return code;
  }
}
