package ca.gc.cra.prism.domain.error;

/**
 * A write for a key collided with an existing or concurrent write.
 *
 * <p>{@link #finalized()} separates the terminal case (the key already holds a result) from a transient
 * race that may succeed when retried.</p>
 *
 * @since PRISM 0.1
 */
public final class StorageConflictException extends PipelineException {
  private static final long serialVersionUID = 1L;

  private final String key;
  private final boolean finalized;

  public StorageConflictException(String key, boolean finalized, String message) {
    super(ErrorKind.STORAGE_CONFLICT, !finalized, message, null);
    this.key = key;
    this.finalized = finalized;
  }

  /**
   * Key the write targeted.
   *
   * @return store key
   */
  public String key() {
    return key;
  }

  /**
   * Whether the key already holds a finalized result.
   *
   * @return {@code true} when retrying cannot succeed
   */
  public boolean finalized() {
    return finalized;
  }
}
