package ca.gc.cra.prism.domain.error;

/**
 * Classification of pipeline failures.
 *
 * @since PRISM 0.1
 */
public enum ErrorKind {
  /** Network or 5xx failure talking to the upstream data source. */
  TRANSIENT_FETCH,
  /** Upstream retries were exhausted. */
  FETCH_EXHAUSTED,
  /** Requested range holds no data. */
  NOT_FOUND,
  /** A scaled value does not fit in a signed 64-bit integer. */
  ENCODING_OVERFLOW,
  /** The computation did not finish within the poll budget. */
  COMPUTATION_TIMEOUT,
  /** The computation service refused the submission. */
  COMPUTATION_REJECTED,
  /** The computation service was temporarily unreachable. */
  COMPUTATION_UNAVAILABLE,
  /** A result already exists for the key, or a concurrent write raced this one. */
  STORAGE_CONFLICT,
  /** A vector's shape disagrees with its metadata. */
  DECODE_MISMATCH
}
