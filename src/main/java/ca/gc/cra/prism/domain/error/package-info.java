/**
 * Checked error taxonomy raised by pipeline collaborators.
 * <p><strong>Role:</strong> Each exception carries an {@link ca.gc.cra.prism.domain.error.ErrorKind} and a
 * retryable flag; the orchestrator retries the retryable ones within a stage budget and records the rest on
 * the job.</p>
 */
package ca.gc.cra.prism.domain.error;
