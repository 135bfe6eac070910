/**
 * Pipeline jobs and their stage machine.
 * <p><strong>Concurrency:</strong> {@link ca.gc.cra.prism.domain.job.PipelineJob} is an immutable snapshot; state
 * changes produce new instances.</p>
 */
package ca.gc.cra.prism.domain.job;
