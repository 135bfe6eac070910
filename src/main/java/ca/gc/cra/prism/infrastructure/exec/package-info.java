/**
 * Executor factories for the job worker pool and the computation poll scheduler.
 * <p>Threads are named {@code <prefix>-<n>} so log lines identify the pool.</p>
 */
package ca.gc.cra.prism.infrastructure.exec;
