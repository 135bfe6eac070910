/**
 * Application-level pipeline: aggregation, fixed-point encoding, computation polling, and the per-key job
 * orchestrator that sequences them.
 * <p>{@link ca.gc.cra.prism.application.pipeline.PipelineOrchestrator} owns all job state. Stage work runs on an
 * ExecutorService-backed worker pool whose threads follow the {@code prism-worker-*} naming convention, and
 * computation polls are scheduled on a separate single-threaded scheduler.</p>
 * <p>Aggregator and codec are stateless apart from their configuration and are safe to share across jobs.</p>
 *
 * @since PRISM 0.1
 */
package ca.gc.cra.prism.application.pipeline;
