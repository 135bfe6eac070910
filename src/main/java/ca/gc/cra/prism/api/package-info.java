/**
 * CLI entry points that run PRISM aggregation, analysis jobs and result inspection.
 * <p><strong>Role:</strong> Adapter layer on the driving side; parses arguments, configures logging, and invokes
 * the pipeline through {@link ca.gc.cra.prism.config.CompositionRoot}.</p>
 * <p><strong>Concurrency:</strong> CLI commands run single-threaded; jobs execute on the composition root's
 * worker pool.</p>
 * <p><strong>Output:</strong> Results are printed as JSON on stdout; diagnostics go to the log.</p>
 */
package ca.gc.cra.prism.api;
