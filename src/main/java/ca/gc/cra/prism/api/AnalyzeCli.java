package ca.gc.cra.prism.api;

import ca.gc.cra.prism.application.json.JsonSupport;
import ca.gc.cra.prism.application.json.JsonViews;
import ca.gc.cra.prism.application.pipeline.PipelineOrchestrator;
import ca.gc.cra.prism.application.port.ClockPort;
import ca.gc.cra.prism.application.port.Sleeper;
import ca.gc.cra.prism.config.CompositionRoot;
import ca.gc.cra.prism.config.DefaultsForMode;
import ca.gc.cra.prism.domain.chain.AggregateWindow;
import ca.gc.cra.prism.domain.chain.BlockRange;
import ca.gc.cra.prism.domain.job.JobParams;
import ca.gc.cra.prism.domain.job.PipelineJob;
import ca.gc.cra.prism.domain.job.PipelineStage;
import ca.gc.cra.prism.domain.store.StoredResult;
import ca.gc.cra.prism.logging.LoggingConfigurator;
import ca.gc.cra.prism.validation.Durations;
import java.io.IOException;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs one analysis job end to end: starts it, polls its status until terminal, then prints the job and the
 * stored summary.
 *
 * @since PRISM 0.1
 */
public final class AnalyzeCli {
  private static final Logger log = LoggerFactory.getLogger(AnalyzeCli.class);
  private static final String SUMMARY_USAGE =
      "usage: analyze range=START-END [window=hour|day|week] [jobKey=KEY] [pollInterval=DUR] "
          + "[waitTimeout=DUR] [config=PATH] [key=value ...]";
  private static final String HELP_TEXT = """
      PRISM analysis job

      Usage:
        analyze range=START-END [options]

      Options:
        range=START-END            Inclusive block heights to fetch (required)
        window=hour|day|week       Reporting window (default day)
        jobKey=KEY                 Explicit job key; defaults to a hash of source, range and window
        pollInterval=DUR           Status poll interval (default 500ms)
        waitTimeout=DUR            Give up waiting after this long (default 10m)
        config=PATH                YAML file with common/analyze sections
        gateway.mode=LOCAL|REMOTE  Computation backend (default LOCAL simulator)
        gateway.endpoint=URL       Remote computation service, required for REMOTE
        store.mode=MEMORY|FILE     Result store backend (default FILE)
        store.directory=PATH       Result directory for FILE (default ~/.prism/results)
        --verbose                  Enable DEBUG logging
        --help                     Show this message

      Notes:
        Re-running with the same key resumes a failed job at the stage that failed.
        Results are stored under the job key; the summary under <jobKey>#summary.
      """;

  private AnalyzeCli() {}

  /**
   * Entry point invoked by the JVM.
   *
   * @param args raw CLI arguments
   */
  public static void main(String[] args) {
    ExitCode exit = run(args);
    System.exit(exit.code());
  }

  /**
   * Executes the analyze CLI and returns a normalized exit code.
   *
   * @param args raw CLI arguments
   * @return exit code describing the outcome
   */
  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for analyze CLI");
    }

    ConfigCliUtils.Resolved resolved;
    JobParams params;
    Duration pollInterval;
    Duration waitTimeout;
    try {
      resolved = ConfigCliUtils.resolve("analyze", CliArgsParser.toMap(input.keyValueArgs()));
      params = new JobParams(
          BlockRange.parse(resolved.get(DefaultsForMode.RANGE)),
          AggregateWindow.parse(resolved.get(DefaultsForMode.WINDOW)));
      pollInterval = Durations.parse(DefaultsForMode.POLL_INTERVAL, resolved.get(DefaultsForMode.POLL_INTERVAL));
      waitTimeout = Durations.parse(DefaultsForMode.WAIT_TIMEOUT, resolved.get(DefaultsForMode.WAIT_TIMEOUT));
    } catch (IllegalArgumentException ex) {
      log.error("Invalid analyze arguments: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    } catch (IOException ex) {
      log.error("Unable to read configuration", ex);
      return ExitCode.IO_ERROR;
    }

    try (CompositionRoot root = new CompositionRoot(resolved.config())) {
      return execute(root, resolved.get(DefaultsForMode.JOB_KEY), params, pollInterval, waitTimeout, Sleeper.SYSTEM);
    } catch (IOException ex) {
      log.error("Analysis I/O failure", ex);
      return ExitCode.IO_ERROR;
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      log.error("Analysis interrupted; shutting down", ex);
      return ExitCode.INTERRUPTED;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure in analyze CLI", ex);
      return ExitCode.RUNTIME_FAILURE;
    }
  }

  static ExitCode execute(
      CompositionRoot root,
      String jobKey,
      JobParams params,
      Duration pollInterval,
      Duration waitTimeout,
      Sleeper sleeper) throws IOException, InterruptedException {
    PipelineOrchestrator orchestrator = root.orchestrator();
    PipelineJob job = jobKey.isBlank() ? orchestrator.start(params) : orchestrator.start(jobKey, params);
    log.info("Job {} started at stage {}", job.jobKey(), job.stage());

    ClockPort clock = root.clock();
    long deadline = clock.nowMillis() + waitTimeout.toMillis();
    while (!job.terminal()) {
      if (clock.nowMillis() >= deadline) {
        log.error("Job {} still at stage {} after {}; giving up", job.jobKey(), job.stage(), waitTimeout);
        CliPrinter.printJson(Map.of("job", JsonViews.job(job)));
        return ExitCode.RUNTIME_FAILURE;
      }
      sleeper.sleep(pollInterval);
      String key = job.jobKey();
      job = orchestrator.getStatus(key)
          .orElseThrow(() -> new IllegalStateException("job " + key + " disappeared while running"));
    }

    Map<String, Object> output = new LinkedHashMap<>();
    output.put("job", JsonViews.job(job));
    if (job.stage() == PipelineStage.FAILED) {
      log.error("Job {} failed: {}", job.jobKey(), job.lastError().orElse("unknown error"));
      CliPrinter.printJson(output);
      return ExitCode.PIPELINE_FAILED;
    }

    Optional<StoredResult> result = root.resultStore().find(job.jobKey());
    result.ifPresent(stored -> output.put("result", JsonViews.resultSummary(stored.summary())));
    Optional<StoredResult> summary = root.resultStore().find(job.jobKey() + PipelineOrchestrator.SUMMARY_SUFFIX);
    summary.ifPresent(stored -> output.put("summary", new JsonSupport().parse(stored.payload())));
    CliPrinter.printJson(output);
    log.info("Job {} completed", job.jobKey());
    return ExitCode.SUCCESS;
  }
}
