package ca.gc.cra.prism.application.pipeline;

import java.time.Duration;
import java.util.Objects;

/**
 * Tuning for {@link PipelineOrchestrator}.
 *
 * @param workers size of the worker pool bounding concurrent jobs
 * @param stageMaxAttempts attempts allowed per stage for retryable errors, including the first
 * @param stageBaseDelay base backoff delay between stage attempts
 * @param stageMaxDelay cap on a single backoff delay between stage attempts
 * @param jobTtl how long terminal jobs stay queryable before lazy purge
 * @since PRISM 0.1
 */
public record OrchestratorSettings(
    int workers, int stageMaxAttempts, Duration stageBaseDelay, Duration stageMaxDelay, Duration jobTtl) {

  public OrchestratorSettings {
    if (workers < 1) {
      throw new IllegalArgumentException("workers must be >= 1 (was " + workers + ")");
    }
    if (stageMaxAttempts < 1) {
      throw new IllegalArgumentException("stageMaxAttempts must be >= 1 (was " + stageMaxAttempts + ")");
    }
    Objects.requireNonNull(stageBaseDelay, "stageBaseDelay");
    Objects.requireNonNull(stageMaxDelay, "stageMaxDelay");
    Objects.requireNonNull(jobTtl, "jobTtl");
    if (stageBaseDelay.isNegative() || stageMaxDelay.isNegative() || jobTtl.isNegative()) {
      throw new IllegalArgumentException("durations must be non-negative");
    }
  }

  /**
   * Defaults: four workers, three attempts per stage, 500 ms base delay capped at 30 s, one-hour job TTL.
   *
   * @return default settings
   */
  public static OrchestratorSettings defaults() {
    return new OrchestratorSettings(4, 3, Duration.ofMillis(500), Duration.ofSeconds(30), Duration.ofHours(1));
  }
}
