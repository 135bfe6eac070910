package ca.gc.cra.prism.domain.job;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable snapshot of a pipeline job.
 *
 * <p>The orchestrator replaces the snapshot on every transition, so a reader always sees a consistent view.</p>
 *
 * @param jobKey caller-supplied or content-derived key
 * @param params job inputs
 * @param stage last completed stage, or {@link PipelineStage#FAILED}
 * @param failedStage stage that was executing when the job failed; empty unless failed
 * @param attempts failed attempts recorded so far for the current stage
 * @param lastError last error description; empty when no error occurred
 * @param resultRef reference id of the stored result once {@link PipelineStage#STORED} is reached
 * @param createdAt creation time
 * @param updatedAt time of the latest transition
 * @since PRISM 0.1
 */
public record PipelineJob(
    String jobKey,
    JobParams params,
    PipelineStage stage,
    Optional<PipelineStage> failedStage,
    int attempts,
    Optional<String> lastError,
    Optional<String> resultRef,
    Instant createdAt,
    Instant updatedAt) {

  public PipelineJob {
    Objects.requireNonNull(jobKey, "jobKey");
    Objects.requireNonNull(params, "params");
    Objects.requireNonNull(stage, "stage");
    Objects.requireNonNull(failedStage, "failedStage");
    Objects.requireNonNull(lastError, "lastError");
    Objects.requireNonNull(resultRef, "resultRef");
    Objects.requireNonNull(createdAt, "createdAt");
    Objects.requireNonNull(updatedAt, "updatedAt");
    if (attempts < 0) {
      throw new IllegalArgumentException("attempts must be non-negative");
    }
  }

  /**
   * Creates a job that has not started any stage yet.
   *
   * @param jobKey job key
   * @param params job inputs
   * @param now creation time
   * @return pending job
   */
  public static PipelineJob pending(String jobKey, JobParams params, Instant now) {
    return new PipelineJob(
        jobKey, params, PipelineStage.PENDING, Optional.empty(), 0, Optional.empty(), Optional.empty(), now, now);
  }

  /**
   * Records completion of {@code completed}; clears the per-stage attempt counter.
   *
   * @param completed stage that just finished
   * @param now transition time
   * @return updated snapshot
   */
  public PipelineJob advancedTo(PipelineStage completed, Instant now) {
    return new PipelineJob(
        jobKey, params, completed, Optional.empty(), 0, lastError, resultRef, createdAt, now);
  }

  /**
   * Records a failed attempt that will be retried.
   *
   * @param error error description
   * @param now transition time
   * @return updated snapshot with the attempt counter incremented
   */
  public PipelineJob retrying(String error, Instant now) {
    return new PipelineJob(
        jobKey, params, stage, failedStage, attempts + 1, Optional.of(error), resultRef, createdAt, now);
  }

  /**
   * Moves the job to {@link PipelineStage#FAILED}.
   *
   * @param during stage that was executing
   * @param error error description
   * @param now transition time
   * @return failed snapshot with the attempt counter incremented
   */
  public PipelineJob failed(PipelineStage during, String error, Instant now) {
    return new PipelineJob(
        jobKey, params, PipelineStage.FAILED, Optional.of(during), attempts + 1, Optional.of(error),
        resultRef, createdAt, now);
  }

  /**
   * Prepares a failed job for an explicit restart from the stage that failed.
   *
   * @param now restart time
   * @return snapshot positioned just before the failed stage, attempts reset
   */
  public PipelineJob restarted(Instant now) {
    if (stage != PipelineStage.FAILED) {
      return this;
    }
    PipelineStage resumeAfter = failedStage.map(PipelineJob::predecessor).orElse(PipelineStage.PENDING);
    return new PipelineJob(
        jobKey, params, resumeAfter, Optional.empty(), 0, lastError, resultRef, createdAt, now);
  }

  /**
   * Attaches the stored result reference.
   *
   * @param referenceId reference id returned by the result store
   * @param now transition time
   * @return updated snapshot
   */
  public PipelineJob withResultRef(String referenceId, Instant now) {
    return new PipelineJob(
        jobKey, params, stage, failedStage, attempts, lastError, Optional.of(referenceId), createdAt, now);
  }

  /**
   * Whether the job reached a terminal stage.
   *
   * @return {@code true} for succeeded or failed jobs
   */
  public boolean terminal() {
    return stage.terminal();
  }

  private static PipelineStage predecessor(PipelineStage running) {
    PipelineStage previous = PipelineStage.PENDING;
    for (PipelineStage candidate : PipelineStage.values()) {
      if (candidate == running) {
        return previous;
      }
      previous = candidate;
    }
    return PipelineStage.PENDING;
  }
}
