package ca.gc.cra.prism.application.pipeline;

import ca.gc.cra.prism.application.json.JsonSupport;
import ca.gc.cra.prism.application.json.JsonViews;
import ca.gc.cra.prism.application.port.ClockPort;
import ca.gc.cra.prism.application.port.ComputationGateway;
import ca.gc.cra.prism.application.port.MetricsPort;
import ca.gc.cra.prism.application.port.Sleeper;
import ca.gc.cra.prism.application.port.SourceClient;
import ca.gc.cra.prism.application.port.SummaryGenerator;
import ca.gc.cra.prism.application.store.ResultStore;
import ca.gc.cra.prism.domain.aggregate.AggregateRecord;
import ca.gc.cra.prism.domain.error.PipelineException;
import ca.gc.cra.prism.domain.job.JobParams;
import ca.gc.cra.prism.domain.job.PipelineJob;
import ca.gc.cra.prism.domain.job.PipelineStage;
import ca.gc.cra.prism.domain.store.Provenance;
import ca.gc.cra.prism.domain.store.StoredResult;
import ca.gc.cra.prism.domain.summary.Summary;
import ca.gc.cra.prism.domain.vector.EncodedVector;
import java.io.IOException;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Random;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.UnaryOperator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * <strong>What:</strong> Per-key state machine driving a job through ingest, encode, submit, compute, decode,
 * store and summarize.
 * <p><strong>Why:</strong> Callers start work by key and poll its status; the orchestrator absorbs retryable
 * failures inside each stage's budget and records terminal ones on the job.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>{@link #start(String, JobParams)} is idempotent: running or summarized jobs are returned unchanged, and a
 *   failed job resumes at the stage that failed, keeping earlier stage output.</li>
 *   <li>{@link #getStatus(String)} returns an immutable snapshot and never blocks on a running job.</li>
 *   <li>A new job whose key already holds a stored vector result skips to the summary stage.</li>
 *   <li>Terminal jobs are purged lazily once older than {@link OrchestratorSettings#jobTtl()}.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Jobs live in a concurrent registry; each key has its own lock guarding the
 * running flag and snapshot replacement, so at most one execution per key is in flight and no global lock is
 * taken. Stage output belongs to the single running execution.</p>
 * <p><strong>Performance:</strong> Concurrency is bounded by the injected worker executor; blocking calls to the
 * source and gateway happen on those workers.</p>
 * <p><strong>Observability:</strong> Puts {@code jobKey} in the SLF4J MDC while a job runs; emits
 * {@code pipeline.job.*}, {@code pipeline.stage.*} and {@code pipeline.stage.latencyMillis}.</p>
 *
 * @since PRISM 0.1
 */
public final class PipelineOrchestrator {
  private static final Logger log = LoggerFactory.getLogger(PipelineOrchestrator.class);
  static final String MDC_JOB_KEY = "jobKey";

  /** Suffix of the key the summary is stored under. */
  public static final String SUMMARY_SUFFIX = "#summary";

  /** Content type of stored computation results. */
  public static final String VECTOR_CONTENT_TYPE = "application/vnd.prism.vector+json";

  private final Collaborators deps;
  private final OrchestratorSettings settings;
  private final Executor workers;
  private final Backoff stageBackoff;
  private final JsonSupport json = new JsonSupport();
  private final ConcurrentMap<String, JobSlot> jobs = new ConcurrentHashMap<>();

  /**
   * Creates an orchestrator.
   *
   * @param deps pipeline collaborators
   * @param settings tuning
   * @param workers executor running job bodies; its size bounds concurrent jobs
   * @param random jitter source for stage backoff
   */
  public PipelineOrchestrator(
      Collaborators deps, OrchestratorSettings settings, Executor workers, Random random) {
    this.deps = Objects.requireNonNull(deps, "deps");
    this.settings = Objects.requireNonNull(settings, "settings");
    this.workers = Objects.requireNonNull(workers, "workers");
    this.stageBackoff = new Backoff(
        settings.stageBaseDelay(), settings.stageMaxDelay(), settings.stageMaxAttempts(), random);
  }

  /**
   * Starts a job under a content-derived key.
   *
   * @param params job inputs
   * @return current snapshot
   */
  public PipelineJob start(JobParams params) {
    Objects.requireNonNull(params, "params");
    return start(params.contentKey(deps.source().sourceId()), params);
  }

  /**
   * Starts the job for {@code jobKey}, or returns the existing one.
   *
   * <p>Pipeline failures never surface here; they are visible only through {@link #getStatus(String)}.</p>
   *
   * @param jobKey caller-supplied key; must not be blank
   * @param params job inputs; ignored when the key already exists
   * @return current snapshot
   * @throws IllegalStateException if the worker executor no longer accepts work
   */
  public PipelineJob start(String jobKey, JobParams params) {
    Objects.requireNonNull(jobKey, "jobKey");
    Objects.requireNonNull(params, "params");
    if (jobKey.isBlank()) {
      throw new IllegalArgumentException("jobKey must not be blank");
    }
    purgeExpiredJobs();
    while (true) {
      JobSlot slot = jobs.computeIfAbsent(jobKey, key -> new JobSlot(PipelineJob.pending(key, params, now())));
      slot.lock.lock();
      try {
        if (jobs.get(jobKey) != slot) {
          continue;
        }
        PipelineJob current = slot.snapshot;
        if (slot.running || current.stage() == PipelineStage.SUMMARIZED) {
          return current;
        }
        if (!current.params().equals(params)) {
          log.warn("Job {} already exists with {}; ignoring new parameters {}", jobKey, current.params(), params);
        }
        if (current.stage() == PipelineStage.FAILED) {
          log.info("Restarting job {} at stage {}", jobKey, current.failedStage().orElse(PipelineStage.PENDING));
          slot.snapshot = current.restarted(now());
        }
        slot.running = true;
        try {
          workers.execute(() -> execute(slot));
        } catch (RejectedExecutionException ex) {
          slot.running = false;
          slot.snapshot = current;
          throw new IllegalStateException("pipeline workers are not accepting jobs", ex);
        }
        metrics().increment("pipeline.job.started");
        return slot.snapshot;
      } finally {
        slot.lock.unlock();
      }
    }
  }

  /**
   * Returns the latest snapshot for {@code jobKey}.
   *
   * @param jobKey job key
   * @return snapshot, or empty if the key is unknown or purged
   */
  public Optional<PipelineJob> getStatus(String jobKey) {
    JobSlot slot = jobs.get(Objects.requireNonNull(jobKey, "jobKey"));
    return slot == null ? Optional.empty() : Optional.of(slot.snapshot);
  }

  /**
   * Removes terminal jobs whose last transition is older than the job TTL.
   *
   * @return number of jobs removed
   */
  public int purgeExpiredJobs() {
    Instant cutoff = now().minus(settings.jobTtl());
    int removed = 0;
    for (Map.Entry<String, JobSlot> entry : jobs.entrySet()) {
      JobSlot slot = entry.getValue();
      if (!slot.lock.tryLock()) {
        continue;
      }
      try {
        PipelineJob job = slot.snapshot;
        if (!slot.running && job.terminal() && job.updatedAt().isBefore(cutoff)
            && jobs.remove(entry.getKey(), slot)) {
          removed++;
        }
      } finally {
        slot.lock.unlock();
      }
    }
    if (removed > 0) {
      log.debug("Purged {} expired jobs", removed);
    }
    return removed;
  }

  private void execute(JobSlot slot) {
    String jobKey = slot.snapshot.jobKey();
    String previousJobKey = MDC.get(MDC_JOB_KEY);
    MDC.put(MDC_JOB_KEY, jobKey);
    PipelineJob current = slot.snapshot;
    try {
      log.info("Job {} running from stage {}", jobKey, current.stage());
      if (current.stage() == PipelineStage.PENDING) {
        current = adoptStoredResult(slot).orElse(current);
      }
      while (!current.terminal()) {
        current = runStage(slot, current.stage().next());
      }
      if (current.stage() == PipelineStage.SUMMARIZED) {
        metrics().increment("pipeline.job.completed");
        log.info("Job {} completed; result {}", jobKey, current.resultRef().orElse("-"));
      } else {
        metrics().increment("pipeline.job.failed");
        log.warn("Job {} failed during {}: {}", jobKey,
            current.failedStage().map(Enum::name).orElse("?"), current.lastError().orElse("-"));
      }
    } finally {
      if (!current.terminal()) {
        // Left without a terminal transition, which is the only other place the flag is cleared.
        slot.lock.lock();
        try {
          slot.running = false;
        } finally {
          slot.lock.unlock();
        }
      }
      if (previousJobKey == null) {
        MDC.remove(MDC_JOB_KEY);
      } else {
        MDC.put(MDC_JOB_KEY, previousJobKey);
      }
    }
  }

  /**
   * Picks up a vector result an earlier process already stored under the job key, so a repeated run over the
   * same range goes straight to the summary instead of recomputing. Anything unreadable falls back to a full
   * run.
   */
  private Optional<PipelineJob> adoptStoredResult(JobSlot slot) {
    String jobKey = slot.snapshot.jobKey();
    try {
      StoredResult stored = deps.store().find(jobKey).orElse(null);
      if (stored == null || !VECTOR_CONTENT_TYPE.equals(stored.metadata().get(StoredResult.CONTENT_TYPE))) {
        return Optional.empty();
      }
      JobWork work = slot.work;
      work.resultBlob = stored.payload();
      work.resultVector = deps.gateway().decodeResult(work.resultBlob);
      work.decoded = deps.codec().decode(work.resultVector);
      work.reused = true;
      metrics().increment("pipeline.job.reused");
      log.info("Job {} reuses stored result {}", jobKey, stored.referenceId());
      return Optional.of(transition(
          slot, job -> job.advancedTo(PipelineStage.STORED, now()).withResultRef(stored.referenceId(), now())));
    } catch (PipelineException ex) {
      log.warn("Job {} cannot reuse stored result: {}", jobKey, ex.describe());
    } catch (IOException ex) {
      log.warn("Job {} cannot read stored result: {}", jobKey, ex.getMessage());
    }
    return Optional.empty();
  }

  private PipelineJob runStage(JobSlot slot, PipelineStage target) {
    int attempt = 0;
    while (true) {
      long startedAt = deps.clock().nowMillis();
      String error;
      boolean retryable;
      try {
        perform(slot, target);
        metrics().observe("pipeline.stage.latencyMillis", deps.clock().nowMillis() - startedAt);
        metrics().increment("pipeline.stage." + target.name().toLowerCase(Locale.ROOT));
        log.debug("Job {} reached {}", slot.snapshot.jobKey(), target);
        return transition(slot, job -> job.advancedTo(target, now()));
      } catch (PipelineException ex) {
        error = ex.describe();
        retryable = ex.retryable();
      } catch (IOException ex) {
        error = "IO: " + ex.getMessage();
        retryable = true;
      } catch (InterruptedException ex) {
        Thread.currentThread().interrupt();
        return fail(slot, target, "INTERRUPTED: stage " + target + " was interrupted");
      } catch (RuntimeException ex) {
        log.error("Job {} stage {} failed unexpectedly", slot.snapshot.jobKey(), target, ex);
        return fail(slot, target, "UNEXPECTED: " + ex.getClass().getSimpleName() + ": " + ex.getMessage());
      }

      if (!retryable || !stageBackoff.canRetry(attempt + 1)) {
        return fail(slot, target, error);
      }
      final String retryError = error;
      transition(slot, job -> job.retrying(retryError, now()));
      metrics().increment("pipeline.stage.retry");
      log.warn("Job {} stage {} attempt {} failed, retrying: {}", slot.snapshot.jobKey(), target, attempt + 1, error);
      try {
        deps.sleeper().sleep(stageBackoff.delayFor(attempt));
      } catch (InterruptedException ex) {
        Thread.currentThread().interrupt();
        return fail(slot, target, "INTERRUPTED: stage " + target + " was interrupted");
      }
      attempt++;
    }
  }

  private void perform(JobSlot slot, PipelineStage stage)
      throws PipelineException, IOException, InterruptedException {
    JobWork work = slot.work;
    JobParams params = slot.snapshot.params();
    switch (stage) {
      case INGESTED -> work.aggregate = deps.aggregator().ingest(deps.source(), params.range(), params.window());
      case ENCODED -> {
        work.vector = deps.codec().encode(work.aggregate);
        work.idempotencyKey = VectorCodec.contentHash(work.vector);
      }
      case SUBMITTED -> {
        work.token = deps.gateway().submit(work.vector, work.idempotencyKey);
        work.submittedAt = now();
      }
      case COMPUTED -> {
        work.resultBlob = deps.poller().await(work.token);
        work.resultVector = deps.gateway().decodeResult(work.resultBlob);
      }
      case DECODED -> work.decoded = deps.codec().decode(work.resultVector);
      case STORED -> storeResult(slot, work, params);
      case SUMMARIZED -> storeSummary(slot, work, params);
      default -> throw new IllegalStateException("stage " + stage + " has no work");
    }
  }

  private void storeResult(JobSlot slot, JobWork work, JobParams params) throws PipelineException, IOException {
    String key = slot.snapshot.jobKey();
    Map<String, String> metadata = new LinkedHashMap<>();
    metadata.put(StoredResult.CONTENT_TYPE, VECTOR_CONTENT_TYPE);
    metadata.put(StoredResult.WINDOW, params.window().label());
    metadata.put("txCount", Long.toString(work.decoded.txCount()));
    metadata.put("shieldedRatio", Double.toString(work.decoded.shieldedRatio()));
    metadata.put("scalingFactor", Long.toString(work.resultVector.metadata().scalingFactor()));
    StoredResult result = deps.store().newResult(key, work.resultBlob, metadata, provenance(work, params));
    deps.store().put(key, result);
    transition(slot, job -> job.withResultRef(result.referenceId(), now()));
  }

  private void storeSummary(JobSlot slot, JobWork work, JobParams params) throws PipelineException, IOException {
    String key = slot.snapshot.jobKey() + SUMMARY_SUFFIX;
    if (work.reused && deps.store().find(key).isPresent()) {
      log.debug("Summary {} already stored", key);
      return;
    }
    Summary summary = deps.summaries().summarize(work.decoded);
    Map<String, String> metadata = new LinkedHashMap<>();
    metadata.put(StoredResult.CONTENT_TYPE, "application/json");
    metadata.put(StoredResult.WINDOW, params.window().label());
    slot.snapshot.resultRef().ifPresent(ref -> metadata.put("resultRef", ref));
    byte[] payload = json.write(JsonViews.summary(summary));
    deps.store().put(key, deps.store().newResult(key, payload, metadata, provenance(work, params)));
  }

  private Provenance provenance(JobWork work, JobParams params) {
    Instant submittedAt = work.submittedAt != null ? work.submittedAt : now();
    return new Provenance(deps.source().sourceId(), params.range(), submittedAt);
  }

  private PipelineJob fail(JobSlot slot, PipelineStage during, String error) {
    return transition(slot, job -> job.failed(during, error, now()));
  }

  /**
   * Replaces the snapshot under the slot lock. A terminal snapshot releases the slot in the same critical
   * section, so a caller that observes it through {@link #getStatus(String)} can restart the job at once.
   */
  private PipelineJob transition(JobSlot slot, UnaryOperator<PipelineJob> change) {
    slot.lock.lock();
    try {
      PipelineJob next = change.apply(slot.snapshot);
      slot.snapshot = next;
      if (next.terminal()) {
        slot.running = false;
      }
      return next;
    } finally {
      slot.lock.unlock();
    }
  }

  private Instant now() {
    return deps.clock().now();
  }

  private MetricsPort metrics() {
    return deps.metrics();
  }

  /**
   * Everything the orchestrator calls out to.
   *
   * @param source upstream transaction source
   * @param aggregator aggregator
   * @param codec vector codec with deployment defaults
   * @param gateway computation gateway
   * @param poller poller bound to {@code gateway}
   * @param store result store
   * @param summaries summary generator
   * @param clock time source
   * @param sleeper pause between stage retries
   * @param metrics metrics sink
   */
  public record Collaborators(
      SourceClient source,
      Aggregator aggregator,
      VectorCodec codec,
      ComputationGateway gateway,
      ComputationPoller poller,
      ResultStore store,
      SummaryGenerator summaries,
      ClockPort clock,
      Sleeper sleeper,
      MetricsPort metrics) {

    public Collaborators {
      Objects.requireNonNull(source, "source");
      Objects.requireNonNull(aggregator, "aggregator");
      Objects.requireNonNull(codec, "codec");
      Objects.requireNonNull(gateway, "gateway");
      Objects.requireNonNull(poller, "poller");
      Objects.requireNonNull(store, "store");
      Objects.requireNonNull(summaries, "summaries");
      Objects.requireNonNull(clock, "clock");
      Objects.requireNonNull(sleeper, "sleeper");
      Objects.requireNonNull(metrics, "metrics");
    }
  }

  private static final class JobSlot {
    final ReentrantLock lock = new ReentrantLock();
    final JobWork work = new JobWork();
    volatile PipelineJob snapshot;
    boolean running;

    JobSlot(PipelineJob initial) {
      this.snapshot = initial;
    }
  }

  // Output of completed stages, kept so a restarted job resumes without redoing them.
  private static final class JobWork {
    AggregateRecord aggregate;
    EncodedVector vector;
    String idempotencyKey;
    String token;
    Instant submittedAt;
    byte[] resultBlob;
    EncodedVector resultVector;
    AggregateRecord decoded;
    boolean reused;
  }
}
