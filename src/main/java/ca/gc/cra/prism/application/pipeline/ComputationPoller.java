package ca.gc.cra.prism.application.pipeline;

import ca.gc.cra.prism.application.port.ComputationGateway;
import ca.gc.cra.prism.application.port.ComputationGateway.PollResult;
import ca.gc.cra.prism.application.port.MetricsPort;
import ca.gc.cra.prism.domain.error.ComputationRejectedException;
import ca.gc.cra.prism.domain.error.ComputationTimeoutException;
import ca.gc.cra.prism.domain.error.PipelineException;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Polls a submitted computation until it finishes.
 * <p><strong>Threads:</strong> {@link #await(String)} calls the gateway on the calling worker and uses the
 * scheduler only to time the gap between polls, so a slow remote poll holds up its own job and no other.
 * {@link #poll(String)} runs each poll as a task on the scheduler; the next one is scheduled only after the
 * previous completes, so there is at most one outstanding poll per token and cancelling the returned future
 * cancels the pending task.</p>
 * <p><strong>Bounds:</strong> At most {@link Backoff#maxAttempts()} polls, spaced by the backoff policy. Exhausting
 * the budget ends with {@link ComputationTimeoutException}.</p>
 * <p><strong>Errors:</strong> A {@code FAILED} status ends with {@link ComputationRejectedException}. Retryable
 * gateway errors use up a poll; non-retryable ones end polling immediately.</p>
 *
 * @since PRISM 0.1
 */
public final class ComputationPoller {
  private static final Logger log = LoggerFactory.getLogger(ComputationPoller.class);

  private final ComputationGateway gateway;
  private final ScheduledExecutorService scheduler;
  private final Backoff backoff;
  private final MetricsPort metrics;

  /**
   * Creates a poller.
   *
   * @param gateway computation gateway
   * @param scheduler scheduler timing polls; owned by the caller
   * @param backoff poll spacing and attempt bound
   * @param metrics metrics sink
   */
  public ComputationPoller(
      ComputationGateway gateway, ScheduledExecutorService scheduler, Backoff backoff, MetricsPort metrics) {
    this.gateway = Objects.requireNonNull(gateway, "gateway");
    this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
    this.backoff = Objects.requireNonNull(backoff, "backoff");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Starts polling {@code token} on the scheduler. The first poll runs immediately.
   *
   * @param token computation token
   * @return future completed with the result blob, or exceptionally with a {@link PipelineException}
   */
  public CompletableFuture<byte[]> poll(String token) {
    Objects.requireNonNull(token, "token");
    CompletableFuture<byte[]> result = new CompletableFuture<>();
    AtomicReference<ScheduledFuture<?>> pending = new AtomicReference<>();
    result.whenComplete((blob, error) -> {
      ScheduledFuture<?> task = pending.get();
      if (task != null && result.isCancelled()) {
        task.cancel(false);
      }
    });
    schedule(token, 0, Duration.ZERO, result, pending);
    return result;
  }

  /**
   * Polls {@code token} from the calling thread until the computation finishes.
   *
   * @param token computation token
   * @return result blob
   * @throws PipelineException on timeout, rejection or a non-retryable gateway error
   * @throws InterruptedException if the worker is interrupted while waiting between polls
   */
  public byte[] await(String token) throws PipelineException, InterruptedException {
    Objects.requireNonNull(token, "token");
    for (int attempt = 0; ; attempt++) {
      if (attempt > 0) {
        pause(backoff.delayFor(attempt - 1));
      }
      Optional<byte[]> blob = pollOnce(token, attempt);
      if (blob.isPresent()) {
        return blob.get();
      }
      int made = attempt + 1;
      if (!backoff.canRetry(made)) {
        throw timedOut(token, made);
      }
    }
  }

  private void pause(Duration delay) throws InterruptedException {
    if (delay.isZero() || delay.isNegative()) {
      return;
    }
    ScheduledFuture<?> tick = scheduler.schedule(() -> { }, delay.toMillis(), TimeUnit.MILLISECONDS);
    try {
      tick.get();
    } catch (InterruptedException ex) {
      tick.cancel(false);
      throw ex;
    } catch (ExecutionException ex) {
      throw new IllegalStateException("poll timer failed", ex.getCause());
    }
  }

  /**
   * Makes one gateway poll.
   *
   * @return the result blob once done; empty while pending or after a retryable gateway error
   */
  private Optional<byte[]> pollOnce(String token, int attempt) throws PipelineException {
    metrics.increment("compute.poll.attempt");
    try {
      PollResult poll = gateway.poll(token);
      switch (poll.status()) {
        case DONE -> {
          return Optional.of(poll.resultBlob().orElseThrow());
        }
        case FAILED -> throw new ComputationRejectedException(
            "computation " + token + " failed: " + poll.reason().orElse("no reason given"));
        case PENDING -> log.debug("Computation {} pending after poll {}", token, attempt + 1);
      }
    } catch (PipelineException ex) {
      if (!ex.retryable()) {
        throw ex;
      }
      log.warn("Poll {} for computation {} failed: {}", attempt + 1, token, ex.getMessage());
    }
    return Optional.empty();
  }

  private static ComputationTimeoutException timedOut(String token, int polls) {
    return new ComputationTimeoutException("computation " + token + " not done after " + polls + " polls");
  }

  private void schedule(
      String token,
      int attempt,
      Duration delay,
      CompletableFuture<byte[]> result,
      AtomicReference<ScheduledFuture<?>> pending) {
    if (result.isDone()) {
      return;
    }
    try {
      pending.set(scheduler.schedule(
          () -> attempt(token, attempt, result, pending), delay.toMillis(), TimeUnit.MILLISECONDS));
    } catch (RejectedExecutionException ex) {
      result.completeExceptionally(ex);
    }
  }

  private void attempt(
      String token,
      int attempt,
      CompletableFuture<byte[]> result,
      AtomicReference<ScheduledFuture<?>> pending) {
    if (result.isDone()) {
      return;
    }
    try {
      Optional<byte[]> blob = pollOnce(token, attempt);
      if (blob.isPresent()) {
        result.complete(blob.get());
        return;
      }
    } catch (PipelineException | RuntimeException ex) {
      result.completeExceptionally(ex);
      return;
    }
    int made = attempt + 1;
    if (!backoff.canRetry(made)) {
      result.completeExceptionally(timedOut(token, made));
      return;
    }
    schedule(token, made, backoff.delayFor(attempt), result, pending);
  }
}
