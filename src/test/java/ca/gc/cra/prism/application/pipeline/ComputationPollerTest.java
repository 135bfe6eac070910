package ca.gc.cra.prism.application.pipeline;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTimeoutPreemptively;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.prism.application.port.ComputationGateway;
import ca.gc.cra.prism.application.port.ComputationGateway.PollResult;
import ca.gc.cra.prism.domain.error.ComputationRejectedException;
import ca.gc.cra.prism.domain.error.ComputationTimeoutException;
import ca.gc.cra.prism.domain.error.ComputationUnavailableException;
import ca.gc.cra.prism.domain.error.PipelineException;
import ca.gc.cra.prism.domain.vector.EncodedVector;
import ca.gc.cra.prism.testing.RecordingMetricsPort;
import ca.gc.cra.prism.testing.ScriptedGateway;
import java.time.Duration;
import java.util.Random;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.ScheduledExecutorService;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ComputationPollerTest {
  private static final byte[] BLOB = {1, 2, 3};

  private ScheduledExecutorService scheduler;
  private ScriptedGateway gateway;
  private RecordingMetricsPort metrics;

  @BeforeEach
  void setUp() {
    scheduler = Executors.newSingleThreadScheduledExecutor();
    gateway = new ScriptedGateway();
    metrics = new RecordingMetricsPort();
  }

  @AfterEach
  void tearDown() {
    scheduler.shutdownNow();
  }

  @Test
  void pollsUntilDone() throws Exception {
    gateway.then(PollResult.pending()).then(PollResult.pending()).then(PollResult.done(BLOB));

    byte[] result = poller(5).await("tok-1");

    assertArrayEquals(BLOB, result);
    assertEquals(3, gateway.pollCount());
    assertEquals(3, metrics.count("compute.poll.attempt"));
  }

  @Test
  void timesOutAfterMaxPolls() {
    ComputationTimeoutException error = assertThrows(ComputationTimeoutException.class,
        () -> poller(3).await("tok-1"));

    assertEquals(3, gateway.pollCount());
    assertTrue(error.getMessage().contains("3 polls"));
  }

  @Test
  void remoteFailureEndsPolling() {
    gateway.then(PollResult.failed("bad vector"));

    ComputationRejectedException error = assertThrows(ComputationRejectedException.class,
        () -> poller(5).await("tok-1"));

    assertTrue(error.getMessage().contains("bad vector"));
    assertEquals(1, gateway.pollCount());
  }

  @Test
  void transientPollErrorsAreRetried() throws Exception {
    gateway.thenThrow(new ComputationUnavailableException("503")).then(PollResult.done(BLOB));

    assertArrayEquals(BLOB, poller(5).await("tok-1"));
    assertEquals(2, gateway.pollCount());
  }

  @Test
  void permanentPollErrorsAreNotRetried() {
    gateway.thenThrow(new ComputationRejectedException("unknown token"));

    assertThrows(ComputationRejectedException.class, () -> poller(5).await("tok-1"));
    assertEquals(1, gateway.pollCount());
  }

  @Test
  void cancellingStopsFurtherPolls() throws Exception {
    ComputationPoller slow = new ComputationPoller(
        gateway, scheduler, new Backoff(Duration.ofSeconds(10), Duration.ofSeconds(10), 5, new Random(1)), metrics);

    CompletableFuture<byte[]> future = slow.poll("tok-1");
    while (gateway.pollCount() == 0) {
      Thread.onSpinWait();
    }
    future.cancel(false);

    assertTrue(future.isCancelled());
    assertEquals(1, gateway.pollCount());
  }

  @Test
  void slowPollDoesNotHoldUpOtherComputations() throws Exception {
    BlockingGateway blocking = new BlockingGateway("tok-slow");
    ComputationPoller shared = new ComputationPoller(
        blocking, scheduler, new Backoff(Duration.ZERO, Duration.ZERO, 3, new Random(1)), metrics);
    ExecutorService worker = Executors.newSingleThreadExecutor();
    try {
      Future<byte[]> slow = worker.submit(() -> shared.await("tok-slow"));
      assertTrue(blocking.entered.await(5, TimeUnit.SECONDS));

      byte[] fast = assertTimeoutPreemptively(Duration.ofSeconds(5), () -> shared.await("tok-fast"));

      assertArrayEquals(BLOB, fast);
      assertFalse(slow.isDone());
      blocking.release.countDown();
      assertArrayEquals(BLOB, slow.get(5, TimeUnit.SECONDS));
    } finally {
      blocking.release.countDown();
      worker.shutdownNow();
    }
  }

  @Test
  void awaitWaitsOutBackoffBetweenPolls() throws Exception {
    gateway.then(PollResult.pending()).then(PollResult.done(BLOB));
    ComputationPoller spaced = new ComputationPoller(
        gateway, scheduler, new Backoff(Duration.ofMillis(20), Duration.ofMillis(20), 3, new Random(1)), metrics);

    long started = System.nanoTime();
    byte[] result = spaced.await("tok-1");

    assertArrayEquals(BLOB, result);
    assertTrue(System.nanoTime() - started >= TimeUnit.MILLISECONDS.toNanos(10));
    assertEquals(2, gateway.pollCount());
  }

  private ComputationPoller poller(int maxPolls) {
    return new ComputationPoller(
        gateway, scheduler, new Backoff(Duration.ZERO, Duration.ZERO, maxPolls, new Random(1)), metrics);
  }

  // Answers DONE at once, except for one token whose poll blocks until released.
  private static final class BlockingGateway implements ComputationGateway {
    private final String slowToken;
    private final CountDownLatch entered = new CountDownLatch(1);
    private final CountDownLatch release = new CountDownLatch(1);

    BlockingGateway(String slowToken) {
      this.slowToken = slowToken;
    }

    @Override
    public String submit(EncodedVector vector, String idempotencyKey) {
      throw new UnsupportedOperationException();
    }

    @Override
    public PollResult poll(String token) throws PipelineException {
      if (token.equals(slowToken)) {
        entered.countDown();
        try {
          release.await();
        } catch (InterruptedException ex) {
          Thread.currentThread().interrupt();
          throw new ComputationUnavailableException("interrupted");
        }
      }
      return PollResult.done(BLOB);
    }

    @Override
    public EncodedVector decodeResult(byte[] resultBlob) {
      throw new UnsupportedOperationException();
    }
  }
}
