package ca.gc.cra.prism.infrastructure.exec;

import java.lang.Thread.UncaughtExceptionHandler;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Factory helpers for the executors the pipeline runs on.
 */
public final class ExecutorFactories {

  private ExecutorFactories() {}

  /**
   * Builds the fixed-size job worker pool. Jobs beyond {@code size} wait in an unbounded FIFO queue, so the
   * pool size bounds concurrent upstream and gateway calls without rejecting starts.
   *
   * @param size number of worker threads
   * @param prefix thread-name prefix; defaults to {@code prism-worker}
   * @param handler uncaught exception handler installed on each thread
   * @return worker executor
   */
  public static ExecutorService newWorkerPool(int size, String prefix, UncaughtExceptionHandler handler) {
    if (size <= 0) {
      throw new IllegalArgumentException("size must be positive");
    }
    return new ThreadPoolExecutor(
        size,
        size,
        0L,
        TimeUnit.MILLISECONDS,
        new LinkedBlockingQueue<>(),
        namedFactory(prefix, "prism-worker", handler, false),
        new ThreadPoolExecutor.AbortPolicy());
  }

  /**
   * Builds the single-threaded scheduler timing computation polls. Cancelled polls are removed from the
   * queue immediately.
   *
   * @param prefix thread-name prefix; defaults to {@code prism-poll}
   * @param handler uncaught exception handler
   * @return scheduler
   */
  public static ScheduledExecutorService newPollScheduler(String prefix, UncaughtExceptionHandler handler) {
    ScheduledThreadPoolExecutor scheduler =
        new ScheduledThreadPoolExecutor(1, namedFactory(prefix, "prism-poll", handler, true));
    scheduler.setRemoveOnCancelPolicy(true);
    return scheduler;
  }

  private static ThreadFactory namedFactory(
      String prefix, String fallback, UncaughtExceptionHandler handler, boolean daemon) {
    String threadPrefix = (prefix == null || prefix.isBlank()) ? fallback : prefix;
    UncaughtExceptionHandler effectiveHandler = Objects.requireNonNullElse(handler, (t, ex) -> {});
    AtomicInteger index = new AtomicInteger();
    return runnable -> {
      Thread thread = new Thread(runnable);
      thread.setName(threadPrefix + "-" + index.getAndIncrement());
      thread.setDaemon(daemon);
      thread.setUncaughtExceptionHandler(effectiveHandler);
      return thread;
    };
  }
}
