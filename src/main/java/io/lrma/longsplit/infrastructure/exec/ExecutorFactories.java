package io.lrma.longsplit.infrastructure.exec;

import java.lang.Thread.UncaughtExceptionHandler;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Factory helpers for the fixed thread pools used by the segmentation pipeline.
 */
public final class ExecutorFactories {

  private ExecutorFactories() {}

  /**
   * Builds a fixed-size executor whose threads are named, non-daemon, and carry an uncaught handler.
   *
   * <p>The pool has no task queue: submitting more tasks than {@code size} is rejected, so callers
   * size the pool to the exact number of long-running stage loops they start.</p>
   *
   * @param size number of threads to allocate
   * @param prefix thread-name prefix used to tag pipeline threads
   * @param handler uncaught exception handler installed on each thread
   * @return configured executor service
   */
  public static ExecutorService newStagePool(int size, String prefix, UncaughtExceptionHandler handler) {
    if (size <= 0) {
      throw new IllegalArgumentException("size must be positive");
    }
    String threadPrefix = (prefix == null || prefix.isBlank()) ? "longsplit-stage" : prefix;
    UncaughtExceptionHandler effectiveHandler = Objects.requireNonNullElse(handler, (t, ex) -> {});
    AtomicInteger index = new AtomicInteger();
    ThreadFactory factory =
        runnable -> {
          Thread thread = new Thread(runnable);
          thread.setName(threadPrefix + "-" + index.getAndIncrement());
          thread.setDaemon(false);
          thread.setUncaughtExceptionHandler(effectiveHandler);
          return thread;
        };

    return new ThreadPoolExecutor(
        size,
        size,
        0L,
        TimeUnit.MILLISECONDS,
        new SynchronousQueue<>(),
        factory,
        new ThreadPoolExecutor.AbortPolicy());
  }

  /**
   * Resolves the worker count for a run.
   *
   * <p>Non-positive requests and requests above the available processors fall back to the
   * available processor count.</p>
   *
   * @param requested requested worker count
   * @param availableProcessors processors visible to the JVM
   * @return effective worker count, at least one
   */
  public static int resolveWorkerCount(int requested, int availableProcessors) {
    int available = Math.max(1, availableProcessors);
    if (requested <= 0 || requested > available) {
      return available;
    }
    return requested;
  }

  /**
   * Returns the default worker count: one less than the available processors, at least one.
   *
   * @param availableProcessors processors visible to the JVM
   * @return default worker count
   */
  public static int defaultWorkerCount(int availableProcessors) {
    return Math.max(1, availableProcessors - 1);
  }
}
