package io.tessera.conv.infrastructure.exec;

import java.lang.Thread.UncaughtExceptionHandler;
import java.util.Objects;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Factory helpers for the named worker pools of a conversion run.
 */
public final class ExecutorFactories {
  private static final Logger log = LoggerFactory.getLogger(ExecutorFactories.class);

  /** Logs worker failures that escape task code. */
  public static final UncaughtExceptionHandler LOGGING_HANDLER =
      (thread, ex) -> log.error("Uncaught failure on worker {}", thread.getName(), ex);

  private ExecutorFactories() {}

  /**
   * Builds the session pool. Callers bound outstanding submissions to {@code parallelism}, so the queue
   * never holds more than one waiting task per worker; anything beyond that is rejected.
   *
   * @param parallelism number of sessions converted concurrently
   * @param handler uncaught exception handler installed on each worker thread
   * @return configured executor service
   */
  public static ExecutorService newSessionPool(int parallelism, UncaughtExceptionHandler handler) {
    return newPool(parallelism, new ArrayBlockingQueue<>(parallelism), "tessera-session", handler);
  }

  /**
   * Builds the per-session stream pool used for mapping and timing passes.
   *
   * @param workers concurrent stream tasks
   * @param prefix thread-name prefix, usually carrying the session id
   * @param handler uncaught exception handler installed on each worker thread
   * @return configured executor service
   */
  public static ExecutorService newStreamPool(int workers, String prefix, UncaughtExceptionHandler handler) {
    return newPool(workers, new LinkedBlockingQueue<>(), prefix, handler);
  }

  private static ExecutorService newPool(
      int size, BlockingQueue<Runnable> queue, String prefix, UncaughtExceptionHandler handler) {
    if (size <= 0) {
      throw new IllegalArgumentException("size must be positive");
    }
    String threadPrefix = (prefix == null || prefix.isBlank()) ? "tessera-worker" : prefix;
    UncaughtExceptionHandler effectiveHandler = Objects.requireNonNullElse(handler, LOGGING_HANDLER);
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
        queue,
        factory,
        new ThreadPoolExecutor.AbortPolicy());
  }
}
