package ca.gc.cra.relay.infrastructure.exec;

import java.lang.Thread.UncaughtExceptionHandler;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Factory helpers for the named daemon threads and pools that carry RELAY socket I/O.
 */
public final class ExecutorFactories {
  private static final long IDLE_KEEP_ALIVE_SECONDS = 30L;

  private ExecutorFactories() {}

  /**
   * Builds an elastic pool with one thread per live connection, capped at {@code maxThreads}.
   *
   * <p>Tasks beyond the cap are rejected with {@link java.util.concurrent.RejectedExecutionException}; callers
   * size the cap to their connection limit.</p>
   *
   * @param maxThreads upper bound on concurrently running writer tasks
   * @param prefix thread-name prefix used to tag worker threads
   * @param handler uncaught exception handler installed on each worker thread
   * @return configured executor service
   */
  public static ExecutorService newConnectionPool(int maxThreads, String prefix, UncaughtExceptionHandler handler) {
    if (maxThreads <= 0) {
      throw new IllegalArgumentException("maxThreads must be positive");
    }
    return new ThreadPoolExecutor(
        0,
        maxThreads,
        IDLE_KEEP_ALIVE_SECONDS,
        TimeUnit.SECONDS,
        new SynchronousQueue<>(),
        namedDaemonFactory(prefix, handler),
        new ThreadPoolExecutor.AbortPolicy());
  }

  /**
   * Creates (but does not start) a single named daemon thread for long-lived loops such as accept or
   * reconnect supervision.
   *
   * @param name thread name
   * @param task loop body
   * @param handler uncaught exception handler; {@code null} installs a no-op handler
   * @return unstarted thread
   */
  public static Thread newDaemonThread(String name, Runnable task, UncaughtExceptionHandler handler) {
    Thread thread = new Thread(Objects.requireNonNull(task, "task"));
    thread.setName((name == null || name.isBlank()) ? "relay-worker" : name);
    thread.setDaemon(true);
    thread.setUncaughtExceptionHandler(Objects.requireNonNullElse(handler, (t, ex) -> {}));
    return thread;
  }

  /**
   * Returns a thread factory producing {@code prefix-N} daemon threads.
   *
   * @param prefix thread-name prefix; defaults to {@code relay-io}
   * @param handler uncaught exception handler; {@code null} installs a no-op handler
   * @return thread factory
   */
  public static ThreadFactory namedDaemonFactory(String prefix, UncaughtExceptionHandler handler) {
    String threadPrefix = (prefix == null || prefix.isBlank()) ? "relay-io" : prefix;
    AtomicInteger index = new AtomicInteger();
    return runnable -> newDaemonThread(threadPrefix + "-" + index.getAndIncrement(), runnable, handler);
  }
}
