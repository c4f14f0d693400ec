package ca.gc.cra.pulse.infrastructure.exec;

import java.lang.Thread.UncaughtExceptionHandler;
import java.util.Objects;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Factory helpers for the named worker threads used by the emitter.
 */
public final class ExecutorFactories {
  private static final Logger log = LoggerFactory.getLogger(ExecutorFactories.class);

  private ExecutorFactories() {}

  /**
   * Builds a thread factory producing named, non-daemon threads.
   *
   * @param prefix thread-name prefix; defaults to {@code "pulse-worker"} when blank
   * @param handler uncaught exception handler; defaults to logging at ERROR
   * @return thread factory
   */
  public static ThreadFactory namedThreadFactory(String prefix, UncaughtExceptionHandler handler) {
    String threadPrefix = (prefix == null || prefix.isBlank()) ? "pulse-worker" : prefix;
    UncaughtExceptionHandler effectiveHandler = Objects.requireNonNullElse(handler,
        (t, ex) -> log.error("Uncaught failure on thread {}", t.getName(), ex));
    AtomicInteger index = new AtomicInteger();
    return runnable -> {
      Thread thread = new Thread(runnable);
      int n = index.getAndIncrement();
      thread.setName(n == 0 ? threadPrefix : threadPrefix + "-" + n);
      thread.setDaemon(false);
      thread.setUncaughtExceptionHandler(effectiveHandler);
      return thread;
    };
  }

  /**
   * Creates, but does not start, a single named thread.
   *
   * @param name thread name
   * @param task body
   * @return unstarted thread
   */
  public static Thread newNamedThread(String name, Runnable task) {
    return namedThreadFactory(name, null).newThread(Objects.requireNonNull(task, "task"));
  }
}
