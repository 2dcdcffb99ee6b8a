package com.portfoliosync.worker.task;

import com.portfoliosync.worker.config.SyncTaskProperties.TimeLimits;
import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Component;

/**
 * Runs task bodies with a soft and a hard deadline. Passing the soft deadline logs a warning; at
 * the hard deadline the body is interrupted and the caller gets {@link
 * TaskTimeLimitExceededException}.
 *
 * <p>A cancelled body keeps running until it next blocks, and HTTP or JDBC code may clear the
 * interrupt flag. Bodies call {@link #ensureNotCancelled(String)} before committing anything.
 */
@Component
public class TaskTimeLimiter implements DisposableBean {
  private static final Logger log = LoggerFactory.getLogger(TaskTimeLimiter.class);

  private static final ThreadLocal<AtomicBoolean> CANCELLED = new ThreadLocal<>();

  private final ExecutorService executor;

  public TaskTimeLimiter() {
    this.executor = Executors.newCachedThreadPool(new CustomizableThreadFactory("task-body-"));
  }

  public <T> T run(String taskName, TimeLimits limits, Callable<T> body) {
    AtomicBoolean cancelled = new AtomicBoolean();
    Future<T> future = executor.submit(() -> runFlagged(cancelled, body));
    Duration soft = limits.getSoftLimit();
    Duration hard = limits.getHardLimit();
    try {
      try {
        return future.get(soft.toMillis(), TimeUnit.MILLISECONDS);
      } catch (TimeoutException softTimeout) {
        log.warn("Task passed soft time limit task={} soft_limit_s={}", taskName, soft.toSeconds());
      }
      long remainingMs = Math.max(0L, hard.minus(soft).toMillis());
      try {
        return future.get(remainingMs, TimeUnit.MILLISECONDS);
      } catch (TimeoutException hardTimeout) {
        cancelled.set(true);
        future.cancel(true);
        log.warn("Task cancelled at hard time limit task={} hard_limit_s={}", taskName, hard.toSeconds());
        throw new TaskTimeLimitExceededException(taskName, hard);
      }
    } catch (ExecutionException ex) {
      Throwable cause = ex.getCause();
      if (cause instanceof RuntimeException runtimeException) {
        throw runtimeException;
      }
      if (cause instanceof Error error) {
        throw error;
      }
      throw new IllegalStateException(taskName + " failed", cause);
    } catch (InterruptedException ex) {
      cancelled.set(true);
      future.cancel(true);
      Thread.currentThread().interrupt();
      throw new IllegalStateException(taskName + " interrupted", ex);
    }
  }

  /**
   * Throws {@link TaskCancelledException} when the body running on this thread was cancelled at
   * its hard limit. Outside a limited body only the interrupt flag is checked.
   */
  public static void ensureNotCancelled(String stage) {
    AtomicBoolean cancelled = CANCELLED.get();
    if ((cancelled != null && cancelled.get()) || Thread.currentThread().isInterrupted()) {
      throw new TaskCancelledException(stage);
    }
  }

  private static <T> T runFlagged(AtomicBoolean cancelled, Callable<T> body) throws Exception {
    CANCELLED.set(cancelled);
    try {
      return body.call();
    } finally {
      CANCELLED.remove();
    }
  }

  @Override
  public void destroy() {
    executor.shutdownNow();
  }
}
