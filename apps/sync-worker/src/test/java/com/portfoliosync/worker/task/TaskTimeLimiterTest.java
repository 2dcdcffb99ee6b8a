package com.portfoliosync.worker.task;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.portfoliosync.worker.config.SyncTaskProperties.TimeLimits;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class TaskTimeLimiterTest {
  private final TaskTimeLimiter limiter = new TaskTimeLimiter();

  @AfterEach
  void tearDown() {
    limiter.destroy();
  }

  @Test
  void returnsResultAfterSoftLimit() {
    TimeLimits limits = new TimeLimits(Duration.ofMillis(20), Duration.ofSeconds(5));

    String result =
        limiter.run(
            "slow_but_fine",
            limits,
            () -> {
              Thread.sleep(100);
              return "done";
            });

    assertEquals("done", result);
  }

  @Test
  void interruptsBodyAtHardLimit() throws Exception {
    TimeLimits limits = new TimeLimits(Duration.ofMillis(20), Duration.ofMillis(100));
    CountDownLatch interrupted = new CountDownLatch(1);

    assertThrows(
        TaskTimeLimitExceededException.class,
        () ->
            limiter.run(
                "stuck",
                limits,
                () -> {
                  try {
                    Thread.sleep(10_000);
                  } catch (InterruptedException ex) {
                    interrupted.countDown();
                  }
                  return null;
                }));
    assertTrue(interrupted.await(2, TimeUnit.SECONDS));
  }

  @Test
  void bodyThatOutlivesHardLimitCannotCommit() throws Exception {
    TimeLimits limits = new TimeLimits(Duration.ofMillis(20), Duration.ofMillis(100));
    CountDownLatch finished = new CountDownLatch(1);
    AtomicBoolean committed = new AtomicBoolean();
    AtomicReference<RuntimeException> refused = new AtomicReference<>();

    assertThrows(
        TaskTimeLimitExceededException.class,
        () ->
            limiter.run(
                "swallows_interrupt",
                limits,
                () -> {
                  long until = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(300);
                  while (System.nanoTime() < until) {
                    Thread.onSpinWait();
                  }
                  // mimic a client library that clears the interrupt flag
                  Thread.interrupted();
                  try {
                    TaskTimeLimiter.ensureNotCancelled("cursor update");
                    committed.set(true);
                  } catch (TaskCancelledException ex) {
                    refused.set(ex);
                  }
                  finished.countDown();
                  return null;
                }));

    assertTrue(finished.await(2, TimeUnit.SECONDS));
    assertFalse(committed.get());
    assertEquals("Task cancelled before cursor update", refused.get().getMessage());
  }

  @Test
  void bodyWithinLimitsMayCommit() {
    TimeLimits limits = new TimeLimits(Duration.ofSeconds(1), Duration.ofSeconds(2));

    String result =
        limiter.run(
            "quick",
            limits,
            () -> {
              TaskTimeLimiter.ensureNotCancelled("ledger write");
              return "committed";
            });

    assertEquals("committed", result);
  }

  @Test
  void rethrowsBodyFailureUnwrapped() {
    TimeLimits limits = new TimeLimits(Duration.ofSeconds(1), Duration.ofSeconds(2));

    IllegalArgumentException thrown =
        assertThrows(
            IllegalArgumentException.class,
            () ->
                limiter.run(
                    "failing",
                    limits,
                    () -> {
                      throw new IllegalArgumentException("boom");
                    }));
    assertEquals("boom", thrown.getMessage());
  }
}
