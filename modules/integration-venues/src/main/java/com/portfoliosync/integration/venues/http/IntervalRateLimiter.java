package com.portfoliosync.integration.venues.http;

import java.time.Duration;
import java.util.Objects;
import java.util.function.LongSupplier;

/** Enforces a minimum spacing of {@code 1 / permitsPerSecond} between requests. */
public class IntervalRateLimiter implements RequestRateLimiter {
  private final long intervalNanos;
  private final LongSupplier nanoTime;
  private final Sleeper sleeper;
  private long nextFreeSlot;
  private boolean started;

  public IntervalRateLimiter(double permitsPerSecond) {
    this(permitsPerSecond, System::nanoTime, Sleeper.THREAD);
  }

  public IntervalRateLimiter(double permitsPerSecond, LongSupplier nanoTime, Sleeper sleeper) {
    if (!(permitsPerSecond > 0.0d)) {
      throw new IllegalArgumentException("permitsPerSecond must be > 0");
    }
    this.intervalNanos = (long) (1_000_000_000L / permitsPerSecond);
    this.nanoTime = Objects.requireNonNull(nanoTime, "nanoTime must not be null");
    this.sleeper = Objects.requireNonNull(sleeper, "sleeper must not be null");
  }

  @Override
  public synchronized void acquire() throws InterruptedException {
    long now = nanoTime.getAsLong();
    if (started && now < nextFreeSlot) {
      sleeper.sleep(Duration.ofNanos(nextFreeSlot - now));
      now = nextFreeSlot;
    }
    started = true;
    nextFreeSlot = now + intervalNanos;
  }
}
