package com.portfoliosync.integration.venues.http;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;
import java.util.function.LongSupplier;

/** Allows at most {@code maxRequests} within any rolling {@code window}. */
public class SlidingWindowRateLimiter implements RequestRateLimiter {
  private final int maxRequests;
  private final long windowNanos;
  private final LongSupplier nanoTime;
  private final Sleeper sleeper;
  private final Deque<Long> sent = new ArrayDeque<>();

  public SlidingWindowRateLimiter(int maxRequests, Duration window) {
    this(maxRequests, window, System::nanoTime, Sleeper.THREAD);
  }

  public SlidingWindowRateLimiter(int maxRequests, Duration window, LongSupplier nanoTime, Sleeper sleeper) {
    if (maxRequests <= 0) {
      throw new IllegalArgumentException("maxRequests must be > 0");
    }
    if (window == null || window.isZero() || window.isNegative()) {
      throw new IllegalArgumentException("window must be > 0");
    }
    this.maxRequests = maxRequests;
    this.windowNanos = window.toNanos();
    this.nanoTime = Objects.requireNonNull(nanoTime, "nanoTime must not be null");
    this.sleeper = Objects.requireNonNull(sleeper, "sleeper must not be null");
  }

  public static SlidingWindowRateLimiter perSecond(int maxRequests) {
    return new SlidingWindowRateLimiter(maxRequests, Duration.ofSeconds(1));
  }

  public static SlidingWindowRateLimiter perMinute(int maxRequests) {
    return new SlidingWindowRateLimiter(maxRequests, Duration.ofMinutes(1));
  }

  @Override
  public synchronized void acquire() throws InterruptedException {
    while (true) {
      long now = nanoTime.getAsLong();
      while (!sent.isEmpty() && now - sent.peekFirst() >= windowNanos) {
        sent.pollFirst();
      }
      if (sent.size() < maxRequests) {
        sent.addLast(now);
        return;
      }
      long wait = sent.peekFirst() + windowNanos - now;
      sleeper.sleep(Duration.ofNanos(Math.max(1L, wait)));
    }
  }
}
