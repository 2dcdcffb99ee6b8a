package com.portfoliosync.infra.kafka.consumer;

import com.portfoliosync.infra.kafka.errors.InvalidTaskMetadataException;
import java.time.Duration;

/**
 * Retries of a failing handler on the consumer thread before its record is dead-lettered. Sync
 * tasks reschedule themselves through the dispatch queue, so the worker runs with one attempt.
 */
public record HandlerRetry(int maxAttempts, Duration backoff) {
  public HandlerRetry {
    maxAttempts = Math.max(1, maxAttempts);
    backoff = backoff == null || backoff.isNegative() ? Duration.ZERO : backoff;
  }

  public static HandlerRetry once() {
    return new HandlerRetry(1, Duration.ZERO);
  }

  /** Attempts are 1-based; malformed records are never retried. */
  public boolean allowsAnotherAttempt(int attempt, Exception failure) {
    return attempt < maxAttempts && !(failure instanceof InvalidTaskMetadataException);
  }
}
