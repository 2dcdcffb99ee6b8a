package com.portfoliosync.integration.venues.http;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/** Exponential backoff doubling from a base delay up to a cap, with optional full jitter. */
public class JitteredExponentialBackoff {
  private final long baseBackoffMs;
  private final long maxBackoffMs;
  private final boolean jitterEnabled;
  private final DoubleSupplier jitterSource;

  public JitteredExponentialBackoff(Duration baseBackoff, Duration maxBackoff, boolean jitterEnabled) {
    this(baseBackoff, maxBackoff, jitterEnabled, () -> ThreadLocalRandom.current().nextDouble());
  }

  public JitteredExponentialBackoff(
      Duration baseBackoff, Duration maxBackoff, boolean jitterEnabled, DoubleSupplier jitterSource) {
    this.baseBackoffMs = Math.max(0L, baseBackoff.toMillis());
    this.maxBackoffMs = Math.max(this.baseBackoffMs, maxBackoff.toMillis());
    this.jitterEnabled = jitterEnabled;
    this.jitterSource = Objects.requireNonNull(jitterSource, "jitterSource must not be null");
  }

  public Duration backoffForAttempt(int attempt) {
    long ceiling = ceilingForAttempt(attempt);
    if (!jitterEnabled || ceiling == 0L) {
      return Duration.ofMillis(ceiling);
    }
    double factor = Math.max(0.0d, Math.min(1.0d, jitterSource.getAsDouble()));
    return Duration.ofMillis(Math.min(maxBackoffMs, Math.round(factor * ceiling)));
  }

  public Duration maxBackoff() {
    return Duration.ofMillis(maxBackoffMs);
  }

  private long ceilingForAttempt(int attempt) {
    if (baseBackoffMs == 0L) {
      return 0L;
    }
    int exponent = Math.min(30, Math.max(0, attempt - 1));
    double scaled = baseBackoffMs * Math.pow(2.0d, exponent);
    return (long) Math.min((double) maxBackoffMs, scaled);
  }
}
