package com.portfoliosync.integration.venues;

import java.time.Duration;

public record VenueRetrySettings(int maxAttempts, Duration baseBackoff, Duration maxBackoff, boolean jitter) {
  public static final VenueRetrySettings DEFAULTS =
      new VenueRetrySettings(4, Duration.ofMillis(200), Duration.ofSeconds(2), true);

  public VenueRetrySettings {
    if (maxAttempts < 1) {
      throw new IllegalArgumentException("maxAttempts must be >= 1");
    }
    if (baseBackoff == null || baseBackoff.isNegative()) {
      throw new IllegalArgumentException("baseBackoff must be >= 0");
    }
    if (maxBackoff == null || maxBackoff.compareTo(baseBackoff) < 0) {
      throw new IllegalArgumentException("maxBackoff must be >= baseBackoff");
    }
  }
}
