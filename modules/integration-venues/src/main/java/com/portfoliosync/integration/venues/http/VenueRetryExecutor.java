package com.portfoliosync.integration.venues.http;

import com.portfoliosync.integration.venues.Venue;
import com.portfoliosync.integration.venues.VenueApiException;
import com.portfoliosync.integration.venues.VenueException;
import com.portfoliosync.integration.venues.VenueTransportException;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Duration;
import java.util.Objects;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Retries transient venue failures (429, 5xx, timeouts, connection errors). A {@code Retry-After}
 * header on the failure is honoured as is; otherwise the jittered exponential backoff applies.
 */
public class VenueRetryExecutor {
  static final String RETRY_COUNTER = "venue.http.retry.total";
  static final String EXHAUSTED_COUNTER = "venue.http.retry.exhausted.total";

  private static final Logger log = LoggerFactory.getLogger(VenueRetryExecutor.class);

  private final Venue venue;
  private final int maxAttempts;
  private final RetryAfterParser retryAfterParser;
  private final JitteredExponentialBackoff backoff;
  private final Sleeper sleeper;
  private final MeterRegistry meterRegistry;

  public VenueRetryExecutor(
      Venue venue,
      int maxAttempts,
      RetryAfterParser retryAfterParser,
      JitteredExponentialBackoff backoff,
      Sleeper sleeper,
      MeterRegistry meterRegistry) {
    this.venue = Objects.requireNonNull(venue, "venue must not be null");
    this.maxAttempts = Math.max(1, maxAttempts);
    this.retryAfterParser = Objects.requireNonNull(retryAfterParser, "retryAfterParser must not be null");
    this.backoff = Objects.requireNonNull(backoff, "backoff must not be null");
    this.sleeper = Objects.requireNonNull(sleeper, "sleeper must not be null");
    this.meterRegistry = Objects.requireNonNull(meterRegistry, "meterRegistry must not be null");
  }

  public <T> T execute(String action, Supplier<T> operation) {
    int attempt = 1;
    while (true) {
      try {
        return operation.get();
      } catch (VenueException ex) {
        if (!ex.isTransient()) {
          throw ex;
        }
        if (attempt >= maxAttempts) {
          meterRegistry.counter(EXHAUSTED_COUNTER, "venue", venue.code()).increment();
          throw ex;
        }
        Duration wait = resolveBackoff(ex, attempt);
        meterRegistry.counter(RETRY_COUNTER, "venue", venue.code(), "reason", reason(ex)).increment();
        log.warn(
            "Venue call retry scheduled venue={} action={} attempt={} wait_ms={} error={}",
            venue.code(),
            action,
            attempt,
            wait.toMillis(),
            ex.getMessage());
        sleep(wait);
        attempt++;
      }
    }
  }

  private Duration resolveBackoff(VenueException ex, int attempt) {
    if (ex instanceof VenueApiException apiException) {
      return apiException
          .retryAfterHeader()
          .flatMap(retryAfterParser::parse)
          .orElseGet(() -> backoff.backoffForAttempt(attempt));
    }
    return backoff.backoffForAttempt(attempt);
  }

  private void sleep(Duration duration) {
    if (duration.isZero() || duration.isNegative()) {
      return;
    }
    try {
      sleeper.sleep(duration);
    } catch (InterruptedException interrupted) {
      Thread.currentThread().interrupt();
      throw new VenueException(venue, "Interrupted during " + venue.code() + " retry backoff", interrupted);
    }
  }

  private static String reason(VenueException ex) {
    if (ex instanceof VenueApiException apiException) {
      return apiException.isRateLimitError() ? "rate_limited" : "server_error";
    }
    if (ex instanceof VenueTransportException) {
      return "transport";
    }
    return "other";
  }
}
