package com.portfoliosync.integration.venues;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.portfoliosync.integration.venues.http.JitteredExponentialBackoff;
import com.portfoliosync.integration.venues.http.RetryAfterParser;
import com.portfoliosync.integration.venues.http.Sleeper;
import com.portfoliosync.integration.venues.http.VenueHttpClient;
import com.portfoliosync.integration.venues.http.VenueRetryExecutor;
import io.micrometer.core.instrument.MeterRegistry;
import java.net.http.HttpClient;
import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Executor;

/** Process-wide collaborators shared by every adapter instance. Built once at start-up. */
public record VenueSupport(
    HttpClient httpClient,
    ObjectMapper objectMapper,
    Clock clock,
    MeterRegistry meterRegistry,
    Executor executor,
    VenueRetrySettings retrySettings,
    Sleeper sleeper) {
  public VenueSupport {
    Objects.requireNonNull(httpClient, "httpClient must not be null");
    Objects.requireNonNull(objectMapper, "objectMapper must not be null");
    Objects.requireNonNull(clock, "clock must not be null");
    Objects.requireNonNull(meterRegistry, "meterRegistry must not be null");
    Objects.requireNonNull(executor, "executor must not be null");
    Objects.requireNonNull(retrySettings, "retrySettings must not be null");
    Objects.requireNonNull(sleeper, "sleeper must not be null");
  }

  public VenueHttpClient httpClientFor(Venue venue, Duration timeout) {
    return new VenueHttpClient(venue, httpClient, objectMapper, timeout, retryExecutorFor(venue));
  }

  public VenueRetryExecutor retryExecutorFor(Venue venue) {
    return new VenueRetryExecutor(
        venue,
        retrySettings.maxAttempts(),
        new RetryAfterParser(clock),
        new JitteredExponentialBackoff(
            retrySettings.baseBackoff(), retrySettings.maxBackoff(), retrySettings.jitter()),
        sleeper,
        meterRegistry);
  }
}
