package com.portfoliosync.integration.venues;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.portfoliosync.integration.venues.http.Sleeper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.net.http.HttpClient;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/** Adapter collaborators for tests: fixed clock, no backoff sleeps, cached executor. */
public final class VenueSupportFixture implements AutoCloseable {
  public static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

  private final ExecutorService executor = Executors.newCachedThreadPool();
  private final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
  private final VenueSupport support;

  public VenueSupportFixture() {
    Sleeper noSleep = duration -> {};
    support =
        new VenueSupport(
            HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(3)).build(),
            new ObjectMapper(),
            Clock.fixed(NOW, ZoneOffset.UTC),
            meterRegistry,
            executor,
            new VenueRetrySettings(3, Duration.ZERO, Duration.ZERO, false),
            noSleep);
  }

  public VenueSupport support() {
    return support;
  }

  public SimpleMeterRegistry meterRegistry() {
    return meterRegistry;
  }

  @Override
  public void close() {
    executor.shutdownNow();
  }
}
