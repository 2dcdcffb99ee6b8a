package com.portfoliosync.integration.venues.http;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.portfoliosync.integration.venues.Venue;
import com.portfoliosync.integration.venues.VenueApiException;
import com.portfoliosync.integration.venues.VenueAuthenticationException;
import com.portfoliosync.integration.venues.VenueTransportException;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;

class VenueRetryExecutorTest {
  private static final Clock FIXED_CLOCK =
      Clock.fixed(Instant.parse("2026-03-01T00:00:00Z"), ZoneOffset.UTC);

  private final List<Duration> waits = new ArrayList<>();
  private final SimpleMeterRegistry registry = new SimpleMeterRegistry();

  private VenueRetryExecutor executor(int maxAttempts) {
    return new VenueRetryExecutor(
        Venue.BYBIT,
        maxAttempts,
        new RetryAfterParser(FIXED_CLOCK),
        new JitteredExponentialBackoff(Duration.ofMillis(200), Duration.ofSeconds(2), false),
        waits::add,
        registry);
  }

  @Test
  void shouldHonourRetryAfterHeaderOnRateLimit() {
    AtomicInteger attempts = new AtomicInteger();

    String actual =
        executor(4)
            .execute(
                "balances",
                () -> {
                  if (attempts.incrementAndGet() == 1) {
                    HttpHeaders headers = new HttpHeaders();
                    headers.add(HttpHeaders.RETRY_AFTER, "3");
                    throw new VenueApiException(Venue.BYBIT, "balances", 429, headers, "");
                  }
                  return "ok";
                });

    assertEquals("ok", actual);
    assertEquals(List.of(Duration.ofSeconds(3)), waits);
    assertEquals(
        1.0d,
        registry.get("venue.http.retry.total").tags("venue", "bybit", "reason", "rate_limited").counter().count());
  }

  @Test
  void shouldBackOffExponentiallyOnServerAndTransportErrors() {
    AtomicInteger attempts = new AtomicInteger();

    String actual =
        executor(4)
            .execute(
                "positions",
                () -> {
                  int attempt = attempts.incrementAndGet();
                  if (attempt == 1) {
                    throw new VenueApiException(Venue.BYBIT, "positions", 503, HttpHeaders.EMPTY, "busy");
                  }
                  if (attempt == 2) {
                    throw new VenueTransportException(Venue.BYBIT, "timeout", new IOException("timeout"));
                  }
                  return "ok";
                });

    assertEquals("ok", actual);
    assertEquals(List.of(Duration.ofMillis(200), Duration.ofMillis(400)), waits);
    assertEquals(
        1.0d, registry.get("venue.http.retry.total").tags("reason", "transport").counter().count());
  }

  @Test
  void shouldNotRetryForbiddenOrAuthenticationFailures() {
    AtomicInteger attempts = new AtomicInteger();
    VenueRetryExecutor executor = executor(4);

    assertThrows(
        VenueApiException.class,
        () ->
            executor.execute(
                "account",
                () -> {
                  attempts.incrementAndGet();
                  throw new VenueApiException(Venue.BYBIT, "account", 403, HttpHeaders.EMPTY, "denied");
                }));
    assertThrows(
        VenueAuthenticationException.class,
        () ->
            executor.execute(
                "account",
                () -> {
                  attempts.incrementAndGet();
                  throw new VenueAuthenticationException(Venue.BYBIT, "bad key");
                }));

    assertEquals(2, attempts.get());
    assertEquals(List.of(), waits);
  }

  @Test
  void shouldCountExhaustionAfterMaxAttempts() {
    AtomicInteger attempts = new AtomicInteger();

    assertThrows(
        VenueApiException.class,
        () ->
            executor(3)
                .execute(
                    "fills",
                    () -> {
                      attempts.incrementAndGet();
                      throw new VenueApiException(Venue.BYBIT, "fills", 500, HttpHeaders.EMPTY, "");
                    }));

    assertEquals(3, attempts.get());
    assertEquals(List.of(Duration.ofMillis(200), Duration.ofMillis(400)), waits);
    assertEquals(1.0d, registry.get("venue.http.retry.exhausted.total").counter().count());
  }
}
