package com.portfoliosync.integration.venues.auth;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.portfoliosync.integration.venues.auth.AccessTokenCache.IssuedToken;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;

class AccessTokenCacheTest {
  private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");
  private static final Clock CLOCK = Clock.fixed(NOW, ZoneOffset.UTC);

  @Test
  void shouldReuseTokenOutsideRefreshMargin() {
    AtomicInteger issued = new AtomicInteger();
    AccessTokenCache cache =
        new AccessTokenCache(
            () -> new IssuedToken("fresh-" + issued.incrementAndGet(), NOW.plusSeconds(3600)),
            Duration.ofSeconds(300),
            CLOCK,
            new IssuedToken("initial", NOW.plusSeconds(600)));

    assertEquals("initial", cache.get());
    assertEquals(0, issued.get());
  }

  @Test
  void shouldRefreshWhenMissingExpiringOrWithoutExpiry() {
    AccessTokenCache cache =
        new AccessTokenCache(() -> null, Duration.ofSeconds(300), CLOCK, null);

    assertTrue(cache.needsRefresh(null));
    assertTrue(cache.needsRefresh(new IssuedToken("token", null)));
    assertTrue(cache.needsRefresh(new IssuedToken("token", NOW.plusSeconds(300))));
    assertFalse(cache.needsRefresh(new IssuedToken("token", NOW.plusSeconds(301))));
  }

  @Test
  void shouldRefreshOnceForConcurrentCallers() throws Exception {
    AtomicInteger issued = new AtomicInteger();
    CountDownLatch start = new CountDownLatch(1);
    AccessTokenCache cache =
        new AccessTokenCache(
            () -> {
              issued.incrementAndGet();
              sleepQuietly();
              return new IssuedToken("shared", NOW.plusSeconds(3600));
            },
            Duration.ofSeconds(300),
            CLOCK,
            null);

    ExecutorService pool = Executors.newFixedThreadPool(8);
    try {
      List<Future<String>> results = new ArrayList<>();
      for (int i = 0; i < 8; i++) {
        results.add(
            pool.submit(
                () -> {
                  start.await();
                  return cache.get();
                }));
      }
      start.countDown();
      for (Future<String> result : results) {
        assertEquals("shared", result.get(5, TimeUnit.SECONDS));
      }
    } finally {
      pool.shutdownNow();
    }

    assertEquals(1, issued.get());
  }

  @Test
  void shouldSkipSecondRefreshWhenRejectedTokenAlreadyReplaced() {
    AtomicInteger issued = new AtomicInteger();
    AccessTokenCache cache =
        new AccessTokenCache(
            () -> new IssuedToken("token-" + issued.incrementAndGet(), NOW.plusSeconds(3600)),
            Duration.ofSeconds(60),
            CLOCK,
            new IssuedToken("stale", NOW.plusSeconds(3600)));

    String first = cache.refreshAfterRejection("stale");
    String second = cache.refreshAfterRejection("stale");

    assertEquals("token-1", first);
    assertEquals("token-1", second);
    assertEquals(1, issued.get());
  }

  private static void sleepQuietly() {
    try {
      Thread.sleep(50L);
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
    }
  }
}
