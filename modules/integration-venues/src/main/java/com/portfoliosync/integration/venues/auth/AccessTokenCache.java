package com.portfoliosync.integration.venues.auth;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Caches a short-lived access token and renews it single-flight: concurrent callers that find the
 * token stale wait on one lock and all but the first reuse the token it obtained.
 */
public class AccessTokenCache {
  private final TokenSource source;
  private final Duration refreshMargin;
  private final Clock clock;
  private final ReentrantLock lock = new ReentrantLock();

  private volatile IssuedToken current;

  public AccessTokenCache(TokenSource source, Duration refreshMargin, Clock clock, IssuedToken initial) {
    this.source = Objects.requireNonNull(source, "source must not be null");
    this.refreshMargin = Objects.requireNonNull(refreshMargin, "refreshMargin must not be null");
    this.clock = Objects.requireNonNull(clock, "clock must not be null");
    this.current = initial;
  }

  public String get() {
    IssuedToken token = current;
    if (!needsRefresh(token)) {
      return token.value();
    }
    lock.lock();
    try {
      if (needsRefresh(current)) {
        current = source.issue();
      }
      return current.value();
    } finally {
      lock.unlock();
    }
  }

  /**
   * Renews after the venue rejected {@code rejectedToken}. If another caller already replaced it,
   * the newer token is returned without a second renewal.
   */
  public String refreshAfterRejection(String rejectedToken) {
    lock.lock();
    try {
      IssuedToken token = current;
      if (token != null && !token.value().equals(rejectedToken) && !needsRefresh(token)) {
        return token.value();
      }
      current = source.issue();
      return current.value();
    } finally {
      lock.unlock();
    }
  }

  public void invalidate() {
    lock.lock();
    try {
      current = null;
    } finally {
      lock.unlock();
    }
  }

  boolean needsRefresh(IssuedToken token) {
    if (token == null || token.value() == null || token.value().isBlank()) {
      return true;
    }
    if (token.expiresAt() == null) {
      return true;
    }
    return !clock.instant().plus(refreshMargin).isBefore(token.expiresAt());
  }

  @FunctionalInterface
  public interface TokenSource {
    IssuedToken issue();
  }

  public record IssuedToken(String value, Instant expiresAt) {}
}
