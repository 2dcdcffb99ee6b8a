package com.portfoliosync.integration.venues.http;

import java.time.Clock;
import java.time.Duration;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Objects;
import java.util.Optional;

/** Parses {@code Retry-After} as delta-seconds or an RFC 1123 date. */
public class RetryAfterParser {
  private final Clock clock;

  public RetryAfterParser(Clock clock) {
    this.clock = Objects.requireNonNull(clock, "clock must not be null");
  }

  public Optional<Duration> parse(String headerValue) {
    if (headerValue == null || headerValue.isBlank()) {
      return Optional.empty();
    }
    String candidate = headerValue.trim();
    if (candidate.chars().allMatch(Character::isDigit)) {
      return Optional.of(Duration.ofSeconds(Long.parseLong(candidate)));
    }
    try {
      double seconds = Double.parseDouble(candidate);
      return Optional.of(Duration.ofMillis(Math.max(0L, Math.round(seconds * 1000.0d))));
    } catch (NumberFormatException notNumeric) {
      return parseHttpDate(candidate);
    }
  }

  private Optional<Duration> parseHttpDate(String candidate) {
    try {
      ZonedDateTime retryAt = ZonedDateTime.parse(candidate, DateTimeFormatter.RFC_1123_DATE_TIME);
      Duration between = Duration.between(clock.instant(), retryAt.toInstant());
      return Optional.of(between.isNegative() ? Duration.ZERO : between);
    } catch (DateTimeParseException ex) {
      return Optional.empty();
    }
  }
}
