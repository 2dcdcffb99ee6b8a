package com.portfoliosync.integration.venues.http;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import org.junit.jupiter.api.Test;

class RetryAfterParserTest {
  @Test
  void shouldParseDeltaSeconds() {
    RetryAfterParser parser = new RetryAfterParser(Clock.systemUTC());

    assertEquals(Duration.ofSeconds(7), parser.parse("7").orElseThrow());
    assertEquals(Duration.ofMillis(1500), parser.parse("1.5").orElseThrow());
  }

  @Test
  void shouldParseHttpDateRelativeToClock() {
    Instant now = Instant.parse("2026-03-01T10:00:00Z");
    RetryAfterParser parser = new RetryAfterParser(Clock.fixed(now, ZoneOffset.UTC));
    String header = DateTimeFormatter.RFC_1123_DATE_TIME.format(now.plusSeconds(4).atZone(ZoneOffset.UTC));

    assertEquals(Duration.ofSeconds(4), parser.parse(header).orElseThrow());
  }

  @Test
  void shouldClampPastDatesToZero() {
    Instant now = Instant.parse("2026-03-01T10:00:00Z");
    RetryAfterParser parser = new RetryAfterParser(Clock.fixed(now, ZoneOffset.UTC));
    String header = DateTimeFormatter.RFC_1123_DATE_TIME.format(now.minusSeconds(30).atZone(ZoneOffset.UTC));

    assertEquals(Duration.ZERO, parser.parse(header).orElseThrow());
  }

  @Test
  void shouldIgnoreBlankOrInvalidHeader() {
    RetryAfterParser parser = new RetryAfterParser(Clock.systemUTC());

    assertTrue(parser.parse(" ").isEmpty());
    assertTrue(parser.parse("soon").isEmpty());
  }
}
