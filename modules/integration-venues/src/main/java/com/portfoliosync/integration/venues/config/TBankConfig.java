package com.portfoliosync.integration.venues.config;

import static com.portfoliosync.integration.venues.config.ConfigChecks.require;
import static com.portfoliosync.integration.venues.config.ConfigChecks.requirePositive;
import static com.portfoliosync.integration.venues.config.ConfigChecks.requireValue;

import com.portfoliosync.integration.venues.Venue;
import java.net.URI;
import java.time.Duration;

/** T-Invest REST gateway settings. {@code accountId} may be null: the first account is used. */
public record TBankConfig(
    URI baseUri,
    String token,
    String accountId,
    Duration timeout,
    Duration defaultLookback,
    int operationsPerMinute,
    int usersPerMinute)
    implements VenueConfig {
  public static final URI DEFAULT_URI = URI.create("https://invest-public-api.tinkoff.ru/rest");
  public static final URI SANDBOX_URI = URI.create("https://sandbox-invest-public-api.tinkoff.ru/rest");
  public static final Duration DEFAULT_LOOKBACK = Duration.ofDays(30);

  public TBankConfig {
    Venue venue = Venue.TBANK;
    requireValue(venue, baseUri, "baseUri");
    token = require(venue, token, "token");
    accountId = accountId == null || accountId.isBlank() ? null : accountId.trim();
    requirePositive(venue, timeout, "timeout");
    requirePositive(venue, defaultLookback, "defaultLookback");
    requirePositive(venue, operationsPerMinute, "operationsPerMinute");
    requirePositive(venue, usersPerMinute, "usersPerMinute");
  }

  @Override
  public Venue venue() {
    return Venue.TBANK;
  }
}
