package com.portfoliosync.integration.venues.config;

import static com.portfoliosync.integration.venues.config.ConfigChecks.require;
import static com.portfoliosync.integration.venues.config.ConfigChecks.requirePositive;
import static com.portfoliosync.integration.venues.config.ConfigChecks.requireValue;

import com.portfoliosync.integration.venues.Venue;
import java.net.URI;
import java.time.Duration;

public record FinamConfig(
    URI baseUri,
    String secret,
    String accountId,
    Duration timeout,
    Duration defaultLookback,
    int authPerMinute,
    int accountsPerMinute,
    int marketPerMinute)
    implements VenueConfig {
  public static final URI DEFAULT_URI = URI.create("https://api.finam.ru");
  public static final Duration DEFAULT_LOOKBACK = Duration.ofDays(30);

  public FinamConfig {
    Venue venue = Venue.FINAM;
    requireValue(venue, baseUri, "baseUri");
    secret = require(venue, secret, "secret");
    accountId = require(venue, accountId, "accountId");
    requirePositive(venue, timeout, "timeout");
    requirePositive(venue, defaultLookback, "defaultLookback");
    requirePositive(venue, authPerMinute, "authPerMinute");
    requirePositive(venue, accountsPerMinute, "accountsPerMinute");
    requirePositive(venue, marketPerMinute, "marketPerMinute");
  }

  @Override
  public Venue venue() {
    return Venue.FINAM;
  }
}
