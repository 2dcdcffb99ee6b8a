package com.portfoliosync.integration.venues.config;

import static com.portfoliosync.integration.venues.config.ConfigChecks.require;
import static com.portfoliosync.integration.venues.config.ConfigChecks.requirePositive;
import static com.portfoliosync.integration.venues.config.ConfigChecks.requireValue;

import com.portfoliosync.integration.venues.Venue;
import com.portfoliosync.integration.venues.VenueConfigurationException;
import java.net.URI;
import java.time.Duration;
import java.time.Instant;

/**
 * BCS Trade API settings. Only the refresh token is mandatory; a missing or expired access token
 * is renewed on first use.
 */
public record BcsConfig(
    URI baseUri,
    String clientId,
    String accessToken,
    String refreshToken,
    Instant accessExpiresAt,
    Instant refreshExpiresAt,
    Duration tokenRefreshMargin,
    Duration timeout,
    int requestsPerSecond)
    implements VenueConfig {
  public static final URI DEFAULT_URI = URI.create("https://be.broker.ru");
  public static final String DEFAULT_CLIENT_ID = "trade-api-read";
  public static final Duration DEFAULT_REFRESH_MARGIN = Duration.ofSeconds(300);

  public BcsConfig {
    Venue venue = Venue.BCS;
    requireValue(venue, baseUri, "baseUri");
    clientId = clientId == null || clientId.isBlank() ? DEFAULT_CLIENT_ID : clientId.trim();
    refreshToken = require(venue, refreshToken, "refreshToken");
    accessToken = accessToken == null || accessToken.isBlank() ? null : accessToken.trim();
    requireValue(venue, tokenRefreshMargin, "tokenRefreshMargin");
    if (tokenRefreshMargin.isNegative()) {
      throw new VenueConfigurationException(venue, "bcs tokenRefreshMargin must be >= 0");
    }
    requirePositive(venue, timeout, "timeout");
    requirePositive(venue, requestsPerSecond, "requestsPerSecond");
  }

  @Override
  public Venue venue() {
    return Venue.BCS;
  }
}
