package com.portfoliosync.integration.venues.config;

import static com.portfoliosync.integration.venues.config.ConfigChecks.require;
import static com.portfoliosync.integration.venues.config.ConfigChecks.requirePositive;
import static com.portfoliosync.integration.venues.config.ConfigChecks.requireValue;

import com.portfoliosync.integration.venues.Venue;
import java.net.URI;
import java.time.Duration;

/** One TON wallet. {@code tonapiBaseUri} may be null to use Toncenter only. */
public record TonConfig(
    String address,
    URI toncenterBaseUri,
    URI tonapiBaseUri,
    String toncenterApiKey,
    String tonapiApiKey,
    boolean includeJettons,
    boolean includeStaking,
    Duration timeout,
    double requestsPerSecond)
    implements VenueConfig {
  public static final URI TONCENTER_URI = URI.create("https://toncenter.com/api/v2");
  public static final URI TONAPI_URI = URI.create("https://tonapi.io");

  public TonConfig {
    Venue venue = Venue.TON;
    address = require(venue, address, "wallet address");
    requireValue(venue, toncenterBaseUri, "toncenterBaseUri");
    toncenterApiKey = blankToNull(toncenterApiKey);
    tonapiApiKey = blankToNull(tonapiApiKey);
    requirePositive(venue, timeout, "timeout");
    requirePositive(venue, requestsPerSecond, "requestsPerSecond");
  }

  @Override
  public Venue venue() {
    return Venue.TON;
  }

  private static String blankToNull(String value) {
    return value == null || value.isBlank() ? null : value.trim();
  }
}
