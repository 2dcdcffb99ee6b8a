package com.portfoliosync.integration.venues.config;

import static com.portfoliosync.integration.venues.config.ConfigChecks.require;
import static com.portfoliosync.integration.venues.config.ConfigChecks.requirePositive;
import static com.portfoliosync.integration.venues.config.ConfigChecks.requireValue;

import com.portfoliosync.integration.venues.Venue;
import java.net.URI;
import java.time.Duration;
import java.util.List;

public record OkxConfig(
    URI baseUri,
    String apiKey,
    String apiSecret,
    String passphrase,
    boolean demo,
    Duration timeout,
    List<String> positionInstTypes,
    List<String> fillInstTypes,
    List<String> quoteAssets,
    double requestsPerSecond)
    implements VenueConfig {
  public static final URI DEFAULT_URI = URI.create("https://www.okx.com");
  public static final List<String> DEFAULT_POSITION_INST_TYPES = List.of("SWAP", "FUTURES");
  public static final List<String> DEFAULT_FILL_INST_TYPES = List.of("SPOT", "SWAP", "FUTURES");

  public OkxConfig {
    Venue venue = Venue.OKX;
    requireValue(venue, baseUri, "baseUri");
    apiKey = require(venue, apiKey, "apiKey");
    apiSecret = require(venue, apiSecret, "apiSecret");
    passphrase = require(venue, passphrase, "passphrase");
    requirePositive(venue, timeout, "timeout");
    requirePositive(venue, requestsPerSecond, "requestsPerSecond");
    positionInstTypes =
        positionInstTypes == null || positionInstTypes.isEmpty()
            ? DEFAULT_POSITION_INST_TYPES
            : List.copyOf(positionInstTypes);
    fillInstTypes =
        fillInstTypes == null || fillInstTypes.isEmpty() ? DEFAULT_FILL_INST_TYPES : List.copyOf(fillInstTypes);
    quoteAssets = List.copyOf(requireValue(venue, quoteAssets, "quoteAssets"));
  }

  @Override
  public Venue venue() {
    return Venue.OKX;
  }
}
