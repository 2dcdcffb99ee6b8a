package com.portfoliosync.integration.venues.config;

import static com.portfoliosync.integration.venues.config.ConfigChecks.require;
import static com.portfoliosync.integration.venues.config.ConfigChecks.requirePositive;
import static com.portfoliosync.integration.venues.config.ConfigChecks.requireValue;

import com.portfoliosync.integration.venues.Venue;
import com.portfoliosync.integration.venues.VenueConfigurationException;
import java.net.URI;
import java.time.Duration;
import java.util.List;
import java.util.Map;

public record BybitConfig(
    URI baseUri,
    String apiKey,
    String apiSecret,
    long recvWindowMs,
    Duration timeout,
    String accountType,
    List<String> positionCategories,
    Map<String, String> settleCoins,
    List<String> quoteAssets,
    double requestsPerSecond)
    implements VenueConfig {
  public static final URI MAINNET_URI = URI.create("https://api.bybit.com");
  public static final URI TESTNET_URI = URI.create("https://api-testnet.bybit.com");
  public static final List<String> DEFAULT_CATEGORIES = List.of("linear", "inverse");
  public static final Map<String, String> DEFAULT_SETTLE_COINS = Map.of("linear", "USDT", "inverse", "BTC");

  public BybitConfig {
    Venue venue = Venue.BYBIT;
    requireValue(venue, baseUri, "baseUri");
    apiKey = require(venue, apiKey, "apiKey");
    apiSecret = require(venue, apiSecret, "apiSecret");
    if (recvWindowMs <= 0) {
      throw new VenueConfigurationException(venue, "bybit recvWindowMs must be > 0");
    }
    requirePositive(venue, timeout, "timeout");
    requirePositive(venue, requestsPerSecond, "requestsPerSecond");
    accountType = require(venue, accountType, "accountType");
    positionCategories =
        positionCategories == null || positionCategories.isEmpty()
            ? DEFAULT_CATEGORIES
            : List.copyOf(positionCategories);
    for (String category : positionCategories) {
      if (!DEFAULT_CATEGORIES.contains(category)) {
        throw new VenueConfigurationException(
            venue, "bybit position category must be linear or inverse: " + category);
      }
    }
    settleCoins = settleCoins == null ? DEFAULT_SETTLE_COINS : Map.copyOf(settleCoins);
    quoteAssets = List.copyOf(requireValue(venue, quoteAssets, "quoteAssets"));
  }

  @Override
  public Venue venue() {
    return Venue.BYBIT;
  }
}
