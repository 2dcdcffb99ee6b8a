package com.portfoliosync.integration.venues.config;

import static com.portfoliosync.integration.venues.config.ConfigChecks.require;
import static com.portfoliosync.integration.venues.config.ConfigChecks.requirePositive;
import static com.portfoliosync.integration.venues.config.ConfigChecks.requireValue;

import com.portfoliosync.integration.venues.Venue;
import com.portfoliosync.integration.venues.VenueConfigurationException;
import java.net.URI;
import java.time.Duration;
import java.util.List;

public record BinanceConfig(
    URI spotBaseUri,
    URI usdMarginedBaseUri,
    URI coinMarginedBaseUri,
    String apiKey,
    String apiSecret,
    long recvWindowMs,
    Duration timeout,
    List<String> quoteAssets,
    List<String> spotSymbols,
    List<String> usdMarginedSymbols,
    List<String> coinMarginedSymbols,
    double requestsPerSecond)
    implements VenueConfig {
  public static final URI SPOT_URI = URI.create("https://api.binance.com");
  public static final URI USD_M_URI = URI.create("https://fapi.binance.com");
  public static final URI COIN_M_URI = URI.create("https://dapi.binance.com");
  public static final URI SPOT_TESTNET_URI = URI.create("https://testnet.binance.vision");
  public static final URI FUTURES_TESTNET_URI = URI.create("https://testnet.binancefuture.com");

  public BinanceConfig {
    Venue venue = Venue.BINANCE;
    requireValue(venue, spotBaseUri, "spotBaseUri");
    requireValue(venue, usdMarginedBaseUri, "usdMarginedBaseUri");
    requireValue(venue, coinMarginedBaseUri, "coinMarginedBaseUri");
    apiKey = require(venue, apiKey, "apiKey");
    apiSecret = require(venue, apiSecret, "apiSecret");
    if (recvWindowMs <= 0 || recvWindowMs > 60_000) {
      throw new VenueConfigurationException(venue, "binance recvWindowMs must be in (0, 60000]");
    }
    requirePositive(venue, timeout, "timeout");
    requirePositive(venue, requestsPerSecond, "requestsPerSecond");
    quoteAssets = List.copyOf(requireValue(venue, quoteAssets, "quoteAssets"));
    spotSymbols = spotSymbols == null ? List.of() : List.copyOf(spotSymbols);
    usdMarginedSymbols = usdMarginedSymbols == null ? List.of() : List.copyOf(usdMarginedSymbols);
    coinMarginedSymbols = coinMarginedSymbols == null ? List.of() : List.copyOf(coinMarginedSymbols);
  }

  @Override
  public Venue venue() {
    return Venue.BINANCE;
  }
}
