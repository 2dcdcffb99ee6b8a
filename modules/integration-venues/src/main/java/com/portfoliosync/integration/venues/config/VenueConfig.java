package com.portfoliosync.integration.venues.config;

import com.portfoliosync.integration.venues.Venue;
import com.portfoliosync.integration.venues.model.ActivityQuery;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/** Validated connection settings for one venue integration. */
public sealed interface VenueConfig
    permits BinanceConfig, BybitConfig, OkxConfig, TBankConfig, BcsConfig, FinamConfig, TonConfig {
  Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

  Venue venue();

  Duration timeout();

  /** Quote-asset allowlist for splitting pair symbols; empty where the venue reports assets directly. */
  default List<String> quoteAssets() {
    return List.of();
  }

  /** Activity window carrying this integration's quote-asset allowlist. */
  default ActivityQuery activityQuery(Instant since, int limit, String cursor) {
    return new ActivityQuery(since, limit, quoteAssets(), cursor);
  }
}
