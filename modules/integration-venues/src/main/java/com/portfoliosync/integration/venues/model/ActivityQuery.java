package com.portfoliosync.integration.venues.model;

import java.time.Instant;
import java.util.List;

/**
 * Activity window for one fetch. {@code since} is inclusive and may be null for the venue's
 * default lookback; {@code cursor} is an opaque pagination token from a previous run.
 */
public record ActivityQuery(Instant since, int limit, List<String> quoteAssets, String cursor) {
  public static final int DEFAULT_LIMIT = 200;

  public ActivityQuery {
    if (limit <= 0) {
      throw new IllegalArgumentException("limit must be > 0");
    }
    quoteAssets =
        quoteAssets == null || quoteAssets.isEmpty()
            ? SymbolSplitter.DEFAULT_QUOTE_ASSETS
            : List.copyOf(quoteAssets);
  }

  public static ActivityQuery since(Instant since, int limit) {
    return new ActivityQuery(since, limit, null, null);
  }

  public ActivityQuery withQuoteAssets(List<String> assets) {
    return new ActivityQuery(since, limit, assets, cursor);
  }
}
