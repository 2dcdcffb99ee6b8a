package com.portfoliosync.domain.ledger.valuation;

import java.math.BigDecimal;

@FunctionalInterface
public interface LatestPriceLookup {
  /** Price of the most recent transaction of the asset recorded in {@code baseCurrency}, or null. */
  BigDecimal latestPrice(long assetId, String baseCurrency);
}
