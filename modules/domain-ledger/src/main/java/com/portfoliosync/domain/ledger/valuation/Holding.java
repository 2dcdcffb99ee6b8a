package com.portfoliosync.domain.ledger.valuation;

import java.math.BigDecimal;

/** A current {@code portfolio_assets} row joined with its asset's currency. */
public record Holding(
    long assetId, BigDecimal quantity, BigDecimal avgBuyPrice, String buyCurrency, String assetCurrency) {
  public Holding {
    quantity = quantity == null ? BigDecimal.ZERO : quantity;
  }
}
