package com.portfoliosync.domain.ledger.valuation;

import com.portfoliosync.domain.ledger.LedgerDomainException;
import com.portfoliosync.domain.ledger.TransactionType;
import java.math.BigDecimal;
import java.util.Objects;

/** A deposit or withdrawal booked on the valuation date. */
public record CashFlow(
    TransactionType type, BigDecimal amount, BigDecimal price, String priceCurrency, String assetCurrency) {
  public CashFlow {
    Objects.requireNonNull(type, "type must not be null");
    if (!type.isCashFlow()) {
      throw new LedgerDomainException("Cash flow must be a deposit or withdrawal, got " + type);
    }
    amount = amount == null ? BigDecimal.ZERO : amount;
  }
}
