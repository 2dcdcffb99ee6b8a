package com.portfoliosync.domain.ledger;

import java.util.Locale;

public enum TransactionType {
  BUY,
  SELL,
  FUTURES_BUY,
  FUTURES_SELL,
  DEPOSIT,
  WITHDRAWAL,
  CONVERSION;

  /** Value stored in {@code transactions.transaction_type}. */
  public String code() {
    return name().toLowerCase(Locale.ROOT);
  }

  public boolean isCashFlow() {
    return this == DEPOSIT || this == WITHDRAWAL;
  }

  public static TransactionType fromCode(String code) {
    if (code == null || code.isBlank()) {
      throw new LedgerDomainException("transaction type must not be blank");
    }
    try {
      return valueOf(code.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException ex) {
      throw new LedgerDomainException("Unknown transaction type: " + code);
    }
  }
}
