package com.portfoliosync.domain.ledger;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Objects;

/** A transaction ready to insert; duplicates are dropped by {@code (integrationId, dedupeKey)}. */
public record TransactionDraft(
    long portfolioId,
    long assetId,
    long integrationId,
    TransactionType type,
    BigDecimal amount,
    BigDecimal price,
    String priceCurrency,
    Instant executedAt,
    String dedupeKey) {
  public static final String SOURCE = "INTEGRATION";

  public TransactionDraft {
    Objects.requireNonNull(type, "type must not be null");
    Objects.requireNonNull(amount, "amount must not be null");
    if (dedupeKey == null || dedupeKey.isBlank()) {
      throw new LedgerDomainException("dedupeKey must not be blank");
    }
    if (dedupeKey.length() > DedupeKeyGenerator.MAX_KEY_LENGTH) {
      throw new LedgerDomainException("dedupeKey must be at most " + DedupeKeyGenerator.MAX_KEY_LENGTH + " chars");
    }
  }
}
