package com.portfoliosync.domain.ledger;

import java.util.Objects;

/**
 * Where activities come from: the integration, the portfolio they are booked into, the venue
 * category and the venue code used as the market-url prefix.
 */
public record NormalizationContext(long integrationId, long portfolioId, SourceType sourceType, String venueCode) {
  public NormalizationContext {
    Objects.requireNonNull(sourceType, "sourceType must not be null");
    if (venueCode == null || venueCode.isBlank()) {
      throw new LedgerDomainException("venueCode must not be blank");
    }
  }
}
