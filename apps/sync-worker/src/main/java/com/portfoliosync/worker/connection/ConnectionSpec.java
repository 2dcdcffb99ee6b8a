package com.portfoliosync.worker.connection;

import com.portfoliosync.domain.ledger.SourceType;
import java.util.Objects;

/**
 * One unit of sync work. {@code connectionId} is the integration id, or the wallet id for {@link
 * ConnectionKind#TON_WALLET}.
 */
public record ConnectionSpec(
    long userId,
    long portfolioId,
    long integrationId,
    long connectionId,
    ConnectionKind connectionKind,
    SourceType sourceType) {
  public ConnectionSpec {
    Objects.requireNonNull(connectionKind, "connectionKind must not be null");
    Objects.requireNonNull(sourceType, "sourceType must not be null");
  }
}
