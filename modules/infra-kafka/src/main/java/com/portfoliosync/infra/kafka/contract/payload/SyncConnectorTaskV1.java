package com.portfoliosync.infra.kafka.contract.payload;

import java.time.LocalDate;
import java.util.Objects;

/**
 * Sync of one connection. {@code connectionId} is the integration id, or the wallet id when
 * {@code connectionKind} is {@code TON_WALLET}. {@code attempt} starts at 1.
 */
public record SyncConnectorTaskV1(
    long batchId,
    long userId,
    long connectionId,
    String connectionKind,
    String sourceType,
    LocalDate snapshotDate,
    int attempt) {
  public SyncConnectorTaskV1 {
    if (connectionKind == null || connectionKind.isBlank()) {
      throw new IllegalArgumentException("connectionKind must not be blank");
    }
    if (sourceType == null || sourceType.isBlank()) {
      throw new IllegalArgumentException("sourceType must not be blank");
    }
    Objects.requireNonNull(snapshotDate, "snapshotDate must not be null");
    if (attempt < 1) {
      throw new IllegalArgumentException("attempt must be >= 1");
    }
  }

  public SyncConnectorTaskV1 nextAttempt() {
    return new SyncConnectorTaskV1(
        batchId, userId, connectionId, connectionKind, sourceType, snapshotDate, attempt + 1);
  }
}
