package com.portfoliosync.domain.ledger;

import java.util.Arrays;
import java.util.Optional;

/** Broad venue category. Each one has its own sync queue. */
public enum SourceType {
  CRYPTO("sync_crypto"),
  RU_BROKERS("sync_ru_brokers"),
  TON("sync_ton");

  private final String queueName;

  SourceType(String queueName) {
    this.queueName = queueName;
  }

  public String queueName() {
    return queueName;
  }

  public static Optional<SourceType> fromQueueName(String queueName) {
    return Arrays.stream(values()).filter(type -> type.queueName.equals(queueName)).findFirst();
  }
}
