package com.portfoliosync.infra.kafka.contract.payload;

import java.time.LocalDate;
import java.util.Objects;

public record RunUserAnalyticsTaskV1(long batchId, long userId, LocalDate snapshotDate) {
  public RunUserAnalyticsTaskV1 {
    Objects.requireNonNull(snapshotDate, "snapshotDate must not be null");
  }
}
