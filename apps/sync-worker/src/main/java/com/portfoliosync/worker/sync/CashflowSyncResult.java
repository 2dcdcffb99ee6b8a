package com.portfoliosync.worker.sync;

import java.time.LocalDate;
import java.util.List;

public record CashflowSyncResult(
    long portfolioId,
    LocalDate date,
    int integrationsChecked,
    int activitiesFound,
    int transactionsCreated,
    int skippedMissingAsset,
    int skippedMissingAmount,
    List<String> errors) {
  public CashflowSyncResult {
    errors = List.copyOf(errors);
  }
}
