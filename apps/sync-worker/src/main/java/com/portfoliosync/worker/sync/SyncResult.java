package com.portfoliosync.worker.sync;

public record SyncResult(
    long integrationId,
    long portfolioId,
    int newTxCount,
    int positionsCount,
    int balancesCount,
    int skippedMissingAsset,
    int skippedMissingAmount,
    long durationMs) {}
