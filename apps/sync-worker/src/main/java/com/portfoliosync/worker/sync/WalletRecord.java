package com.portfoliosync.worker.sync;

public record WalletRecord(long id, long integrationId, long portfolioId, String address, boolean active) {}
