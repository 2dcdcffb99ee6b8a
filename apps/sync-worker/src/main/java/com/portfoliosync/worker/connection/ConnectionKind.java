package com.portfoliosync.worker.connection;

public enum ConnectionKind {
  INTEGRATION,
  TON_WALLET
}
