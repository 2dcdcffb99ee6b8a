package com.portfoliosync.domain.ledger;

public enum SkipReason {
  UNSUPPORTED_TYPE,
  MISSING_ASSET,
  MISSING_AMOUNT
}
