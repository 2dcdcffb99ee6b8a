package com.portfoliosync.domain.ledger;

public class LedgerDomainException extends RuntimeException {
  public LedgerDomainException(String message) {
    super(message);
  }
}
