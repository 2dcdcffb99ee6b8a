package com.portfoliosync.worker.sync;

/** A sync failure that a later attempt may not repeat. */
public class TransientSyncException extends RuntimeException {
  public TransientSyncException(String message, Throwable cause) {
    super(message, cause);
  }
}
