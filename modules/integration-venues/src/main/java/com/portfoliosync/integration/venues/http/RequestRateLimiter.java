package com.portfoliosync.integration.venues.http;

/** Blocks the caller until a request may be sent. Callers sleep rather than fail. */
public interface RequestRateLimiter {
  RequestRateLimiter UNLIMITED = () -> {};

  void acquire() throws InterruptedException;
}
