package com.portfoliosync.integration.venues.auth;

/** Receives rotated credentials so the caller can persist them before the next run. */
@FunctionalInterface
public interface TokenUpdateListener {
  TokenUpdateListener NONE = tokens -> {};

  void onTokensRefreshed(RefreshedTokens tokens);
}
