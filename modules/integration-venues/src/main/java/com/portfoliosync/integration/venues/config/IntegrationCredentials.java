package com.portfoliosync.integration.venues.config;

import java.time.Instant;

/** Credential columns of one stored integration. Any of them may be null. */
public record IntegrationCredentials(
    String apiKey,
    String apiSecret,
    String passphrase,
    String token,
    String accessToken,
    String refreshToken,
    String clientId,
    String accountId,
    Instant tokenExpiresAt,
    Instant refreshExpiresAt) {

  public static IntegrationCredentials apiKey(String apiKey, String apiSecret) {
    return new IntegrationCredentials(apiKey, apiSecret, null, null, null, null, null, null, null, null);
  }

  public static IntegrationCredentials none() {
    return new IntegrationCredentials(null, null, null, null, null, null, null, null, null, null);
  }
}
