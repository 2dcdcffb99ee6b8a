package com.portfoliosync.integration.venues.auth;

import java.time.Instant;

public record RefreshedTokens(
    String accessToken, String refreshToken, Instant accessExpiresAt, Instant refreshExpiresAt) {
  public RefreshedTokens {
    if (accessToken == null || accessToken.isBlank()) {
      throw new IllegalArgumentException("accessToken is required");
    }
  }
}
