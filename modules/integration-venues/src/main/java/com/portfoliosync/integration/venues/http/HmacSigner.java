package com.portfoliosync.integration.venues.http;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.HexFormat;
import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;

public final class HmacSigner {
  private static final String ALGORITHM = "HmacSHA256";

  private HmacSigner() {}

  public static String hmacSha256Hex(String secret, String payload) {
    return HexFormat.of().formatHex(hmacSha256(secret, payload));
  }

  public static String hmacSha256Base64(String secret, String payload) {
    return Base64.getEncoder().encodeToString(hmacSha256(secret, payload));
  }

  private static byte[] hmacSha256(String secret, String payload) {
    try {
      Mac mac = Mac.getInstance(ALGORITHM);
      mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), ALGORITHM));
      return mac.doFinal(payload.getBytes(StandardCharsets.UTF_8));
    } catch (Exception ex) {
      throw new IllegalStateException("Failed to sign venue request", ex);
    }
  }
}
