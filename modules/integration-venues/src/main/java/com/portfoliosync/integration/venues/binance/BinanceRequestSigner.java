package com.portfoliosync.integration.venues.binance;

import com.portfoliosync.integration.venues.http.HmacSigner;
import com.portfoliosync.integration.venues.http.VenueHttpClient;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/** Appends timestamp, recvWindow and the HMAC-SHA256 signature to a Binance query string. */
public class BinanceRequestSigner {
  private final String apiSecret;
  private final long recvWindowMs;
  private final Clock clock;

  public BinanceRequestSigner(String apiSecret, long recvWindowMs, Clock clock) {
    this.apiSecret = Objects.requireNonNull(apiSecret, "apiSecret must not be null");
    this.recvWindowMs = Math.max(1L, recvWindowMs);
    this.clock = Objects.requireNonNull(clock, "clock must not be null");
  }

  public String signedQuery(Map<String, String> queryParams) {
    LinkedHashMap<String, String> normalized = new LinkedHashMap<>();
    if (queryParams != null) {
      queryParams.forEach(
          (key, value) -> {
            if (value != null && !value.isBlank()) {
              normalized.put(key, value);
            }
          });
    }
    normalized.put("timestamp", String.valueOf(clock.millis()));
    normalized.put("recvWindow", String.valueOf(recvWindowMs));

    String unsignedQuery = VenueHttpClient.queryString(normalized);
    String signature = HmacSigner.hmacSha256Hex(apiSecret, unsignedQuery);
    return unsignedQuery + "&signature=" + signature;
  }
}
