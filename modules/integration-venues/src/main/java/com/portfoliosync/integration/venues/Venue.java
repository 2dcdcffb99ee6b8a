package com.portfoliosync.integration.venues;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;

public enum Venue {
  BINANCE("binance", VenueKind.CRYPTO_EXCHANGE),
  BYBIT("bybit", VenueKind.CRYPTO_EXCHANGE),
  OKX("okx", VenueKind.CRYPTO_EXCHANGE),
  TBANK("tbank", VenueKind.RU_BROKER),
  BCS("bcs", VenueKind.RU_BROKER),
  FINAM("finam", VenueKind.RU_BROKER),
  TON("ton", VenueKind.WALLET);

  private static final Map<String, Venue> ALIASES =
      Map.ofEntries(
          Map.entry("binance", BINANCE),
          Map.entry("bybit", BYBIT),
          Map.entry("okx", OKX),
          Map.entry("t", TBANK),
          Map.entry("tinkoff", TBANK),
          Map.entry("t-bank", TBANK),
          Map.entry("tbank", TBANK),
          Map.entry("bcs", BCS),
          Map.entry("bks", BCS),
          Map.entry("finam", FINAM),
          Map.entry("ton", TON));

  private final String code;
  private final VenueKind kind;

  Venue(String code, VenueKind kind) {
    this.code = code;
    this.kind = kind;
  }

  public String code() {
    return code;
  }

  public VenueKind kind() {
    return kind;
  }

  public static Optional<Venue> fromExchangeName(String exchangeName) {
    if (exchangeName == null || exchangeName.isBlank()) {
      return Optional.empty();
    }
    return Optional.ofNullable(ALIASES.get(exchangeName.trim().toLowerCase(Locale.ROOT)));
  }

  public enum VenueKind {
    CRYPTO_EXCHANGE,
    RU_BROKER,
    WALLET
  }
}
