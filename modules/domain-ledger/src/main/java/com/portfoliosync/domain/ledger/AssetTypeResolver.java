package com.portfoliosync.domain.ledger;

import java.util.Locale;
import java.util.Set;

public final class AssetTypeResolver {
  public static final String CRYPTO = "crypto";
  public static final String CURRENCY = "currency";
  public static final String STOCK_RU = "stock_ru";

  static final Set<String> FIAT_CODES =
      Set.of("USD", "EUR", "RUB", "GBP", "CNY", "JPY", "HKD", "CHF", "AED", "TRY", "KZT", "BYN");

  private AssetTypeResolver() {}

  public static String resolve(SourceType sourceType, String symbol) {
    if (sourceType != SourceType.RU_BROKERS) {
      return CRYPTO;
    }
    return isFiat(symbol) ? CURRENCY : STOCK_RU;
  }

  public static boolean isFiat(String symbol) {
    return symbol != null && FIAT_CODES.contains(symbol.trim().toUpperCase(Locale.ROOT));
  }

  /** Synthetic market url, e.g. {@code binance:BTC}. */
  public static String marketUrl(String venueCode, String symbol) {
    return venueCode + ":" + symbol;
  }
}
