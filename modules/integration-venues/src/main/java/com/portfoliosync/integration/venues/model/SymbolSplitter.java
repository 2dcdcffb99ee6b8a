package com.portfoliosync.integration.venues.model;

import java.util.Comparator;
import java.util.List;
import java.util.Locale;

public final class SymbolSplitter {
  public static final List<String> DEFAULT_QUOTE_ASSETS =
      List.of("USDT", "USDC", "USD", "BTC", "ETH", "EUR", "RUB");

  private SymbolSplitter() {}

  public static SplitSymbol split(String symbol) {
    return split(symbol, DEFAULT_QUOTE_ASSETS);
  }

  /**
   * Splits a trading pair. An explicit {@code /} or {@code -} separator wins (a trailing contract
   * suffix such as {@code BTC-USDT-SWAP} is dropped), then the longest
   * allow-listed quote asset the symbol ends with. Without a match the whole symbol is the base.
   */
  public static SplitSymbol split(String symbol, List<String> quoteAssets) {
    if (symbol == null || symbol.isBlank()) {
      return new SplitSymbol(null, null);
    }
    String upper = symbol.trim().toUpperCase(Locale.ROOT);
    for (String separator : List.of("/", "-")) {
      int index = upper.indexOf(separator);
      if (index > 0 && index < upper.length() - 1) {
        String rest = upper.substring(index + 1);
        int next = indexOfSeparator(rest);
        return new SplitSymbol(upper.substring(0, index), next > 0 ? rest.substring(0, next) : rest);
      }
    }
    List<String> allowList =
        quoteAssets == null || quoteAssets.isEmpty() ? DEFAULT_QUOTE_ASSETS : quoteAssets;
    List<String> candidates =
        allowList.stream()
            .map(quote -> quote.trim().toUpperCase(Locale.ROOT))
            .filter(quote -> !quote.isEmpty())
            .sorted(Comparator.comparingInt(String::length).reversed())
            .toList();
    for (String quote : candidates) {
      if (upper.length() > quote.length() && upper.endsWith(quote)) {
        return new SplitSymbol(upper.substring(0, upper.length() - quote.length()), quote);
      }
    }
    return new SplitSymbol(upper, null);
  }

  private static int indexOfSeparator(String value) {
    int slash = value.indexOf('/');
    int dash = value.indexOf('-');
    if (slash < 0) {
      return dash;
    }
    return dash < 0 ? slash : Math.min(slash, dash);
  }

  public record SplitSymbol(String base, String quote) {}
}
