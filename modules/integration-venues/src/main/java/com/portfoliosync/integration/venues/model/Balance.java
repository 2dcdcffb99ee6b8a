package com.portfoliosync.integration.venues.model;

import java.math.BigDecimal;
import java.util.Locale;

public record Balance(String asset, BigDecimal free, BigDecimal locked, BigDecimal total) {
  public Balance {
    if (asset == null || asset.isBlank()) {
      throw new IllegalArgumentException("asset is required");
    }
    asset = asset.trim().toUpperCase(Locale.ROOT);
  }

  public static Balance ofFreeAndLocked(String asset, BigDecimal free, BigDecimal locked) {
    BigDecimal total = free == null && locked == null ? null : orZero(free).add(orZero(locked));
    return new Balance(asset, free, locked, total);
  }

  /** Quantity held: total when the venue reports it, otherwise the free amount. */
  public BigDecimal quantity() {
    return total != null ? total : free;
  }

  private static BigDecimal orZero(BigDecimal value) {
    return value == null ? BigDecimal.ZERO : value;
  }
}
