package com.portfoliosync.integration.venues.model;

import java.math.BigDecimal;
import java.util.Locale;

public enum PositionSide {
  LONG,
  SHORT,
  UNKNOWN;

  /**
   * Resolves the side of a position. An explicit long/short (or buy/sell) flag wins; a NET or
   * missing flag falls back to the sign of the size.
   */
  public static PositionSide resolve(String explicitSide, BigDecimal signedSize) {
    if (explicitSide != null) {
      switch (explicitSide.trim().toUpperCase(Locale.ROOT)) {
        case "LONG", "BUY" -> {
          return LONG;
        }
        case "SHORT", "SELL" -> {
          return SHORT;
        }
        default -> {
          // NET, BOTH and unknown flags fall through to the sign.
        }
      }
    }
    if (signedSize == null || signedSize.signum() == 0) {
      return UNKNOWN;
    }
    return signedSize.signum() > 0 ? LONG : SHORT;
  }
}
