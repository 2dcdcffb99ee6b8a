package com.portfoliosync.integration.venues.model;

import java.math.BigDecimal;

public record Position(
    String symbol,
    PositionSide side,
    BigDecimal size,
    BigDecimal entryPrice,
    BigDecimal markPrice,
    BigDecimal unrealizedPnl,
    BigDecimal leverage,
    String currency) {
  public Position {
    if (symbol == null || symbol.isBlank()) {
      throw new IllegalArgumentException("symbol is required");
    }
    if (side == null) {
      side = PositionSide.UNKNOWN;
    }
  }

  public static Position holding(
      String symbol,
      BigDecimal size,
      BigDecimal averagePrice,
      BigDecimal currentPrice,
      BigDecimal unrealizedPnl,
      String currency) {
    return new Position(
        symbol,
        PositionSide.resolve(null, size),
        size,
        averagePrice,
        currentPrice,
        unrealizedPnl,
        null,
        currency);
  }
}
