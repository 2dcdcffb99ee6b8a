package com.portfoliosync.domain.ledger.valuation;

import java.math.BigDecimal;
import java.util.List;

public record PortfolioValuation(
    String baseCurrency,
    List<PositionValue> positions,
    BigDecimal valueBase,
    BigDecimal netFlowBase,
    BigDecimal pnlBase) {
  public PortfolioValuation {
    positions = List.copyOf(positions);
  }
}
