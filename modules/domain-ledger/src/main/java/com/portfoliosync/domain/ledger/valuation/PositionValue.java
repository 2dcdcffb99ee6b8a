package com.portfoliosync.domain.ledger.valuation;

import java.math.BigDecimal;

/** {@code priceBase} and {@code valueBase} are null when no base-currency price is known. */
public record PositionValue(long assetId, BigDecimal quantity, BigDecimal priceBase, BigDecimal valueBase) {}
