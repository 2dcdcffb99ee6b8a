package com.portfoliosync.integration.venues.model;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.math.BigDecimal;
import org.junit.jupiter.api.Test;

class PositionSideTest {
  @Test
  void shouldPreferExplicitFlag() {
    assertEquals(PositionSide.SHORT, PositionSide.resolve("Sell", new BigDecimal("3")));
    assertEquals(PositionSide.LONG, PositionSide.resolve("long", new BigDecimal("-3")));
  }

  @Test
  void shouldFallBackToSignForNetOrMissingFlag() {
    assertEquals(PositionSide.SHORT, PositionSide.resolve("net", new BigDecimal("-0.5")));
    assertEquals(PositionSide.LONG, PositionSide.resolve(null, new BigDecimal("2")));
    assertEquals(PositionSide.UNKNOWN, PositionSide.resolve("BOTH", BigDecimal.ZERO));
    assertEquals(PositionSide.UNKNOWN, PositionSide.resolve(null, null));
  }
}
