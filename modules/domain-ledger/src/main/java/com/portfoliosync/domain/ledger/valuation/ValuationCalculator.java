package com.portfoliosync.domain.ledger.valuation;

import com.portfoliosync.domain.ledger.TransactionType;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Daily valuation arithmetic. Only prices already quoted in the base currency are used; holdings
 * in other currencies stay unpriced.
 */
public final class ValuationCalculator {
  public static final String DEFAULT_BASE_CURRENCY = "USD";

  private ValuationCalculator() {}

  public static PortfolioValuation value(
      String baseCurrency,
      List<Holding> holdings,
      LatestPriceLookup latestPrices,
      List<CashFlow> flows,
      BigDecimal previousValue) {
    String base = baseCurrency(baseCurrency);
    List<PositionValue> positions = new ArrayList<>(holdings.size());
    BigDecimal total = BigDecimal.ZERO;
    for (Holding holding : holdings) {
      BigDecimal price = unitPrice(holding, base, latestPrices);
      BigDecimal value = price == null ? null : holding.quantity().multiply(price);
      if (value != null) {
        total = total.add(value);
      }
      positions.add(new PositionValue(holding.assetId(), holding.quantity(), price, value));
    }
    BigDecimal netFlow = netFlow(flows, base);
    return new PortfolioValuation(base, positions, total, netFlow, pnl(total, previousValue, netFlow));
  }

  public static String baseCurrency(String configured) {
    String normalized = normalize(configured);
    return normalized == null ? DEFAULT_BASE_CURRENCY : normalized;
  }

  /**
   * Positive average buy price in base first, then the latest base-currency trade price of the
   * asset. A zero average price counts as unknown.
   */
  public static BigDecimal unitPrice(Holding holding, String base, LatestPriceLookup latestPrices) {
    if (holding.avgBuyPrice() != null
        && holding.avgBuyPrice().signum() > 0
        && base.equals(normalize(holding.buyCurrency()))) {
      return holding.avgBuyPrice();
    }
    if (base.equals(normalize(holding.assetCurrency()))) {
      return latestPrices.latestPrice(holding.assetId(), base);
    }
    return null;
  }

  public static BigDecimal netFlow(List<CashFlow> flows, String base) {
    BigDecimal net = BigDecimal.ZERO;
    for (CashFlow flow : flows) {
      BigDecimal value;
      if (flow.price() != null && base.equals(normalize(flow.priceCurrency()))) {
        value = flow.amount().multiply(flow.price());
      } else if (base.equals(normalize(flow.assetCurrency()))) {
        value = flow.amount();
      } else {
        continue;
      }
      net = flow.type() == TransactionType.WITHDRAWAL ? net.subtract(value) : net.add(value);
    }
    return net;
  }

  /** Without a previous day the baseline is zero. */
  public static BigDecimal pnl(BigDecimal total, BigDecimal previousValue, BigDecimal netFlow) {
    BigDecimal previous = previousValue == null ? BigDecimal.ZERO : previousValue;
    return total.subtract(previous).subtract(netFlow);
  }

  private static String normalize(String currency) {
    if (currency == null || currency.isBlank()) {
      return null;
    }
    return currency.trim().toUpperCase(Locale.ROOT);
  }
}
