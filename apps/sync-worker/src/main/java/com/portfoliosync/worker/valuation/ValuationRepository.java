package com.portfoliosync.worker.valuation;

import com.portfoliosync.domain.ledger.TransactionType;
import com.portfoliosync.domain.ledger.valuation.CashFlow;
import com.portfoliosync.domain.ledger.valuation.Holding;
import com.portfoliosync.domain.ledger.valuation.PortfolioValuation;
import com.portfoliosync.domain.ledger.valuation.PositionValue;
import java.math.BigDecimal;
import java.sql.Date;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
public class ValuationRepository {
  private final JdbcTemplate jdbcTemplate;

  public ValuationRepository(JdbcTemplate jdbcTemplate) {
    this.jdbcTemplate = jdbcTemplate;
  }

  /** Locks the portfolio row for the rest of the transaction and returns its base currency. */
  public Optional<String> lockPortfolio(long portfolioId) {
    List<String> rows =
        jdbcTemplate.query(
            "SELECT COALESCE(base_currency, '') AS base_currency FROM portfolios WHERE id = ? FOR UPDATE",
            (rs, rowNum) -> rs.getString("base_currency"),
            portfolioId);
    return rows.stream().findFirst();
  }

  public List<Long> portfolioIdsForUser(long userId) {
    return jdbcTemplate.queryForList(
        "SELECT id FROM portfolios WHERE user_id = ? ORDER BY id", Long.class, userId);
  }

  public List<Holding> holdings(long portfolioId) {
    String sql =
        """
            SELECT pa.asset_id, pa.quantity, pa.avg_buy_price, pa.buy_currency, a.currency
            FROM portfolio_assets pa
            JOIN assets a ON a.id = pa.asset_id
            WHERE pa.portfolio_id = ?
            ORDER BY pa.asset_id
            """;
    return jdbcTemplate.query(
        sql,
        (rs, rowNum) ->
            new Holding(
                rs.getLong("asset_id"),
                rs.getBigDecimal("quantity"),
                rs.getBigDecimal("avg_buy_price"),
                rs.getString("buy_currency"),
                rs.getString("currency")),
        portfolioId);
  }

  /** Price of the newest transaction of the asset quoted in {@code baseCurrency}; undated rows sort last. */
  public BigDecimal latestPrice(long portfolioId, long assetId, String baseCurrency) {
    String sql =
        """
            SELECT price
            FROM transactions
            WHERE portfolio_id = ?
              AND asset_id = ?
              AND price_currency = ?
            ORDER BY executed_at DESC NULLS LAST, created_at DESC
            LIMIT 1
            """;
    List<BigDecimal> prices =
        jdbcTemplate.query(
            sql, (rs, rowNum) -> rs.getBigDecimal("price"), portfolioId, assetId, baseCurrency);
    return prices.isEmpty() ? null : prices.get(0);
  }

  /**
   * Deposits and withdrawals dated on {@code date} in {@code zone}; the creation time stands in for
   * a missing execution time.
   */
  public List<CashFlow> cashFlows(long portfolioId, LocalDate date, String zone) {
    String sql =
        """
            SELECT t.transaction_type, t.amount, t.price, t.price_currency, a.currency
            FROM transactions t
            JOIN assets a ON a.id = t.asset_id
            WHERE t.portfolio_id = ?
              AND t.transaction_type IN ('deposit', 'withdrawal')
              AND CAST(COALESCE(t.executed_at, t.created_at) AT TIME ZONE ? AS DATE) = ?
            ORDER BY t.id
            """;
    return jdbcTemplate.query(
        sql,
        (rs, rowNum) ->
            new CashFlow(
                TransactionType.fromCode(rs.getString("transaction_type")),
                rs.getBigDecimal("amount"),
                rs.getBigDecimal("price"),
                rs.getString("price_currency"),
                rs.getString("currency")),
        portfolioId,
        zone,
        Date.valueOf(date));
  }

  public Optional<BigDecimal> valueOn(long portfolioId, LocalDate date) {
    List<BigDecimal> values =
        jdbcTemplate.query(
            "SELECT value_base FROM portfolio_valuation_daily WHERE portfolio_id = ? AND snapshot_date = ?",
            (rs, rowNum) -> rs.getBigDecimal("value_base"),
            portfolioId,
            Date.valueOf(date));
    return values.stream().findFirst();
  }

  public void upsertPosition(long portfolioId, LocalDate date, PositionValue position) {
    jdbcTemplate.update(
        """
            INSERT INTO portfolio_position_daily (
                portfolio_id, asset_id, snapshot_date, quantity, price_base, value_base)
            VALUES (?, ?, ?, ?, ?, ?)
            ON CONFLICT (portfolio_id, asset_id, snapshot_date) DO UPDATE
            SET quantity = EXCLUDED.quantity,
                price_base = EXCLUDED.price_base,
                value_base = EXCLUDED.value_base
            """,
        portfolioId,
        position.assetId(),
        Date.valueOf(date),
        position.quantity(),
        position.priceBase(),
        position.valueBase());
  }

  public void upsertValuation(long portfolioId, LocalDate date, PortfolioValuation valuation) {
    jdbcTemplate.update(
        """
            INSERT INTO portfolio_valuation_daily (
                portfolio_id, snapshot_date, base_currency, value_base, net_flow_base, pnl_base, updated_at)
            VALUES (?, ?, ?, ?, ?, ?, NOW())
            ON CONFLICT (portfolio_id, snapshot_date) DO UPDATE
            SET base_currency = EXCLUDED.base_currency,
                value_base = EXCLUDED.value_base,
                net_flow_base = EXCLUDED.net_flow_base,
                pnl_base = EXCLUDED.pnl_base,
                updated_at = NOW()
            """,
        portfolioId,
        Date.valueOf(date),
        valuation.baseCurrency(),
        valuation.valueBase(),
        valuation.netFlowBase(),
        valuation.pnlBase());
  }

  public UserMetrics userMetrics(long userId, LocalDate date) {
    String sql =
        """
            SELECT COUNT(*) AS portfolio_count, COALESCE(SUM(v.value_base), 0) AS total_value
            FROM portfolio_valuation_daily v
            JOIN portfolios p ON p.id = v.portfolio_id
            WHERE p.user_id = ?
              AND v.snapshot_date = ?
            """;
    return jdbcTemplate.queryForObject(
        sql,
        (rs, rowNum) -> new UserMetrics(rs.getInt("portfolio_count"), rs.getBigDecimal("total_value")),
        userId,
        Date.valueOf(date));
  }
}
