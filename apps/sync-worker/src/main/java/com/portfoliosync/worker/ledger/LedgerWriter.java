package com.portfoliosync.worker.ledger;

import com.portfoliosync.domain.ledger.AssetCatalog;
import com.portfoliosync.domain.ledger.AssetCatalog.AssetSpec;
import com.portfoliosync.domain.ledger.AssetTypeResolver;
import com.portfoliosync.domain.ledger.SourceType;
import com.portfoliosync.domain.ledger.TransactionDraft;
import com.portfoliosync.integration.venues.model.Balance;
import com.portfoliosync.integration.venues.model.Position;
import java.math.BigDecimal;
import java.sql.Timestamp;
import java.util.List;
import java.util.Locale;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

/** Writes normalized venue data into the ledger tables. Every write is idempotent. */
@Repository
public class LedgerWriter {
  private final JdbcTemplate jdbcTemplate;
  private final AssetCatalog assetCatalog;
  private final TransactionTemplate transactionTemplate;

  public LedgerWriter(
      JdbcTemplate jdbcTemplate,
      AssetCatalog assetCatalog,
      PlatformTransactionManager transactionManager) {
    this.jdbcTemplate = jdbcTemplate;
    this.assetCatalog = assetCatalog;
    this.transactionTemplate = new TransactionTemplate(transactionManager);
  }

  /** Inserts the drafts in one batch and returns how many rows were new. */
  public int insertTransactions(List<TransactionDraft> drafts) {
    if (drafts.isEmpty()) {
      return 0;
    }
    String sql =
        """
            INSERT INTO transactions (
                portfolio_id,
                asset_id,
                integration_id,
                transaction_type,
                amount,
                price,
                price_currency,
                executed_at,
                created_at,
                source,
                integration_dedupe_key
            ) VALUES (?, ?, ?, ?, ?, ?, ?, ?, NOW(), ?, ?)
            ON CONFLICT (integration_id, integration_dedupe_key) DO NOTHING
            """;
    int[][] counts =
        transactionTemplate.execute(
            status ->
                jdbcTemplate.batchUpdate(
                    sql,
                    drafts,
                    Math.max(1, drafts.size()),
                    (ps, draft) -> {
                      ps.setLong(1, draft.portfolioId());
                      ps.setLong(2, draft.assetId());
                      ps.setLong(3, draft.integrationId());
                      ps.setString(4, draft.type().code());
                      ps.setBigDecimal(5, draft.amount());
                      ps.setBigDecimal(6, draft.price());
                      ps.setString(7, draft.priceCurrency());
                      ps.setTimestamp(
                          8, draft.executedAt() == null ? null : Timestamp.from(draft.executedAt()));
                      ps.setString(9, TransactionDraft.SOURCE);
                      ps.setString(10, draft.dedupeKey());
                    }));
    int inserted = 0;
    if (counts != null) {
      for (int[] batch : counts) {
        for (int count : batch) {
          if (count > 0) {
            inserted += count;
          }
        }
      }
    }
    return inserted;
  }

  /** Sets the held quantity of each balance's asset; balances without a quantity are skipped. */
  public int upsertBalances(
      long portfolioId, SourceType sourceType, String venueCode, List<Balance> balances) {
    int updated = 0;
    for (Balance balance : balances) {
      BigDecimal quantity = balance.quantity();
      if (quantity == null) {
        continue;
      }
      String symbol = balance.asset();
      long assetId =
          assetCatalog.getOrCreate(
              new AssetSpec(
                  symbol,
                  AssetTypeResolver.resolve(sourceType, symbol),
                  AssetTypeResolver.marketUrl(venueCode, symbol),
                  symbol));
      jdbcTemplate.update(
          """
              INSERT INTO portfolio_assets (portfolio_id, asset_id, quantity, updated_at)
              VALUES (?, ?, ?, NOW())
              ON CONFLICT (portfolio_id, asset_id) DO UPDATE
              SET quantity = EXCLUDED.quantity,
                  updated_at = NOW()
              """,
          portfolioId,
          assetId,
          quantity);
      updated++;
    }
    return updated;
  }

  /**
   * Sets quantity from each position's size. Average price and currency are only overwritten when
   * the venue reports them.
   */
  public int upsertPositions(
      long portfolioId, SourceType sourceType, String venueCode, List<Position> positions) {
    int updated = 0;
    for (Position position : positions) {
      if (position.size() == null) {
        continue;
      }
      String symbol = position.symbol().trim().toUpperCase(Locale.ROOT);
      String currency = upperOrNull(position.currency());
      long assetId =
          assetCatalog.getOrCreate(
              new AssetSpec(
                  symbol,
                  AssetTypeResolver.resolve(sourceType, symbol),
                  AssetTypeResolver.marketUrl(venueCode, symbol),
                  currency != null ? currency : symbol));
      jdbcTemplate.update(
          """
              INSERT INTO portfolio_assets (
                  portfolio_id, asset_id, quantity, avg_buy_price, buy_currency, updated_at)
              VALUES (?, ?, ?, ?, ?, NOW())
              ON CONFLICT (portfolio_id, asset_id) DO UPDATE
              SET quantity = EXCLUDED.quantity,
                  avg_buy_price = COALESCE(EXCLUDED.avg_buy_price, portfolio_assets.avg_buy_price),
                  buy_currency = COALESCE(EXCLUDED.buy_currency, portfolio_assets.buy_currency),
                  updated_at = NOW()
              """,
          portfolioId,
          assetId,
          position.size(),
          position.entryPrice(),
          currency);
      updated++;
    }
    return updated;
  }

  private static String upperOrNull(String value) {
    if (value == null || value.isBlank()) {
      return null;
    }
    return value.trim().toUpperCase(Locale.ROOT);
  }
}
