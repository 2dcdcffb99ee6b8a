package com.portfoliosync.worker.ledger;

import com.portfoliosync.domain.ledger.AssetCatalog;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

/** Insert-if-absent on the unique keys, then read back, so concurrent syncs agree on one id. */
@Repository
public class JdbcAssetCatalog implements AssetCatalog {
  private final JdbcTemplate jdbcTemplate;

  public JdbcAssetCatalog(JdbcTemplate jdbcTemplate) {
    this.jdbcTemplate = jdbcTemplate;
  }

  @Override
  public long getOrCreate(AssetSpec spec) {
    long assetTypeId = assetTypeId(spec.assetTypeCode());
    jdbcTemplate.update(
        """
            INSERT INTO assets (symbol, name, asset_type_id, market_url, currency)
            VALUES (?, ?, ?, ?, ?)
            ON CONFLICT (symbol, asset_type_id) DO NOTHING
            """,
        spec.symbol(),
        spec.symbol(),
        assetTypeId,
        spec.marketUrl(),
        spec.currency());
    Long id =
        jdbcTemplate.queryForObject(
            "SELECT id FROM assets WHERE symbol = ? AND asset_type_id = ?",
            Long.class,
            spec.symbol(),
            assetTypeId);
    return id;
  }

  private long assetTypeId(String code) {
    jdbcTemplate.update(
        """
            INSERT INTO asset_types (code, name, description)
            VALUES (?, ?, ?)
            ON CONFLICT (code) DO NOTHING
            """,
        code,
        code,
        code);
    Long id = jdbcTemplate.queryForObject("SELECT id FROM asset_types WHERE code = ?", Long.class, code);
    return id;
  }
}
