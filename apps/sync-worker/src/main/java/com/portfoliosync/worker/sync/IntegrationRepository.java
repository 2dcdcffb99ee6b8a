package com.portfoliosync.worker.sync;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.portfoliosync.integration.venues.auth.RefreshedTokens;
import com.portfoliosync.integration.venues.config.IntegrationCredentials;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
public class IntegrationRepository {
  private static final String INTEGRATION_COLUMNS =
      """
          SELECT i.id, i.portfolio_id, p.user_id, e.name AS exchange_name,
                 i.api_key, i.api_secret, i.passphrase, i.token, i.access_token, i.refresh_token,
                 i.client_id, i.account_id, i.token_expires_at, i.refresh_expires_at,
                 i.extra_params
          FROM integrations i
          JOIN portfolios p ON p.id = i.portfolio_id
          JOIN exchanges e ON e.id = i.exchange_id
          """;

  private final JdbcTemplate jdbcTemplate;
  private final ObjectMapper objectMapper;

  public IntegrationRepository(
      JdbcTemplate jdbcTemplate, @Qualifier("taskObjectMapper") ObjectMapper objectMapper) {
    this.jdbcTemplate = jdbcTemplate;
    this.objectMapper = objectMapper;
  }

  public Optional<IntegrationRecord> findIntegration(long integrationId) {
    return jdbcTemplate
        .query(INTEGRATION_COLUMNS + " WHERE i.id = ?", this::mapIntegration, integrationId)
        .stream()
        .findFirst();
  }

  public List<IntegrationRecord> findByPortfolio(long portfolioId) {
    return jdbcTemplate.query(
        INTEGRATION_COLUMNS + " WHERE i.portfolio_id = ? ORDER BY i.id", this::mapIntegration, portfolioId);
  }

  public Optional<WalletRecord> findWallet(long walletId) {
    return jdbcTemplate
        .query(
            "SELECT id, integration_id, portfolio_id, address, is_active FROM wallet_addresses WHERE id = ?",
            this::mapWallet,
            walletId)
        .stream()
        .findFirst();
  }

  public List<WalletRecord> findActiveWallets(long integrationId) {
    return jdbcTemplate.query(
        """
            SELECT id, integration_id, portfolio_id, address, is_active
            FROM wallet_addresses
            WHERE integration_id = ?
              AND is_active = TRUE
            ORDER BY id
            """,
        this::mapWallet,
        integrationId);
  }

  /** Merges the cursor keys into {@code extra_params}, leaving every other key untouched. */
  public void updateSyncCursor(long integrationId, Instant lastSyncAt, String lastCursor) {
    jdbcTemplate.update(
        """
            UPDATE integrations
            SET extra_params = COALESCE(extra_params, '{}'::jsonb) || CAST(? AS JSONB)
            WHERE id = ?
            """,
        toJson(cursorPatch(lastSyncAt, lastCursor)),
        integrationId);
  }

  private ObjectNode cursorPatch(Instant lastSyncAt, String lastCursor) {
    ObjectNode patch = objectMapper.createObjectNode();
    patch.put(SyncCursor.LAST_SYNC_AT, lastSyncAt.toString());
    if (lastCursor != null && !lastCursor.isBlank()) {
      patch.put(SyncCursor.LAST_CURSOR, lastCursor);
    }
    return patch;
  }

  public void updateWalletSyncCursor(long integrationId, long walletId, Instant lastSyncAt, String lastCursor) {
    String walletKey = String.valueOf(walletId);
    jdbcTemplate.update(
        """
            UPDATE integrations
            SET extra_params = COALESCE(extra_params, '{}'::jsonb) || jsonb_build_object(
                'wallet_cursors',
                COALESCE(extra_params -> 'wallet_cursors', '{}'::jsonb) || jsonb_build_object(
                    CAST(? AS TEXT),
                    COALESCE(extra_params -> 'wallet_cursors' -> CAST(? AS TEXT), '{}'::jsonb) || CAST(? AS JSONB)))
            WHERE id = ?
            """,
        walletKey,
        walletKey,
        toJson(cursorPatch(lastSyncAt, lastCursor)),
        integrationId);
  }

  public void saveRefreshedTokens(long integrationId, RefreshedTokens tokens) {
    jdbcTemplate.update(
        """
            UPDATE integrations
            SET access_token = ?,
                refresh_token = COALESCE(?, refresh_token),
                token_expires_at = ?,
                refresh_expires_at = COALESCE(?, refresh_expires_at)
            WHERE id = ?
            """,
        tokens.accessToken(),
        tokens.refreshToken(),
        toTimestamp(tokens.accessExpiresAt()),
        toTimestamp(tokens.refreshExpiresAt()),
        integrationId);
  }

  private IntegrationRecord mapIntegration(ResultSet rs, int rowNum) throws SQLException {
    IntegrationCredentials credentials =
        new IntegrationCredentials(
            rs.getString("api_key"),
            rs.getString("api_secret"),
            rs.getString("passphrase"),
            rs.getString("token"),
            rs.getString("access_token"),
            rs.getString("refresh_token"),
            rs.getString("client_id"),
            rs.getString("account_id"),
            toInstant(rs.getTimestamp("token_expires_at")),
            toInstant(rs.getTimestamp("refresh_expires_at")));
    return new IntegrationRecord(
        rs.getLong("id"),
        rs.getLong("portfolio_id"),
        rs.getLong("user_id"),
        rs.getString("exchange_name"),
        credentials,
        parseJson(rs.getString("extra_params")));
  }

  private WalletRecord mapWallet(ResultSet rs, int rowNum) throws SQLException {
    return new WalletRecord(
        rs.getLong("id"),
        rs.getLong("integration_id"),
        rs.getLong("portfolio_id"),
        rs.getString("address"),
        rs.getBoolean("is_active"));
  }

  private JsonNode parseJson(String json) {
    if (json == null || json.isBlank()) {
      return objectMapper.createObjectNode();
    }
    try {
      return objectMapper.readTree(json);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("Invalid extra_params JSON", ex);
    }
  }

  private String toJson(JsonNode node) {
    try {
      return objectMapper.writeValueAsString(node);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("Failed to serialize extra_params patch", ex);
    }
  }

  private static Instant toInstant(Timestamp timestamp) {
    return timestamp == null ? null : timestamp.toInstant();
  }

  private static Timestamp toTimestamp(Instant instant) {
    return instant == null ? null : Timestamp.from(instant);
  }
}
