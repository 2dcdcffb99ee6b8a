package com.portfoliosync.worker.connection;

import com.portfoliosync.domain.ledger.SourceType;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
public class ConnectionEnumerator {
  private static final Logger log = LoggerFactory.getLogger(ConnectionEnumerator.class);

  private final JdbcTemplate jdbcTemplate;

  public ConnectionEnumerator(JdbcTemplate jdbcTemplate) {
    this.jdbcTemplate = jdbcTemplate;
  }

  /**
   * Every syncable connection grouped by owning user, in user then integration order. A TON
   * integration contributes one connection per active wallet and none of its own.
   */
  public Map<Long, List<ConnectionSpec>> listActiveConnections() {
    Map<Long, List<WalletRow>> walletsByIntegration = new LinkedHashMap<>();
    for (WalletRow wallet : loadActiveWallets()) {
      walletsByIntegration.computeIfAbsent(wallet.integrationId(), id -> new ArrayList<>()).add(wallet);
    }

    Map<Long, List<ConnectionSpec>> byUser = new LinkedHashMap<>();
    for (IntegrationRow integration : loadIntegrations()) {
      Optional<SourceType> sourceType = SourceQueues.resolve(integration.exchangeName());
      if (sourceType.isEmpty()) {
        log.debug(
            "Skipping integration with unsupported venue integration_id={} exchange={}",
            integration.id(),
            integration.exchangeName());
        continue;
      }

      List<ConnectionSpec> connections =
          byUser.computeIfAbsent(integration.userId(), id -> new ArrayList<>());
      if (sourceType.get() == SourceType.TON) {
        for (WalletRow wallet : walletsByIntegration.getOrDefault(integration.id(), List.of())) {
          connections.add(
              new ConnectionSpec(
                  integration.userId(),
                  wallet.portfolioId(),
                  integration.id(),
                  wallet.id(),
                  ConnectionKind.TON_WALLET,
                  SourceType.TON));
        }
        continue;
      }

      connections.add(
          new ConnectionSpec(
              integration.userId(),
              integration.portfolioId(),
              integration.id(),
              integration.id(),
              ConnectionKind.INTEGRATION,
              sourceType.get()));
    }
    byUser.values().removeIf(List::isEmpty);
    return byUser;
  }

  private List<IntegrationRow> loadIntegrations() {
    String sql =
        """
            SELECT i.id, i.portfolio_id, p.user_id, e.name AS exchange_name
            FROM integrations i
            JOIN portfolios p ON p.id = i.portfolio_id
            JOIN exchanges e ON e.id = i.exchange_id
            ORDER BY p.user_id, i.id
            """;
    return jdbcTemplate.query(
        sql,
        (rs, rowNum) ->
            new IntegrationRow(
                rs.getLong("id"),
                rs.getLong("portfolio_id"),
                rs.getLong("user_id"),
                rs.getString("exchange_name")));
  }

  private List<WalletRow> loadActiveWallets() {
    String sql =
        """
            SELECT id, integration_id, portfolio_id
            FROM wallet_addresses
            WHERE is_active = TRUE
            ORDER BY id
            """;
    return jdbcTemplate.query(
        sql,
        (rs, rowNum) ->
            new WalletRow(rs.getLong("id"), rs.getLong("integration_id"), rs.getLong("portfolio_id")));
  }

  private record IntegrationRow(long id, long portfolioId, long userId, String exchangeName) {}

  private record WalletRow(long id, long integrationId, long portfolioId) {}
}
