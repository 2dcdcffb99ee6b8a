package com.portfoliosync.worker.sync;

import com.fasterxml.jackson.databind.JsonNode;
import com.portfoliosync.domain.ledger.ActivityNormalizer;
import com.portfoliosync.domain.ledger.NormalizationContext;
import com.portfoliosync.domain.ledger.NormalizationSummary;
import com.portfoliosync.domain.ledger.SkipReason;
import com.portfoliosync.domain.ledger.SourceType;
import com.portfoliosync.integration.venues.Venue;
import com.portfoliosync.integration.venues.VenueAdapter;
import com.portfoliosync.integration.venues.VenueAdapterRegistry;
import com.portfoliosync.integration.venues.config.VenueConfig;
import com.portfoliosync.integration.venues.config.VenueConfigParser;
import com.portfoliosync.integration.venues.model.ActivityQuery;
import com.portfoliosync.integration.venues.model.Snapshot;
import com.portfoliosync.integration.venues.model.SnapshotRequest;
import com.portfoliosync.worker.config.SyncTaskProperties;
import com.portfoliosync.worker.connection.ConnectionKind;
import com.portfoliosync.worker.ledger.LedgerWriter;
import com.portfoliosync.worker.metrics.PipelineMetrics;
import com.portfoliosync.worker.task.TaskTimeLimiter;
import java.time.Clock;
import java.time.Instant;
import java.util.NoSuchElementException;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Pulls one connection's snapshot since its stored cursor, writes it to the ledger and advances
 * the cursor. Venue failures classified as transient surface as {@link TransientSyncException}.
 */
@Service
public class SyncConnectionService {
  private static final Logger log = LoggerFactory.getLogger(SyncConnectionService.class);

  private final IntegrationRepository integrationRepository;
  private final VenueConfigParser configParser;
  private final VenueAdapterRegistry adapterRegistry;
  private final ActivityNormalizer normalizer;
  private final LedgerWriter ledgerWriter;
  private final TransientFailureClassifier failureClassifier;
  private final SyncTaskProperties properties;
  private final PipelineMetrics metrics;
  private final Clock clock;

  public SyncConnectionService(
      IntegrationRepository integrationRepository,
      VenueConfigParser configParser,
      VenueAdapterRegistry adapterRegistry,
      ActivityNormalizer normalizer,
      LedgerWriter ledgerWriter,
      TransientFailureClassifier failureClassifier,
      SyncTaskProperties properties,
      PipelineMetrics metrics,
      Clock clock) {
    this.integrationRepository = integrationRepository;
    this.configParser = configParser;
    this.adapterRegistry = adapterRegistry;
    this.normalizer = normalizer;
    this.ledgerWriter = ledgerWriter;
    this.failureClassifier = failureClassifier;
    this.properties = properties;
    this.metrics = metrics;
    this.clock = clock;
  }

  public SyncResult syncConnection(long connectionId, ConnectionKind connectionKind, SourceType sourceType) {
    SyncTarget target = resolveTarget(connectionId, connectionKind);
    IntegrationRecord integration = target.integration();
    Venue venue =
        integration
            .venue()
            .orElseThrow(
                () ->
                    new IllegalStateException(
                        "Unsupported integration exchange=" + integration.exchangeName()));

    JsonNode cursorState =
        target.walletId() == null
            ? integration.extraParams()
            : SyncCursor.walletState(integration.extraParams(), target.walletId());
    Instant since = SyncCursor.lastSyncAt(cursorState);
    int limit = SyncCursor.limit(integration.extraParams(), properties.getActivityLimit());
    VenueConfig config =
        configParser.parse(venue, integration.credentials(), integration.extraParams(), target.walletAddress());
    ActivityQuery query = config.activityQuery(since, limit, SyncCursor.lastCursor(cursorState));

    long started = System.nanoTime();
    Snapshot snapshot;
    Optional<String> lastCursor;
    VenueAdapter adapter =
        adapterRegistry.create(
            config, tokens -> integrationRepository.saveRefreshedTokens(integration.id(), tokens));
    try {
      snapshot = adapter.fetchSnapshot(SnapshotRequest.of(query));
      lastCursor = readCursor(adapter);
    } catch (RuntimeException ex) {
      log.warn(
          "Sync fetch failed source_type={} integration_id={} duration_ms={} error={}",
          sourceType.queueName(),
          integration.id(),
          elapsedMs(started),
          ex.getMessage());
      if (failureClassifier.isTransient(ex)) {
        throw new TransientSyncException(ex.getMessage(), ex);
      }
      throw ex;
    } finally {
      closeQuietly(adapter, integration.id());
    }

    NormalizationContext context =
        new NormalizationContext(integration.id(), target.portfolioId(), sourceType, venue.code());
    NormalizationSummary summary = normalizer.normalizeAll(context, snapshot.activities());
    metrics.normalizerSkipped(summary.skipped());

    TaskTimeLimiter.ensureNotCancelled("ledger write");
    int newTxCount = ledgerWriter.insertTransactions(summary.drafts());
    int balancesCount =
        ledgerWriter.upsertBalances(target.portfolioId(), sourceType, venue.code(), snapshot.balances());
    int positionsCount =
        ledgerWriter.upsertPositions(target.portfolioId(), sourceType, venue.code(), snapshot.positions());

    TaskTimeLimiter.ensureNotCancelled("cursor update");
    if (target.walletId() == null) {
      integrationRepository.updateSyncCursor(integration.id(), clock.instant(), lastCursor.orElse(null));
    } else {
      integrationRepository.updateWalletSyncCursor(
          integration.id(), target.walletId(), clock.instant(), lastCursor.orElse(null));
    }

    return new SyncResult(
        integration.id(),
        target.portfolioId(),
        newTxCount,
        positionsCount,
        balancesCount,
        summary.skipped(SkipReason.MISSING_ASSET),
        summary.skipped(SkipReason.MISSING_AMOUNT),
        elapsedMs(started));
  }

  private SyncTarget resolveTarget(long connectionId, ConnectionKind connectionKind) {
    if (connectionKind == ConnectionKind.TON_WALLET) {
      WalletRecord wallet =
          integrationRepository
              .findWallet(connectionId)
              .orElseThrow(() -> new NoSuchElementException("Wallet not found id=" + connectionId));
      IntegrationRecord integration =
          integrationRepository
              .findIntegration(wallet.integrationId())
              .orElseThrow(
                  () -> new NoSuchElementException("Integration not found id=" + wallet.integrationId()));
      return new SyncTarget(integration, wallet.portfolioId(), wallet.id(), wallet.address());
    }
    IntegrationRecord integration =
        integrationRepository
            .findIntegration(connectionId)
            .orElseThrow(() -> new NoSuchElementException("Integration not found id=" + connectionId));
    return new SyncTarget(integration, integration.portfolioId(), null, null);
  }

  private static Optional<String> readCursor(VenueAdapter adapter) {
    try {
      return adapter.lastCursor();
    } catch (RuntimeException ex) {
      log.debug("Venue cursor unavailable venue={} error={}", adapter.venue(), ex.getMessage());
      return Optional.empty();
    }
  }

  private static void closeQuietly(VenueAdapter adapter, long integrationId) {
    try {
      adapter.close();
    } catch (RuntimeException ex) {
      log.warn("Failed to close venue adapter integration_id={} error={}", integrationId, ex.getMessage());
    }
  }

  private static long elapsedMs(long startedNanos) {
    return (System.nanoTime() - startedNanos) / 1_000_000L;
  }

  private record SyncTarget(
      IntegrationRecord integration, long portfolioId, Long walletId, String walletAddress) {}
}
