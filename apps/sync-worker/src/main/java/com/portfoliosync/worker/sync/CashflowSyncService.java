package com.portfoliosync.worker.sync;

import com.portfoliosync.domain.ledger.ActivityNormalizer;
import com.portfoliosync.domain.ledger.NormalizationContext;
import com.portfoliosync.domain.ledger.NormalizationSummary;
import com.portfoliosync.domain.ledger.SkipReason;
import com.portfoliosync.domain.ledger.TransactionDraft;
import com.portfoliosync.integration.venues.Venue;
import com.portfoliosync.integration.venues.VenueAdapter;
import com.portfoliosync.integration.venues.VenueAdapterRegistry;
import com.portfoliosync.integration.venues.config.VenueConfig;
import com.portfoliosync.integration.venues.config.VenueConfigParser;
import com.portfoliosync.integration.venues.model.ActivityLine;
import com.portfoliosync.worker.config.SyncPipelineProperties;
import com.portfoliosync.worker.config.SyncTaskProperties;
import com.portfoliosync.worker.connection.SourceQueues;
import com.portfoliosync.worker.ledger.LedgerWriter;
import com.portfoliosync.worker.task.TaskFailures;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Semaphore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Books one day's activities of every integration of a portfolio. Integrations are fetched
 * concurrently up to a bound, and a failing integration only adds an entry to the error list.
 */
@Service
public class CashflowSyncService {
  public static final int DEFAULT_MAX_CONCURRENCY = 5;

  private static final Logger log = LoggerFactory.getLogger(CashflowSyncService.class);

  private final IntegrationRepository integrationRepository;
  private final VenueConfigParser configParser;
  private final VenueAdapterRegistry adapterRegistry;
  private final ActivityNormalizer normalizer;
  private final LedgerWriter ledgerWriter;
  private final ExecutorService venueExecutor;
  private final SyncTaskProperties taskProperties;
  private final ZoneId zone;

  public CashflowSyncService(
      IntegrationRepository integrationRepository,
      VenueConfigParser configParser,
      VenueAdapterRegistry adapterRegistry,
      ActivityNormalizer normalizer,
      LedgerWriter ledgerWriter,
      @Qualifier("venueExecutor") ExecutorService venueExecutor,
      SyncTaskProperties taskProperties,
      SyncPipelineProperties pipelineProperties) {
    this.integrationRepository = integrationRepository;
    this.configParser = configParser;
    this.adapterRegistry = adapterRegistry;
    this.normalizer = normalizer;
    this.ledgerWriter = ledgerWriter;
    this.venueExecutor = venueExecutor;
    this.taskProperties = taskProperties;
    this.zone = pipelineProperties.zoneId();
  }

  public CashflowSyncResult syncPortfolioCashflow(long portfolioId, LocalDate targetDate) {
    return syncPortfolioCashflow(
        portfolioId, targetDate, taskProperties.getActivityLimit(), DEFAULT_MAX_CONCURRENCY);
  }

  public CashflowSyncResult syncPortfolioCashflow(
      long portfolioId, LocalDate targetDate, int limit, int maxConcurrency) {
    Instant since = targetDate.atStartOfDay(zone).toInstant();
    Semaphore permits = new Semaphore(Math.max(1, maxConcurrency));
    List<IntegrationRecord> integrations = integrationRepository.findByPortfolio(portfolioId);

    List<CompletableFuture<FetchOutcome>> futures = new ArrayList<>(integrations.size());
    for (IntegrationRecord integration : integrations) {
      futures.add(
          CompletableFuture.supplyAsync(
              () -> fetchBounded(integration, since, Math.max(1, limit), permits), venueExecutor));
    }

    List<TransactionDraft> drafts = new ArrayList<>();
    List<String> errors = new ArrayList<>();
    int activitiesFound = 0;
    int skippedMissingAsset = 0;
    int skippedMissingAmount = 0;
    for (CompletableFuture<FetchOutcome> future : futures) {
      FetchOutcome outcome = future.join();
      if (outcome.error() != null) {
        errors.add(outcome.error());
        continue;
      }
      List<ActivityLine> onDate =
          outcome.activities().stream().filter(activity -> isOnDate(activity, targetDate)).toList();
      if (onDate.isEmpty()) {
        continue;
      }
      activitiesFound += onDate.size();
      IntegrationRecord integration = outcome.integration();
      Venue venue = integration.venue().orElseThrow();
      NormalizationSummary summary =
          normalizer.normalizeAll(
              new NormalizationContext(
                  integration.id(), portfolioId, SourceQueues.forVenue(venue), venue.code()),
              onDate);
      drafts.addAll(summary.drafts());
      skippedMissingAsset += summary.skipped(SkipReason.MISSING_ASSET);
      skippedMissingAmount += summary.skipped(SkipReason.MISSING_AMOUNT);
    }

    int created = ledgerWriter.insertTransactions(drafts);
    log.info(
        "Cashflow sync finished portfolio_id={} date={} integrations={} activities={} created={} errors={}",
        portfolioId,
        targetDate,
        integrations.size(),
        activitiesFound,
        created,
        errors.size());
    return new CashflowSyncResult(
        portfolioId,
        targetDate,
        integrations.size(),
        activitiesFound,
        created,
        skippedMissingAsset,
        skippedMissingAmount,
        errors);
  }

  private FetchOutcome fetchBounded(
      IntegrationRecord integration, Instant since, int limit, Semaphore permits) {
    try {
      permits.acquire();
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      return FetchOutcome.failed(integration, "interrupted");
    }
    try {
      return FetchOutcome.fetched(integration, fetchActivities(integration, since, limit));
    } catch (RuntimeException ex) {
      log.warn("Cashflow fetch failed integration_id={} error={}", integration.id(), ex.getMessage());
      return FetchOutcome.failed(integration, TaskFailures.describe(ex));
    } finally {
      permits.release();
    }
  }

  private List<ActivityLine> fetchActivities(IntegrationRecord integration, Instant since, int limit) {
    Venue venue =
        integration
            .venue()
            .orElseThrow(
                () -> new IllegalStateException("Unsupported integration exchange=" + integration.exchangeName()));
    if (venue != Venue.TON) {
      return fetchFrom(integration, venue, null, since, limit);
    }
    List<ActivityLine> activities = new ArrayList<>();
    for (WalletRecord wallet : integrationRepository.findActiveWallets(integration.id())) {
      activities.addAll(fetchFrom(integration, venue, wallet.address(), since, limit));
    }
    return activities;
  }

  private List<ActivityLine> fetchFrom(
      IntegrationRecord integration, Venue venue, String walletAddress, Instant since, int limit) {
    VenueConfig config =
        configParser.parse(venue, integration.credentials(), integration.extraParams(), walletAddress);
    try (VenueAdapter adapter =
        adapterRegistry.create(config, tokens -> integrationRepository.saveRefreshedTokens(integration.id(), tokens))) {
      return adapter.fetchActivities(config.activityQuery(since, limit, null));
    }
  }

  private boolean isOnDate(ActivityLine activity, LocalDate targetDate) {
    return activity.timestamp() != null
        && activity.timestamp().atZone(zone).toLocalDate().equals(targetDate);
  }

  private record FetchOutcome(IntegrationRecord integration, List<ActivityLine> activities, String error) {
    static FetchOutcome fetched(IntegrationRecord integration, List<ActivityLine> activities) {
      return new FetchOutcome(integration, activities, null);
    }

    static FetchOutcome failed(IntegrationRecord integration, String message) {
      return new FetchOutcome(integration, List.of(), integration.id() + ": " + message);
    }
  }
}
