package com.portfoliosync.worker.valuation;

import com.portfoliosync.domain.ledger.valuation.CashFlow;
import com.portfoliosync.domain.ledger.valuation.Holding;
import com.portfoliosync.domain.ledger.valuation.PortfolioValuation;
import com.portfoliosync.domain.ledger.valuation.PositionValue;
import com.portfoliosync.domain.ledger.valuation.ValuationCalculator;
import com.portfoliosync.worker.config.SyncPipelineProperties;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Daily valuation snapshots from ledger data only. Each portfolio is valued in its own
 * transaction holding the portfolio row lock, so concurrent runs for the same portfolio serialize.
 */
@Service
public class ValuationService {
  private final ValuationRepository repository;
  private final TransactionTemplate transactionTemplate;
  private final String zone;

  public ValuationService(
      ValuationRepository repository,
      PlatformTransactionManager transactionManager,
      SyncPipelineProperties pipelineProperties) {
    this.repository = repository;
    this.transactionTemplate = new TransactionTemplate(transactionManager);
    this.zone = pipelineProperties.zoneId().getId();
  }

  public Optional<PortfolioValuation> buildPortfolioSnapshot(long portfolioId, LocalDate date) {
    return transactionTemplate.execute(
        status -> {
          Optional<String> configuredBase = repository.lockPortfolio(portfolioId);
          if (configuredBase.isEmpty()) {
            return Optional.empty();
          }
          String base = ValuationCalculator.baseCurrency(configuredBase.get());
          List<Holding> holdings = repository.holdings(portfolioId);
          List<CashFlow> flows = repository.cashFlows(portfolioId, date, zone);
          BigDecimal previous = repository.valueOn(portfolioId, date.minusDays(1)).orElse(BigDecimal.ZERO);

          PortfolioValuation valuation =
              ValuationCalculator.value(
                  base,
                  holdings,
                  (assetId, currency) -> repository.latestPrice(portfolioId, assetId, currency),
                  flows,
                  previous);
          for (PositionValue position : valuation.positions()) {
            repository.upsertPosition(portfolioId, date, position);
          }
          repository.upsertValuation(portfolioId, date, valuation);
          return Optional.of(valuation);
        });
  }

  public List<PortfolioValuation> buildDailySnapshotsForUser(long userId, LocalDate date) {
    List<PortfolioValuation> valuations = new ArrayList<>();
    for (Long portfolioId : repository.portfolioIdsForUser(userId)) {
      buildPortfolioSnapshot(portfolioId, date).ifPresent(valuations::add);
    }
    return valuations;
  }

  public UserMetrics computeUserMetrics(long userId, LocalDate date) {
    return repository.userMetrics(userId, date);
  }
}
