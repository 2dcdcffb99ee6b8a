package com.portfoliosync.worker.task;

import com.portfoliosync.infra.kafka.contract.payload.RunUserAnalyticsTaskV1;
import com.portfoliosync.worker.config.SyncTaskProperties;
import com.portfoliosync.worker.metrics.PipelineMetrics;
import com.portfoliosync.worker.pipeline.SyncBatchRepository;
import com.portfoliosync.worker.valuation.UserMetrics;
import com.portfoliosync.worker.valuation.ValuationService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/** Values every portfolio of the user for the batch date, then closes the batch. */
@Component
public class RunUserAnalyticsTaskHandler {
  private static final Logger log = LoggerFactory.getLogger(RunUserAnalyticsTaskHandler.class);

  private final ValuationService valuationService;
  private final SyncBatchRepository batchRepository;
  private final TaskTimeLimiter timeLimiter;
  private final SyncTaskProperties properties;
  private final PipelineMetrics metrics;

  public RunUserAnalyticsTaskHandler(
      ValuationService valuationService,
      SyncBatchRepository batchRepository,
      TaskTimeLimiter timeLimiter,
      SyncTaskProperties properties,
      PipelineMetrics metrics) {
    this.valuationService = valuationService;
    this.batchRepository = batchRepository;
    this.timeLimiter = timeLimiter;
    this.properties = properties;
    this.metrics = metrics;
  }

  public UserAnalyticsResult handle(RunUserAnalyticsTaskV1 task) {
    try {
      UserAnalyticsResult result =
          timeLimiter.run(
              "run_user_analytics",
              properties.getAnalytics(),
              () -> {
                valuationService.buildDailySnapshotsForUser(task.userId(), task.snapshotDate());
                UserMetrics userMetrics = valuationService.computeUserMetrics(task.userId(), task.snapshotDate());
                return new UserAnalyticsResult(userMetrics.portfolioCount(), userMetrics.totalValueBase());
              });
      batchRepository.markCompleted(task.batchId());
      metrics.analyticsRun("succeeded");
      log.info(
          "User analytics done batch_id={} user_id={} snapshot_date={} portfolios={} total_value_base={}",
          task.batchId(),
          task.userId(),
          task.snapshotDate(),
          result.portfolios(),
          result.totalValueBase());
      return result;
    } catch (RuntimeException ex) {
      metrics.analyticsRun("failed");
      log.error(
          "User analytics failed batch_id={} user_id={} snapshot_date={}",
          task.batchId(),
          task.userId(),
          task.snapshotDate(),
          ex);
      throw ex;
    }
  }
}
