package com.portfoliosync.worker.task;

import com.portfoliosync.domain.ledger.SourceType;
import com.portfoliosync.infra.kafka.contract.payload.SyncConnectorTaskV1;
import com.portfoliosync.integration.venues.http.JitteredExponentialBackoff;
import com.portfoliosync.worker.config.SyncTaskProperties;
import com.portfoliosync.worker.connection.ConnectionKind;
import com.portfoliosync.worker.metrics.PipelineMetrics;
import com.portfoliosync.worker.pipeline.SyncBatchCoordinator;
import com.portfoliosync.worker.sync.SyncConnectionService;
import com.portfoliosync.worker.sync.SyncResult;
import com.portfoliosync.worker.sync.TransientFailureClassifier;
import java.time.Duration;
import java.util.Locale;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Runs one connection sync under the sync time limits. Transient failures are rescheduled through
 * the dispatch queue while retries remain; everything else ends the run as FAILED. Either terminal
 * outcome counts towards the user's batch barrier.
 */
@Component
public class SyncConnectorTaskHandler {
  private static final Logger log = LoggerFactory.getLogger(SyncConnectorTaskHandler.class);

  private final SyncConnectionService syncConnectionService;
  private final SyncBatchCoordinator coordinator;
  private final TransientFailureClassifier failureClassifier;
  private final TaskTimeLimiter timeLimiter;
  private final SyncTaskProperties properties;
  private final PipelineMetrics metrics;
  private final JitteredExponentialBackoff retryBackoff;

  public SyncConnectorTaskHandler(
      SyncConnectionService syncConnectionService,
      SyncBatchCoordinator coordinator,
      TransientFailureClassifier failureClassifier,
      TaskTimeLimiter timeLimiter,
      SyncTaskProperties properties,
      PipelineMetrics metrics) {
    this.syncConnectionService = syncConnectionService;
    this.coordinator = coordinator;
    this.failureClassifier = failureClassifier;
    this.timeLimiter = timeLimiter;
    this.properties = properties;
    this.metrics = metrics;
    this.retryBackoff =
        new JitteredExponentialBackoff(properties.getRetryBaseBackoff(), properties.getRetryMaxBackoff(), true);
  }

  public void handle(SyncConnectorTaskV1 task) {
    if (!coordinator.beginAttempt(task)) {
      return;
    }
    Optional<ConnectionKind> kind = parseKind(task.connectionKind());
    Optional<SourceType> sourceType = SourceType.fromQueueName(task.sourceType());
    if (kind.isEmpty() || sourceType.isEmpty()) {
      String error =
          "INVALID_TASK: unsupported connection_kind=" + task.connectionKind() + " source_type=" + task.sourceType();
      coordinator.recordFailed(task, error);
      metrics.syncTask(task.sourceType(), "failed", Duration.ZERO);
      log.warn("Rejected sync task batch_id={} {}", task.batchId(), error);
      return;
    }

    long started = System.nanoTime();
    try {
      SyncResult result =
          timeLimiter.run(
              "sync_connector",
              properties.getSync(),
              () -> syncConnectionService.syncConnection(task.connectionId(), kind.get(), sourceType.get()));
      coordinator.recordSucceeded(task, result);
      metrics.syncTask(task.sourceType(), "succeeded", elapsed(started));
      log.info(
          "Sync succeeded batch_id={} connection_kind={} connection_id={} attempt={} new_tx={} positions={} balances={}",
          task.batchId(),
          task.connectionKind(),
          task.connectionId(),
          task.attempt(),
          result.newTxCount(),
          result.positionsCount(),
          result.balancesCount());
    } catch (RuntimeException ex) {
      onFailure(task, ex, elapsed(started));
    }
  }

  private void onFailure(SyncConnectorTaskV1 task, RuntimeException failure, Duration elapsed) {
    String error = TaskFailures.describe(failure);
    if (failureClassifier.isTransient(failure) && task.attempt() <= properties.getMaxRetries()) {
      Duration delay = retryBackoff.backoffForAttempt(task.attempt());
      coordinator.recordRetry(task, error, delay);
      metrics.syncTask(task.sourceType(), "retried", elapsed);
      log.warn(
          "Sync failed transiently, retrying batch_id={} connection_kind={} connection_id={} attempt={} delay_ms={} error={}",
          task.batchId(),
          task.connectionKind(),
          task.connectionId(),
          task.attempt(),
          delay.toMillis(),
          error);
      return;
    }
    coordinator.recordFailed(task, error);
    metrics.syncTask(task.sourceType(), "failed", elapsed);
    log.warn(
        "Sync failed batch_id={} connection_kind={} connection_id={} attempt={} error={}",
        task.batchId(),
        task.connectionKind(),
        task.connectionId(),
        task.attempt(),
        error,
        failure);
  }

  private static Optional<ConnectionKind> parseKind(String value) {
    try {
      return Optional.of(ConnectionKind.valueOf(value.trim().toUpperCase(Locale.ROOT)));
    } catch (IllegalArgumentException ex) {
      return Optional.empty();
    }
  }

  private static Duration elapsed(long startedNanos) {
    return Duration.ofNanos(System.nanoTime() - startedNanos);
  }
}
