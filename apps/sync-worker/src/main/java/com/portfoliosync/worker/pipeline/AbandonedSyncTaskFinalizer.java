package com.portfoliosync.worker.pipeline;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.portfoliosync.infra.kafka.contract.TaskTypes;
import com.portfoliosync.infra.kafka.contract.payload.SyncConnectorTaskV1;
import com.portfoliosync.worker.config.SyncPipelineProperties;
import com.portfoliosync.worker.dispatch.DeadDispatchListener;
import com.portfoliosync.worker.dispatch.TaskDispatchRecord;
import com.portfoliosync.worker.metrics.PipelineMetrics;
import com.portfoliosync.worker.task.TaskFailures;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Fails the run of a sync task that will never execute again, so its batch barrier still reaches
 * zero and the user's analytics is queued. Three ways a task gets lost: its dispatch row went
 * DEAD, its record was dead-lettered, or the worker died holding it. The first two are reported
 * as they happen; the last is caught by a periodic sweep over runs older than the stale-run
 * timeout.
 */
@Component
public class AbandonedSyncTaskFinalizer implements DeadDispatchListener {
  private static final Logger log = LoggerFactory.getLogger(AbandonedSyncTaskFinalizer.class);
  private static final int SWEEP_LIMIT = 500;

  private final SyncBatchCoordinator coordinator;
  private final SyncBatchRepository batchRepository;
  private final SyncPipelineProperties properties;
  private final ObjectMapper objectMapper;
  private final PipelineMetrics metrics;
  private final Clock clock;

  public AbandonedSyncTaskFinalizer(
      SyncBatchCoordinator coordinator,
      SyncBatchRepository batchRepository,
      SyncPipelineProperties properties,
      @Qualifier("taskObjectMapper") ObjectMapper objectMapper,
      PipelineMetrics metrics,
      Clock clock) {
    this.coordinator = coordinator;
    this.batchRepository = batchRepository;
    this.properties = properties;
    this.objectMapper = objectMapper;
    this.metrics = metrics;
    this.clock = clock;
  }

  @Override
  public void onDeadDispatch(TaskDispatchRecord record, String error) {
    if (!TaskTypes.SYNC_CONNECTOR.equals(record.taskType())) {
      return;
    }
    SyncConnectorTaskV1 task;
    try {
      task = objectMapper.readValue(record.payload(), SyncConnectorTaskV1.class);
    } catch (JsonProcessingException ex) {
      // left to the stale-run sweep
      log.error("Dead dispatch row has unreadable sync payload dispatch_id={}", record.id(), ex);
      return;
    }
    abandon(task, "DISPATCH_DEAD: " + TaskFailures.sanitizeMessage(error));
  }

  public void onDeadLettered(SyncConnectorTaskV1 task, Exception failure) {
    abandon(task, "DEAD_LETTERED: " + TaskFailures.describe(failure));
  }

  @Scheduled(
      fixedDelayString = "${sync.pipeline.stale-run-sweep-ms:300000}",
      initialDelayString = "${sync.pipeline.stale-run-sweep-ms:300000}")
  public void sweepStaleRuns() {
    Duration timeout = properties.getStaleRunTimeout();
    List<SyncConnectorTaskV1> stale = batchRepository.findStaleRuns(clock.instant().minus(timeout), SWEEP_LIMIT);
    if (stale.isEmpty()) {
      return;
    }
    log.warn("Failing stale sync runs count={} timeout_min={}", stale.size(), timeout.toMinutes());
    for (SyncConnectorTaskV1 task : stale) {
      abandon(task, "STALE_RUN: not finished within " + timeout.toMinutes() + "m");
    }
  }

  private void abandon(SyncConnectorTaskV1 task, String error) {
    coordinator.recordFailed(task, error);
    metrics.syncTask(task.sourceType(), "abandoned", Duration.ZERO);
    log.warn(
        "Sync run abandoned batch_id={} connection_kind={} connection_id={} attempt={} error={}",
        task.batchId(),
        task.connectionKind(),
        task.connectionId(),
        task.attempt(),
        error);
  }
}
