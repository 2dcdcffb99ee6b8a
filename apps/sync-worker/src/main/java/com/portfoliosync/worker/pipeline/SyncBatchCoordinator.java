package com.portfoliosync.worker.pipeline;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.portfoliosync.infra.kafka.contract.payload.RunUserAnalyticsTaskV1;
import com.portfoliosync.infra.kafka.contract.payload.SyncConnectorTaskV1;
import com.portfoliosync.worker.dispatch.TaskEnqueuer;
import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.OptionalInt;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * State transitions of one connection task within its user's batch.
 *
 * <p>A run reaches SUCCEEDED or FAILED at most once. That transition, the barrier decrement and,
 * for the last sibling, the analytics enqueue commit together, so analytics is queued exactly once
 * per batch and only after every connection is terminal.
 */
@Component
public class SyncBatchCoordinator {
  private static final Logger log = LoggerFactory.getLogger(SyncBatchCoordinator.class);

  private final SyncBatchRepository batchRepository;
  private final TaskEnqueuer taskEnqueuer;
  private final ObjectMapper objectMapper;
  private final Clock clock;
  private final TransactionTemplate transactionTemplate;

  public SyncBatchCoordinator(
      SyncBatchRepository batchRepository,
      TaskEnqueuer taskEnqueuer,
      @Qualifier("taskObjectMapper") ObjectMapper objectMapper,
      Clock clock,
      PlatformTransactionManager transactionManager) {
    this.batchRepository = batchRepository;
    this.taskEnqueuer = taskEnqueuer;
    this.objectMapper = objectMapper;
    this.clock = clock;
    this.transactionTemplate = new TransactionTemplate(transactionManager);
  }

  /** Marks the run as started; false when the run is unknown or already terminal. */
  public boolean beginAttempt(SyncConnectorTaskV1 task) {
    Boolean started =
        transactionTemplate.execute(
            status -> {
              Optional<TaskRunState> run = findRun(task);
              if (run.isEmpty()) {
                log.warn(
                    "Sync task has no run row batch_id={} connection_kind={} connection_id={}",
                    task.batchId(),
                    task.connectionKind(),
                    task.connectionId());
                return false;
              }
              if (run.get().status().isTerminal()) {
                log.info(
                    "Ignoring duplicate delivery of finished sync task run_id={} status={} attempt={}",
                    run.get().id(),
                    run.get().status(),
                    task.attempt());
                return false;
              }
              batchRepository.markRunning(run.get().id(), task.attempt());
              return true;
            });
    return Boolean.TRUE.equals(started);
  }

  public void recordSucceeded(SyncConnectorTaskV1 task, Object result) {
    finish(task, TaskRunStatus.SUCCEEDED, null, toJson(result));
  }

  public void recordFailed(SyncConnectorTaskV1 task, String error) {
    finish(task, TaskRunStatus.FAILED, error, null);
  }

  /** Keeps the run open and queues the next attempt after {@code delay}. */
  public void recordRetry(SyncConnectorTaskV1 task, String error, Duration delay) {
    transactionTemplate.executeWithoutResult(
        status ->
            findRun(task)
                .filter(run -> !run.status().isTerminal())
                .ifPresent(
                    run -> {
                      batchRepository.markRetrying(run.id(), task.attempt(), error);
                      taskEnqueuer.enqueueSync(task.nextAttempt(), clock.instant().plus(delay));
                    }));
  }

  private void finish(SyncConnectorTaskV1 task, TaskRunStatus outcome, String error, String resultJson) {
    transactionTemplate.executeWithoutResult(
        status -> {
          Optional<TaskRunState> run = findRun(task);
          if (run.isEmpty() || !batchRepository.markTerminal(run.get().id(), outcome, error, resultJson)) {
            return;
          }
          OptionalInt remaining = batchRepository.decrementPending(task.batchId());
          if (remaining.isPresent() && remaining.getAsInt() == 0) {
            taskEnqueuer.enqueueAnalytics(
                new RunUserAnalyticsTaskV1(task.batchId(), task.userId(), task.snapshotDate()),
                clock.instant());
            log.info(
                "Sync batch complete, analytics queued batch_id={} user_id={} snapshot_date={}",
                task.batchId(),
                task.userId(),
                task.snapshotDate());
          }
        });
  }

  private Optional<TaskRunState> findRun(SyncConnectorTaskV1 task) {
    return batchRepository.findRunForUpdate(task.batchId(), task.connectionKind(), task.connectionId());
  }

  private String toJson(Object result) {
    if (result == null) {
      return null;
    }
    try {
      return objectMapper.writeValueAsString(result);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("Failed to serialize task result", ex);
    }
  }
}
