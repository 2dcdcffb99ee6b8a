package com.portfoliosync.worker.pipeline;

import com.portfoliosync.infra.kafka.contract.payload.SyncConnectorTaskV1;
import com.portfoliosync.worker.config.SyncPipelineProperties;
import com.portfoliosync.worker.connection.ConnectionEnumerator;
import com.portfoliosync.worker.connection.ConnectionSpec;
import com.portfoliosync.worker.dispatch.TaskEnqueuer;
import com.portfoliosync.worker.metrics.PipelineMetrics;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Fans the nightly sync out into one batch per user. Each user's connections share a random
 * start delay so users are spread over the jitter window while a user's tasks stay together.
 */
@Service
public class NightlyPipelineService {
  private static final Logger log = LoggerFactory.getLogger(NightlyPipelineService.class);
  private static final String LOCK_PREFIX = "nightly_pipeline:";

  private final PipelineLockRepository lockRepository;
  private final ConnectionEnumerator connectionEnumerator;
  private final SyncBatchRepository batchRepository;
  private final TaskEnqueuer taskEnqueuer;
  private final SyncPipelineProperties properties;
  private final PipelineMetrics metrics;
  private final Clock clock;
  private final TransactionTemplate transactionTemplate;
  private final Supplier<Duration> jitterSource;

  @Autowired
  public NightlyPipelineService(
      PipelineLockRepository lockRepository,
      ConnectionEnumerator connectionEnumerator,
      SyncBatchRepository batchRepository,
      TaskEnqueuer taskEnqueuer,
      SyncPipelineProperties properties,
      PipelineMetrics metrics,
      Clock clock,
      PlatformTransactionManager transactionManager) {
    this(
        lockRepository,
        connectionEnumerator,
        batchRepository,
        taskEnqueuer,
        properties,
        metrics,
        clock,
        transactionManager,
        () -> randomJitter(properties.getMaxJitter()));
  }

  NightlyPipelineService(
      PipelineLockRepository lockRepository,
      ConnectionEnumerator connectionEnumerator,
      SyncBatchRepository batchRepository,
      TaskEnqueuer taskEnqueuer,
      SyncPipelineProperties properties,
      PipelineMetrics metrics,
      Clock clock,
      PlatformTransactionManager transactionManager,
      Supplier<Duration> jitterSource) {
    this.lockRepository = lockRepository;
    this.connectionEnumerator = connectionEnumerator;
    this.batchRepository = batchRepository;
    this.taskEnqueuer = taskEnqueuer;
    this.properties = properties;
    this.metrics = metrics;
    this.clock = clock;
    this.transactionTemplate = new TransactionTemplate(transactionManager);
    this.jitterSource = jitterSource;
  }

  public PipelineRunResult runNightly(Optional<LocalDate> asOfDate) {
    LocalDate snapshotDate = asOfDate.orElseGet(() -> LocalDate.now(clock.withZone(properties.zoneId())));
    String lockKey = LOCK_PREFIX + snapshotDate;
    if (!lockRepository.tryAcquire(lockKey, properties.getLockTtl())) {
      log.info("Nightly pipeline skipped, lock held lock_key={}", lockKey);
      metrics.nightlyRun("skipped");
      return PipelineRunResult.skipped();
    }

    try {
      Map<Long, List<ConnectionSpec>> connectionsByUser = connectionEnumerator.listActiveConnections();
      int scheduledUsers = 0;
      int scheduledConnections = 0;
      for (Map.Entry<Long, List<ConnectionSpec>> entry : connectionsByUser.entrySet()) {
        List<ConnectionSpec> connections = entry.getValue();
        if (connections.isEmpty()) {
          continue;
        }
        scheduleUser(entry.getKey(), connections, snapshotDate);
        scheduledUsers++;
        scheduledConnections += connections.size();
      }

      log.info(
          "Nightly pipeline scheduled users={} connections={} snapshot_date={}",
          scheduledUsers,
          scheduledConnections,
          snapshotDate);
      metrics.nightlyRun("scheduled");
      return new PipelineRunResult(scheduledUsers, scheduledConnections);
    } catch (RuntimeException ex) {
      metrics.nightlyRun("failed");
      throw ex;
    }
  }

  private void scheduleUser(long userId, List<ConnectionSpec> connections, LocalDate snapshotDate) {
    Instant availableAt = clock.instant().plus(jitterSource.get());
    transactionTemplate.executeWithoutResult(
        status -> {
          long batchId = batchRepository.createBatch(userId, snapshotDate, connections.size());
          for (ConnectionSpec connection : connections) {
            batchRepository.createTaskRun(batchId, connection);
            taskEnqueuer.enqueueSync(
                new SyncConnectorTaskV1(
                    batchId,
                    userId,
                    connection.connectionId(),
                    connection.connectionKind().name(),
                    connection.sourceType().queueName(),
                    snapshotDate,
                    1),
                availableAt);
          }
          log.debug(
              "Scheduled sync batch batch_id={} user_id={} connections={} available_at={}",
              batchId,
              userId,
              connections.size(),
              availableAt);
        });
  }

  static Duration randomJitter(Duration maxJitter) {
    long maxSeconds = Math.max(0L, maxJitter.toSeconds());
    return Duration.ofSeconds(ThreadLocalRandom.current().nextLong(maxSeconds + 1));
  }
}
