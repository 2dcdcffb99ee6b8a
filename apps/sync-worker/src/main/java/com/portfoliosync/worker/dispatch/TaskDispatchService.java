package com.portfoliosync.worker.dispatch;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.portfoliosync.infra.kafka.contract.TaskEnvelope;
import com.portfoliosync.infra.kafka.producer.TaskPublisher;
import com.portfoliosync.worker.config.DispatchProperties;
import com.portfoliosync.worker.config.SyncTaskProperties;
import com.portfoliosync.worker.metrics.PipelineMetrics;
import java.io.IOException;
import java.time.Instant;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

/** Moves due rows of the dispatch queue onto their Kafka topics. */
@Service
@ConditionalOnProperty(
    prefix = "sync.dispatch",
    name = "enabled",
    havingValue = "true",
    matchIfMissing = true)
public class TaskDispatchService {
  private static final Logger log = LoggerFactory.getLogger(TaskDispatchService.class);
  private static final int TASK_VERSION = 1;

  private final TaskDispatchRepository dispatchRepository;
  private final TaskPublisher taskPublisher;
  private final DispatchProperties properties;
  private final SyncTaskProperties taskProperties;
  private final ObjectMapper objectMapper;
  private final PipelineMetrics metrics;
  private final DeadDispatchListener deadDispatchListener;

  public TaskDispatchService(
      TaskDispatchRepository dispatchRepository,
      TaskPublisher taskPublisher,
      DispatchProperties properties,
      SyncTaskProperties taskProperties,
      @Qualifier("taskObjectMapper") ObjectMapper objectMapper,
      PipelineMetrics metrics,
      DeadDispatchListener deadDispatchListener) {
    this.dispatchRepository = dispatchRepository;
    this.taskPublisher = taskPublisher;
    this.properties = properties;
    this.taskProperties = taskProperties;
    this.objectMapper = objectMapper;
    this.metrics = metrics;
    this.deadDispatchListener = deadDispatchListener;
  }

  @Scheduled(fixedDelayString = "${sync.dispatch.fixed-delay-ms:1000}")
  public void dispatchDueTasks() {
    List<TaskDispatchRecord> due = dispatchRepository.claimDueBatch(properties.getBatchSize());
    if (due.isEmpty()) {
      return;
    }

    for (TaskDispatchRecord record : due) {
      dispatchSingle(record);
    }
  }

  private void dispatchSingle(TaskDispatchRecord record) {
    try {
      JsonNode payload = parsePayload(record.payload());
      TaskEnvelope<JsonNode> envelope =
          TaskEnvelope.of(
              record.taskType(),
              TASK_VERSION,
              taskProperties.getProducerName(),
              correlationIdFor(record, payload),
              record.messageKey(),
              payload);

      taskPublisher.publish(record.topic(), envelope).join();
      dispatchRepository.markPublished(record.id(), Instant.now());
      metrics.dispatch(record.taskType(), "published");

      log.debug(
          "Task dispatch success dispatch_id={} topic={} task_type={} attempt_count={}",
          record.id(),
          record.topic(),
          record.taskType(),
          record.attemptCount());
    } catch (Exception ex) {
      String error = errorMessage(ex);
      boolean dead = dispatchRepository.markFailed(record.id(), error);
      metrics.dispatch(record.taskType(), dead ? "dead" : "failed");
      if (!dead) {
        log.warn(
            "Task dispatch failed dispatch_id={} topic={} task_type={} attempt_count={} error={}",
            record.id(),
            record.topic(),
            record.taskType(),
            record.attemptCount() + 1,
            error);
        return;
      }
      log.error(
          "Task dispatch gave up dispatch_id={} topic={} task_type={} error={}",
          record.id(),
          record.topic(),
          record.taskType(),
          error);
      notifyDead(record, error);
    }
  }

  private void notifyDead(TaskDispatchRecord record, String error) {
    try {
      deadDispatchListener.onDeadDispatch(record, error);
    } catch (RuntimeException ex) {
      log.error("Dead dispatch handling failed dispatch_id={} task_type={}", record.id(), record.taskType(), ex);
    }
  }

  private JsonNode parsePayload(String payloadJson) throws IOException {
    if (payloadJson == null || payloadJson.isBlank()) {
      return objectMapper.createObjectNode();
    }
    return objectMapper.readTree(payloadJson);
  }

  /** Tasks of one nightly batch share the batch as correlation id. */
  private static String correlationIdFor(TaskDispatchRecord record, JsonNode payload) {
    JsonNode batchId = payload.path("batchId");
    if (batchId.canConvertToLong()) {
      return "batch-" + batchId.asLong();
    }
    return record.id().toString();
  }

  private static String errorMessage(Exception ex) {
    Throwable cause = ex.getCause() != null ? ex.getCause() : ex;
    String message = cause.getMessage();
    if (message == null || message.isBlank()) {
      return cause.getClass().getSimpleName();
    }
    return message;
  }
}
