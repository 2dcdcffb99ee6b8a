package com.portfoliosync.worker.dispatch;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.portfoliosync.infra.kafka.contract.TaskTypes;
import com.portfoliosync.infra.kafka.contract.payload.RunUserAnalyticsTaskV1;
import com.portfoliosync.infra.kafka.contract.payload.SyncConnectorTaskV1;
import com.portfoliosync.infra.kafka.topics.TaskTopics;
import java.time.Instant;
import java.util.UUID;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

/**
 * Writes task payloads into the dispatch queue. Callers run inside their own transaction so the
 * task becomes visible together with the state change that caused it.
 */
@Component
public class TaskEnqueuer {
  private final TaskDispatchRepository dispatchRepository;
  private final ObjectMapper objectMapper;

  public TaskEnqueuer(
      TaskDispatchRepository dispatchRepository,
      @Qualifier("taskObjectMapper") ObjectMapper objectMapper) {
    this.dispatchRepository = dispatchRepository;
    this.objectMapper = objectMapper;
  }

  public UUID enqueueSync(SyncConnectorTaskV1 task, Instant availableAt) {
    String topic =
        TaskTopics.forQueue(task.sourceType())
            .orElseThrow(
                () -> new IllegalArgumentException("No topic for source type " + task.sourceType()));
    String key = task.connectionKind() + ":" + task.connectionId();
    return dispatchRepository.enqueue(TaskTypes.SYNC_CONNECTOR, topic, key, toJson(task), availableAt);
  }

  public UUID enqueueAnalytics(RunUserAnalyticsTaskV1 task, Instant availableAt) {
    return dispatchRepository.enqueue(
        TaskTypes.RUN_USER_ANALYTICS,
        TaskTopics.ANALYTICS_USER_V1,
        "user:" + task.userId(),
        toJson(task),
        availableAt);
  }

  private String toJson(Object payload) {
    try {
      return objectMapper.writeValueAsString(payload);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("Failed to serialize task payload", ex);
    }
  }
}
