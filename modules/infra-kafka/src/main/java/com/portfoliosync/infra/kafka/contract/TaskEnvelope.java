package com.portfoliosync.infra.kafka.contract;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/** Wire wrapper of every queued task. The payload carries only primitive identifiers. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TaskEnvelope<T>(
    UUID taskId,
    String taskType,
    int taskVersion,
    Instant enqueuedAt,
    String producer,
    String correlationId,
    String key,
    T payload) {
  public TaskEnvelope {
    Objects.requireNonNull(taskId, "taskId must not be null");
    requireNonBlank(taskType, "taskType");
    if (taskVersion < 1) {
      throw new IllegalArgumentException("taskVersion must be >= 1");
    }
    Objects.requireNonNull(enqueuedAt, "enqueuedAt must not be null");
    requireNonBlank(producer, "producer");
    requireNonBlank(correlationId, "correlationId");
    requireNonBlank(key, "key");
    Objects.requireNonNull(payload, "payload must not be null");
  }

  public static <T> TaskEnvelope<T> of(
      String taskType, int taskVersion, String producer, String correlationId, String key, T payload) {
    return new TaskEnvelope<>(
        UUID.randomUUID(), taskType, taskVersion, Instant.now(), producer, correlationId, key, payload);
  }

  private static void requireNonBlank(String value, String fieldName) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException(fieldName + " must not be blank");
    }
  }
}
