package com.portfoliosync.worker.dispatch;

import java.time.Instant;
import java.util.UUID;

public record TaskDispatchRecord(
    UUID id,
    String taskType,
    String topic,
    String messageKey,
    String payload,
    String status,
    int attemptCount,
    Instant availableAt,
    Instant createdAt) {}
