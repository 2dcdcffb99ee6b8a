package com.portfoliosync.worker.dispatch;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

public interface TaskDispatchRepository {
  UUID enqueue(String taskType, String topic, String messageKey, String payloadJson, Instant availableAt);

  List<TaskDispatchRecord> claimDueBatch(int limit);

  void markPublished(UUID id, Instant publishedAt);

  /** Returns true when this failure used up the last attempt and the row is now DEAD. */
  boolean markFailed(UUID id, String errorMessage);
}
