package com.portfoliosync.infra.kafka.consumer;

import com.portfoliosync.infra.kafka.contract.TaskEnvelope;

@FunctionalInterface
public interface TaskHandler<T> {
  void handle(TaskEnvelope<T> envelope) throws Exception;
}
