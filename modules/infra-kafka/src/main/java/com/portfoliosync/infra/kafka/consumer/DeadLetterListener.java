package com.portfoliosync.infra.kafka.consumer;

/**
 * Told about a task whose record was dead-lettered, so whatever waits on the task can be closed
 * out. Only called when the payload could be read.
 */
@FunctionalInterface
public interface DeadLetterListener<T> {
  void onDeadLettered(T payload, Exception failure);

  static <T> DeadLetterListener<T> ignoring() {
    return (payload, failure) -> {};
  }
}
