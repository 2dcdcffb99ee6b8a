package com.portfoliosync.worker.dispatch;

/** Told about a dispatch row that ran out of publish attempts and will never reach Kafka. */
@FunctionalInterface
public interface DeadDispatchListener {
  void onDeadDispatch(TaskDispatchRecord record, String error);
}
