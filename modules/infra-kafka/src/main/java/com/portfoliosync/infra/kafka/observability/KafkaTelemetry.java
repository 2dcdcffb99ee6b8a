package com.portfoliosync.infra.kafka.observability;

public interface KafkaTelemetry {
  void onPublishSuccess(String topic, String taskType, long durationNanos);

  void onPublishFailure(String topic, String taskType, Throwable error);

  void onConsumeSuccess(String topic, String taskType, int partition, long durationNanos);

  void onConsumeFailure(String topic, String taskType, Throwable error);

  void onDeadLetter(String topic, Throwable error);
}
