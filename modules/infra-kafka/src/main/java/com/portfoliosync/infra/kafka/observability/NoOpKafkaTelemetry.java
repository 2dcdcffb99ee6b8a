package com.portfoliosync.infra.kafka.observability;

public class NoOpKafkaTelemetry implements KafkaTelemetry {
  @Override
  public void onPublishSuccess(String topic, String taskType, long durationNanos) {}

  @Override
  public void onPublishFailure(String topic, String taskType, Throwable error) {}

  @Override
  public void onConsumeSuccess(String topic, String taskType, int partition, long durationNanos) {}

  @Override
  public void onConsumeFailure(String topic, String taskType, Throwable error) {}

  @Override
  public void onDeadLetter(String topic, Throwable error) {}
}
