package com.portfoliosync.infra.kafka.producer;

public class KafkaPublishException extends RuntimeException {
  private final String topic;
  private final String key;
  private final String taskType;

  public KafkaPublishException(
      String topic, String key, String taskType, String message, Throwable cause) {
    super(message, cause);
    this.topic = topic;
    this.key = key;
    this.taskType = taskType;
  }

  public String getTopic() {
    return topic;
  }

  public String getKey() {
    return key;
  }

  public String getTaskType() {
    return taskType;
  }
}
