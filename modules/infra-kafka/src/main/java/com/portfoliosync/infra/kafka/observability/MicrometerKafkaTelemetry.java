package com.portfoliosync.infra.kafka.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.util.concurrent.TimeUnit;

public class MicrometerKafkaTelemetry implements KafkaTelemetry {
  private final MeterRegistry meterRegistry;

  public MicrometerKafkaTelemetry(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
  }

  @Override
  public void onPublishSuccess(String topic, String taskType, long durationNanos) {
    outcome("infra.kafka.publish.total", topic, taskType, "success", null);
    Timer.builder("infra.kafka.publish.duration")
        .description("Task publish latency")
        .tag("topic", safeValue(topic))
        .tag("task_type", safeValue(taskType))
        .register(meterRegistry)
        .record(Math.max(0L, durationNanos), TimeUnit.NANOSECONDS);
  }

  @Override
  public void onPublishFailure(String topic, String taskType, Throwable error) {
    outcome("infra.kafka.publish.total", topic, taskType, "failure", error);
  }

  @Override
  public void onConsumeSuccess(String topic, String taskType, int partition, long durationNanos) {
    outcome("infra.kafka.consume.total", topic, taskType, "success", null);
    Timer.builder("infra.kafka.consume.duration")
        .description("Task processing latency")
        .tag("topic", safeValue(topic))
        .tag("task_type", safeValue(taskType))
        .register(meterRegistry)
        .record(Math.max(0L, durationNanos), TimeUnit.NANOSECONDS);
  }

  @Override
  public void onConsumeFailure(String topic, String taskType, Throwable error) {
    outcome("infra.kafka.consume.total", topic, taskType, "failure", error);
  }

  @Override
  public void onDeadLetter(String topic, Throwable error) {
    Counter.builder("infra.kafka.deadletter.total")
        .description("Tasks sent to the dead-letter path")
        .tag("topic", safeValue(topic))
        .tag("error", safeError(error))
        .register(meterRegistry)
        .increment();
  }

  private void outcome(
      String name, String topic, String taskType, String outcome, Throwable error) {
    Counter.builder(name)
        .tag("topic", safeValue(topic))
        .tag("task_type", safeValue(taskType))
        .tag("outcome", outcome)
        .tag("error", safeError(error))
        .register(meterRegistry)
        .increment();
  }

  private static String safeValue(String value) {
    return value == null || value.isBlank() ? "unknown" : value;
  }

  private static String safeError(Throwable error) {
    return error == null ? "none" : error.getClass().getSimpleName();
  }
}
