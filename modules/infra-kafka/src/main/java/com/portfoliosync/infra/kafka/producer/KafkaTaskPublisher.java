package com.portfoliosync.infra.kafka.producer;

import com.portfoliosync.infra.kafka.contract.TaskEnvelope;
import com.portfoliosync.infra.kafka.contract.TaskHeaders;
import com.portfoliosync.infra.kafka.observability.KafkaTelemetry;
import com.portfoliosync.infra.kafka.serde.TaskEnvelopeJsonCodec;
import com.portfoliosync.infra.kafka.topics.TopicNameValidator;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;

/**
 * Publishes task envelopes keyed by {@link TaskEnvelope#key()}, so every attempt for the same
 * connection lands on the same partition.
 */
public class KafkaTaskPublisher implements TaskPublisher {
  private final KafkaTemplate<String, String> kafkaTemplate;
  private final TaskEnvelopeJsonCodec codec;
  private final KafkaTelemetry telemetry;
  private final Duration sendTimeout;

  public KafkaTaskPublisher(
      KafkaTemplate<String, String> kafkaTemplate,
      TaskEnvelopeJsonCodec codec,
      KafkaTelemetry telemetry,
      Duration sendTimeout) {
    this.kafkaTemplate = kafkaTemplate;
    this.codec = codec;
    this.telemetry = telemetry;
    this.sendTimeout = sendTimeout == null ? Duration.ZERO : sendTimeout;
  }

  @Override
  public <T> CompletableFuture<SendResult<String, String>> publish(
      String topic, TaskEnvelope<T> envelope) {
    TopicNameValidator.assertValid(topic);
    String key = envelope.key();
    long started = System.nanoTime();

    ProducerRecord<String, String> record = new ProducerRecord<>(topic, key, codec.encode(envelope));
    TaskHeaders.write(record.headers(), envelope);

    CompletableFuture<SendResult<String, String>> sendFuture = kafkaTemplate.send(record);
    if (!sendTimeout.isZero() && !sendTimeout.isNegative()) {
      sendFuture = sendFuture.orTimeout(sendTimeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    CompletableFuture<SendResult<String, String>> result = new CompletableFuture<>();
    sendFuture.whenComplete(
        (sendResult, throwable) -> {
          if (throwable == null) {
            telemetry.onPublishSuccess(topic, envelope.taskType(), System.nanoTime() - started);
            result.complete(sendResult);
            return;
          }
          KafkaPublishException failure = wrap(topic, key, envelope.taskType(), throwable);
          telemetry.onPublishFailure(topic, envelope.taskType(), failure);
          result.completeExceptionally(failure);
        });
    return result;
  }

  private static KafkaPublishException wrap(
      String topic, String key, String taskType, Throwable throwable) {
    Throwable cause = throwable;
    if (throwable instanceof CompletionException && throwable.getCause() != null) {
      cause = throwable.getCause();
    }
    if (cause instanceof KafkaPublishException existing) {
      return existing;
    }
    String prefix = cause instanceof TimeoutException ? "Timed out publishing" : "Failed to publish";
    return new KafkaPublishException(
        topic,
        key,
        taskType,
        prefix + " task to Kafka topic=" + topic + " key=" + key + " taskType=" + taskType,
        cause);
  }
}
