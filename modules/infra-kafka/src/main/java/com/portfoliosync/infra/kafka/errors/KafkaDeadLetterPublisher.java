package com.portfoliosync.infra.kafka.errors;

import com.portfoliosync.infra.kafka.topics.TaskTopics;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Objects;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.kafka.core.KafkaTemplate;

/**
 * Copies a failed task record, body included, to the dead-letter twin of its topic with
 * provenance headers, so an operator can replay it after fixing the cause.
 */
public class KafkaDeadLetterPublisher implements DeadLetterPublisher {
  private static final Logger log = LoggerFactory.getLogger(KafkaDeadLetterPublisher.class);

  static final String HEADER_SOURCE_TOPIC = "x-dlq-source-topic";
  static final String HEADER_SOURCE_PARTITION = "x-dlq-source-partition";
  static final String HEADER_SOURCE_OFFSET = "x-dlq-source-offset";
  static final String HEADER_EXCEPTION_CLASS = "x-dlq-exception-class";
  static final String HEADER_EXCEPTION_MESSAGE = "x-dlq-exception-message";
  static final String HEADER_FAILED_AT = "x-dlq-failed-at";

  private final KafkaTemplate<String, String> kafkaTemplate;

  public KafkaDeadLetterPublisher(KafkaTemplate<String, String> kafkaTemplate) {
    this.kafkaTemplate = Objects.requireNonNull(kafkaTemplate, "kafkaTemplate must not be null");
  }

  @Override
  public void publish(
      String sourceTopic, ConsumerRecord<String, String> failedRecord, Exception exception) {
    String targetTopic = TaskTopics.deadLetterFor(sourceTopic);
    ProducerRecord<String, String> deadLetter =
        new ProducerRecord<>(targetTopic, failedRecord.key(), failedRecord.value());
    header(deadLetter, HEADER_SOURCE_TOPIC, sourceTopic);
    header(deadLetter, HEADER_SOURCE_PARTITION, Integer.toString(failedRecord.partition()));
    header(deadLetter, HEADER_SOURCE_OFFSET, Long.toString(failedRecord.offset()));
    header(deadLetter, HEADER_EXCEPTION_CLASS, exception.getClass().getName());
    header(deadLetter, HEADER_EXCEPTION_MESSAGE, safeMessage(exception.getMessage()));
    header(deadLetter, HEADER_FAILED_AT, Instant.now().toString());

    kafkaTemplate
        .send(deadLetter)
        .whenComplete(
            (result, throwable) -> {
              if (throwable != null) {
                log.error(
                    "Failed to publish DLQ record sourceTopic={} targetTopic={} partition={} offset={}",
                    sourceTopic,
                    targetTopic,
                    failedRecord.partition(),
                    failedRecord.offset(),
                    throwable);
                return;
              }
              log.warn(
                  "Published DLQ record sourceTopic={} targetTopic={} partition={} offset={}",
                  sourceTopic,
                  targetTopic,
                  failedRecord.partition(),
                  failedRecord.offset());
            });
  }

    private static void header(ProducerRecord<String, String> record, String name, String value) {
    record.headers().add(name, value.getBytes(StandardCharsets.UTF_8));
  }

  private static String safeMessage(String message) {
    if (message == null || message.isBlank()) {
      return "no-message";
    }
    return message;
  }
}
