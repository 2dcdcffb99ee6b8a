package com.portfoliosync.infra.kafka.consumer;

import com.portfoliosync.infra.kafka.contract.TaskEnvelope;
import com.portfoliosync.infra.kafka.contract.TaskHeaders;
import com.portfoliosync.infra.kafka.errors.DeadLetterPublisher;
import com.portfoliosync.infra.kafka.errors.InvalidTaskMetadataException;
import com.portfoliosync.infra.kafka.observability.KafkaTelemetry;
import com.portfoliosync.infra.kafka.serde.TaskEnvelopeJsonCodec;
import java.time.Duration;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decodes a task record, validates its headers against the expected type and version, and
 * hands the envelope to a {@link TaskHandler}.
 *
 * <p>Malformed records go straight to the dead-letter topic. Handler exceptions are retried
 * in-process under {@link HandlerRetry} and dead-lettered once it gives up. After every
 * dead-letter the {@link DeadLetterListener} learns which task was abandoned, so a sync run
 * cannot hold its batch open forever. Handlers that reschedule their own work (through the
 * dispatch queue) return normally.
 */
public class TaskConsumerAdapter<T> {
  private static final Logger log = LoggerFactory.getLogger(TaskConsumerAdapter.class);

  private final Class<T> payloadType;
  private final String expectedTaskType;
  private final int expectedTaskVersion;
  private final TaskEnvelopeJsonCodec codec;
  private final TaskHandler<T> handler;
  private final DeadLetterPublisher deadLetterPublisher;
  private final DeadLetterListener<T> deadLetterListener;
  private final HandlerRetry retry;
  private final KafkaTelemetry telemetry;

  public TaskConsumerAdapter(
      Class<T> payloadType,
      String expectedTaskType,
      int expectedTaskVersion,
      TaskEnvelopeJsonCodec codec,
      TaskHandler<T> handler,
      DeadLetterPublisher deadLetterPublisher,
      DeadLetterListener<T> deadLetterListener,
      HandlerRetry retry,
      KafkaTelemetry telemetry) {
    this.payloadType = payloadType;
    this.expectedTaskType = expectedTaskType;
    this.expectedTaskVersion = expectedTaskVersion;
    this.codec = codec;
    this.handler = handler;
    this.deadLetterPublisher = deadLetterPublisher;
    this.deadLetterListener = deadLetterListener;
    this.retry = retry;
    this.telemetry = telemetry;
  }

  public void process(ConsumerRecord<String, String> record) {
    long started = System.nanoTime();

    TaskEnvelope<T> envelope;
    try {
      TaskHeaders.requireValid(record.headers());
      envelope = codec.decode(record.value(), payloadType);
      checkIdentity(envelope);
    } catch (RuntimeException ex) {
      telemetry.onConsumeFailure(record.topic(), TaskHeaders.read(record.headers(), TaskHeaders.TASK_TYPE), ex);
      deadLetter(record, null, ex);
      return;
    }

    int attempt = 1;
    while (true) {
      try {
        handler.handle(envelope);
        telemetry.onConsumeSuccess(
            record.topic(), envelope.taskType(), record.partition(), System.nanoTime() - started);
        return;
      } catch (Exception ex) {
        telemetry.onConsumeFailure(record.topic(), envelope.taskType(), ex);
        if (!retry.allowsAnotherAttempt(attempt, ex)) {
          deadLetter(record, envelope.payload(), ex);
          return;
        }
        if (!pause(retry.backoff())) {
          deadLetter(record, envelope.payload(), new IllegalStateException("Interrupted between handler attempts", ex));
          return;
        }
        attempt++;
      }
    }
  }

  private void deadLetter(ConsumerRecord<String, String> record, T payload, Exception failure) {
    try {
      deadLetterPublisher.publish(record.topic(), record, failure);
    } catch (RuntimeException publishFailure) {
      log.error(
          "Dead-letter publish failed topic={} partition={} offset={}",
          record.topic(),
          record.partition(),
          record.offset(),
          publishFailure);
    }
    telemetry.onDeadLetter(record.topic(), failure);

    T abandoned = payload != null ? payload : codec.readPayload(record.value(), payloadType).orElse(null);
    if (abandoned == null) {
      log.warn(
          "Dead-lettered record has no readable {} payload topic={} partition={} offset={}",
          payloadType.getSimpleName(),
          record.topic(),
          record.partition(),
          record.offset());
      return;
    }
    try {
      deadLetterListener.onDeadLettered(abandoned, failure);
    } catch (RuntimeException listenerFailure) {
      log.error(
          "Dead-letter listener failed topic={} partition={} offset={}",
          record.topic(),
          record.partition(),
          record.offset(),
          listenerFailure);
    }
  }

  private void checkIdentity(TaskEnvelope<T> envelope) {
    if (!expectedTaskType.equals(envelope.taskType())) {
      throw new InvalidTaskMetadataException(
          "Unexpected task type: expected=" + expectedTaskType + " actual=" + envelope.taskType());
    }
    if (expectedTaskVersion != envelope.taskVersion()) {
      throw new InvalidTaskMetadataException(
          "Unexpected task version: expected=" + expectedTaskVersion + " actual=" + envelope.taskVersion());
    }
  }

  private static boolean pause(Duration backoff) {
    if (backoff.isZero()) {
      return true;
    }
    try {
      Thread.sleep(backoff.toMillis());
      return true;
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      return false;
    }
  }
}
