package com.portfoliosync.worker.task;

import com.portfoliosync.infra.kafka.consumer.HandlerRetry;
import com.portfoliosync.infra.kafka.consumer.TaskConsumerAdapter;
import com.portfoliosync.infra.kafka.contract.TaskTypes;
import com.portfoliosync.infra.kafka.contract.payload.SyncConnectorTaskV1;
import com.portfoliosync.infra.kafka.errors.DeadLetterPublisher;
import com.portfoliosync.infra.kafka.observability.KafkaTelemetry;
import com.portfoliosync.infra.kafka.serde.TaskEnvelopeJsonCodec;
import com.portfoliosync.infra.kafka.topics.TaskTopics;
import com.portfoliosync.worker.pipeline.AbandonedSyncTaskFinalizer;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.stereotype.Component;

@Component
public class SyncConnectorTaskConsumer {
  private final TaskConsumerAdapter<SyncConnectorTaskV1> adapter;

  public SyncConnectorTaskConsumer(
      TaskEnvelopeJsonCodec codec,
      DeadLetterPublisher deadLetterPublisher,
      HandlerRetry retry,
      KafkaTelemetry telemetry,
      SyncConnectorTaskHandler handler,
      AbandonedSyncTaskFinalizer finalizer) {
    this.adapter =
        new TaskConsumerAdapter<>(
            SyncConnectorTaskV1.class,
            TaskTypes.SYNC_CONNECTOR,
            1,
            codec,
            envelope -> handler.handle(envelope.payload()),
            deadLetterPublisher,
            finalizer::onDeadLettered,
            retry,
            telemetry);
  }

  @KafkaListener(
      topics = {TaskTopics.SYNC_CRYPTO_V1, TaskTopics.SYNC_RU_BROKERS_V1, TaskTopics.SYNC_TON_V1},
      groupId = "${infra.kafka.consumer.group-id:cg-sync-worker}",
      containerFactory = "infraKafkaListenerContainerFactory")
  public void onMessage(ConsumerRecord<String, String> record, Acknowledgment ack) {
    adapter.process(record);
    ack.acknowledge();
  }
}
