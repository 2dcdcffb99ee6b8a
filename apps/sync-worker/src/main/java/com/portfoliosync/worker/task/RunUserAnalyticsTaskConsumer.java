package com.portfoliosync.worker.task;

import com.portfoliosync.infra.kafka.consumer.DeadLetterListener;
import com.portfoliosync.infra.kafka.consumer.HandlerRetry;
import com.portfoliosync.infra.kafka.consumer.TaskConsumerAdapter;
import com.portfoliosync.infra.kafka.contract.TaskTypes;
import com.portfoliosync.infra.kafka.contract.payload.RunUserAnalyticsTaskV1;
import com.portfoliosync.infra.kafka.errors.DeadLetterPublisher;
import com.portfoliosync.infra.kafka.observability.KafkaTelemetry;
import com.portfoliosync.infra.kafka.serde.TaskEnvelopeJsonCodec;
import com.portfoliosync.infra.kafka.topics.TaskTopics;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.stereotype.Component;

@Component
public class RunUserAnalyticsTaskConsumer {
  private final TaskConsumerAdapter<RunUserAnalyticsTaskV1> adapter;

  public RunUserAnalyticsTaskConsumer(
      TaskEnvelopeJsonCodec codec,
      DeadLetterPublisher deadLetterPublisher,
      HandlerRetry retry,
      KafkaTelemetry telemetry,
      RunUserAnalyticsTaskHandler handler) {
    this.adapter =
        new TaskConsumerAdapter<>(
            RunUserAnalyticsTaskV1.class,
            TaskTypes.RUN_USER_ANALYTICS,
            1,
            codec,
            envelope -> handler.handle(envelope.payload()),
            deadLetterPublisher,
            DeadLetterListener.ignoring(),
            retry,
            telemetry);
  }

  @KafkaListener(
      topics = TaskTopics.ANALYTICS_USER_V1,
      groupId = "${infra.kafka.consumer.group-id:cg-sync-worker}",
      containerFactory = "infraKafkaListenerContainerFactory")
  public void onMessage(ConsumerRecord<String, String> record, Acknowledgment ack) {
    adapter.process(record);
    ack.acknowledge();
  }
}
