package com.portfoliosync.infra.kafka.errors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.nio.charset.StandardCharsets;
import java.util.concurrent.CompletableFuture;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.header.Header;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;

class KafkaDeadLetterPublisherTest {
  @Test
  void shouldPublishToDerivedDlqTopicWithProvenanceHeaders() {
    @SuppressWarnings("unchecked")
    KafkaTemplate<String, String> kafkaTemplate = mock(KafkaTemplate.class);
    when(kafkaTemplate.send(any(ProducerRecord.class)))
        .thenReturn(CompletableFuture.completedFuture(new SendResult<>(null, null)));

    KafkaDeadLetterPublisher publisher =
        new KafkaDeadLetterPublisher(kafkaTemplate);
    ConsumerRecord<String, String> failed =
        new ConsumerRecord<>("sync.rubrokers.v1", 2, 12L, "INTEGRATION:5", "{\"taskId\":\"x\"}");

    publisher.publish("sync.rubrokers.v1", failed, new IllegalStateException("boom"));

    ProducerRecord<String, String> dlq = captureSent(kafkaTemplate);
    assertEquals("sync.rubrokers.dlq.v1", dlq.topic());
    assertEquals("INTEGRATION:5", dlq.key());
    assertEquals("{\"taskId\":\"x\"}", dlq.value());
    assertEquals("sync.rubrokers.v1", headerValue(dlq, "x-dlq-source-topic"));
    assertEquals("2", headerValue(dlq, "x-dlq-source-partition"));
    assertEquals("12", headerValue(dlq, "x-dlq-source-offset"));
    assertEquals(IllegalStateException.class.getName(), headerValue(dlq, "x-dlq-exception-class"));
    assertEquals("boom", headerValue(dlq, "x-dlq-exception-message"));
    assertNotNull(headerValue(dlq, "x-dlq-failed-at"));
  }

  @Test
  void shouldFallBackToPlaceholderMessage() {
    @SuppressWarnings("unchecked")
    KafkaTemplate<String, String> kafkaTemplate = mock(KafkaTemplate.class);
    when(kafkaTemplate.send(any(ProducerRecord.class)))
        .thenReturn(CompletableFuture.completedFuture(new SendResult<>(null, null)));

    new KafkaDeadLetterPublisher(kafkaTemplate)
        .publish(
            "analytics.user.v1",
            new ConsumerRecord<>("analytics.user.v1", 0, 1L, "user:1", "{}"),
            new RuntimeException((String) null));

    ProducerRecord<String, String> dlq = captureSent(kafkaTemplate);
    assertEquals("analytics.user.dlq.v1", dlq.topic());
    assertEquals("no-message", headerValue(dlq, "x-dlq-exception-message"));
  }

  @Test
  void shouldRejectTopicWithoutDeadLetterTwin() {
    @SuppressWarnings("unchecked")
    KafkaTemplate<String, String> kafkaTemplate = mock(KafkaTemplate.class);

    assertThrows(
        IllegalArgumentException.class,
        () ->
            new KafkaDeadLetterPublisher(kafkaTemplate)
                .publish(
                    "orders.v1",
                    new ConsumerRecord<>("orders.v1", 0, 1L, "k", "{}"),
                    new IllegalStateException("boom")));
    verify(kafkaTemplate, never()).send(any(ProducerRecord.class));
  }

  private static ProducerRecord<String, String> captureSent(KafkaTemplate<String, String> template) {
    @SuppressWarnings("unchecked")
    ArgumentCaptor<ProducerRecord<String, String>> captor =
        ArgumentCaptor.forClass(ProducerRecord.class);
    verify(template).send(captor.capture());
    return captor.getValue();
  }

  private static String headerValue(ProducerRecord<String, String> record, String name) {
    Header header = record.headers().lastHeader(name);
    assertNotNull(header, "Expected header " + name + " to exist");
    return new String(header.value(), StandardCharsets.UTF_8);
  }
}
