package com.portfoliosync.infra.kafka.topics;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;
import org.apache.kafka.clients.admin.NewTopic;
import org.junit.jupiter.api.Test;

class TaskTopicsTest {
  @Test
  void everyTopicShouldBeValid() {
    TaskTopics.all().forEach(topic -> assertTrue(TopicNameValidator.isValid(topic), topic));
  }

  @Test
  void shouldMapQueueNamesToTopics() {
    assertEquals(Optional.of(TaskTopics.SYNC_CRYPTO_V1), TaskTopics.forQueue("sync_crypto"));
    assertEquals(Optional.of(TaskTopics.SYNC_RU_BROKERS_V1), TaskTopics.forQueue("sync_ru_brokers"));
    assertEquals(Optional.of(TaskTopics.SYNC_TON_V1), TaskTopics.forQueue("sync_ton"));
    assertEquals(Optional.empty(), TaskTopics.forQueue("sync_unknown"));
  }

  @Test
  void validatorShouldRejectUnversionedOrUpperCaseNames() {
    assertFalse(TopicNameValidator.isValid("sync.ton"));
    assertFalse(TopicNameValidator.isValid("Sync.ton.v1"));
    assertFalse(TopicNameValidator.isValid("sync_ton.v1"));
    assertThrows(IllegalArgumentException.class, () -> TopicNameValidator.assertValid("ton.v0"));
  }

  @Test
  void shouldPairEveryWorkTopicWithItsDeadLetterTopic() {
    assertEquals(TaskTopics.SYNC_TON_DLQ_V1, TaskTopics.deadLetterFor(TaskTopics.SYNC_TON_V1));
    assertEquals(TaskTopics.ANALYTICS_USER_DLQ_V1, TaskTopics.deadLetterFor(TaskTopics.ANALYTICS_USER_V1));
    assertThrows(IllegalArgumentException.class, () -> TaskTopics.deadLetterFor(TaskTopics.SYNC_TON_DLQ_V1));
  }

  @Test
  void shouldGiveDeadLetterTopicsOnePartition() {
    Map<String, Integer> partitions =
        TaskTopics.newTopics(3, (short) 1).stream()
            .collect(Collectors.toMap(NewTopic::name, NewTopic::numPartitions));

    assertEquals(8, partitions.size());
    assertEquals(3, partitions.get(TaskTopics.SYNC_CRYPTO_V1));
    assertEquals(1, partitions.get(TaskTopics.SYNC_CRYPTO_DLQ_V1));
    assertThrows(IllegalArgumentException.class, () -> TaskTopics.newTopics(0, (short) 1));
  }
}
