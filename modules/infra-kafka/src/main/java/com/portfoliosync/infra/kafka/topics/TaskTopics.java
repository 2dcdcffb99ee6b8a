package com.portfoliosync.infra.kafka.topics;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.apache.kafka.clients.admin.NewTopic;

/** One topic per logical work queue, plus its dead-letter twin. */
public final class TaskTopics {
  public static final String SYNC_CRYPTO_V1 = "sync.crypto.v1";
  public static final String SYNC_RU_BROKERS_V1 = "sync.rubrokers.v1";
  public static final String SYNC_TON_V1 = "sync.ton.v1";
  public static final String ANALYTICS_USER_V1 = "analytics.user.v1";

  public static final String SYNC_CRYPTO_DLQ_V1 = "sync.crypto.dlq.v1";
  public static final String SYNC_RU_BROKERS_DLQ_V1 = "sync.rubrokers.dlq.v1";
  public static final String SYNC_TON_DLQ_V1 = "sync.ton.dlq.v1";
  public static final String ANALYTICS_USER_DLQ_V1 = "analytics.user.dlq.v1";

  private static final Map<String, String> DEAD_LETTER =
      Map.of(
          SYNC_CRYPTO_V1, SYNC_CRYPTO_DLQ_V1,
          SYNC_RU_BROKERS_V1, SYNC_RU_BROKERS_DLQ_V1,
          SYNC_TON_V1, SYNC_TON_DLQ_V1,
          ANALYTICS_USER_V1, ANALYTICS_USER_DLQ_V1);

  private TaskTopics() {}

  /** Maps a queue name ({@code sync_crypto}, {@code sync_ru_brokers}, {@code sync_ton}, {@code analytics}). */
  public static Optional<String> forQueue(String queueName) {
    if (queueName == null) {
      return Optional.empty();
    }
    return switch (queueName) {
      case "sync_crypto" -> Optional.of(SYNC_CRYPTO_V1);
      case "sync_ru_brokers" -> Optional.of(SYNC_RU_BROKERS_V1);
      case "sync_ton" -> Optional.of(SYNC_TON_V1);
      case "analytics" -> Optional.of(ANALYTICS_USER_V1);
      default -> Optional.empty();
    };
  }

  public static String deadLetterFor(String workTopic) {
    String deadLetter = DEAD_LETTER.get(workTopic);
    if (deadLetter == null) {
      throw new IllegalArgumentException("No dead-letter topic for " + workTopic);
    }
    return deadLetter;
  }

  public static List<String> all() {
    return List.of(
        SYNC_CRYPTO_V1,
        SYNC_RU_BROKERS_V1,
        SYNC_TON_V1,
        ANALYTICS_USER_V1,
        SYNC_CRYPTO_DLQ_V1,
        SYNC_RU_BROKERS_DLQ_V1,
        SYNC_TON_DLQ_V1,
        ANALYTICS_USER_DLQ_V1);
  }

  /**
   * Work topics get {@code partitions} so connections spread over consumers; dead-letter topics
   * get a single partition since only operators read them.
   */
  public static List<NewTopic> newTopics(int partitions, short replicationFactor) {
    if (partitions < 1 || replicationFactor < 1) {
      throw new IllegalArgumentException(
          "partitions and replication factor must be >= 1, got " + partitions + "/" + replicationFactor);
    }
    List<NewTopic> topics = new ArrayList<>();
    for (String topic : all()) {
      TopicNameValidator.assertValid(topic);
      int topicPartitions = DEAD_LETTER.containsKey(topic) ? partitions : 1;
      topics.add(new NewTopic(topic, topicPartitions, replicationFactor));
    }
    return topics;
  }
}
