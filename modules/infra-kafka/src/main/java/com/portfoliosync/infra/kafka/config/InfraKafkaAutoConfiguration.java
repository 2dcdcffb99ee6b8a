package com.portfoliosync.infra.kafka.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.portfoliosync.infra.kafka.consumer.HandlerRetry;
import com.portfoliosync.infra.kafka.errors.DeadLetterPublisher;
import com.portfoliosync.infra.kafka.errors.KafkaDeadLetterPublisher;
import com.portfoliosync.infra.kafka.observability.KafkaTelemetry;
import com.portfoliosync.infra.kafka.observability.MicrometerKafkaTelemetry;
import com.portfoliosync.infra.kafka.observability.NoOpKafkaTelemetry;
import com.portfoliosync.infra.kafka.producer.KafkaTaskPublisher;
import com.portfoliosync.infra.kafka.producer.TaskPublisher;
import com.portfoliosync.infra.kafka.serde.TaskEnvelopeJsonCodec;
import com.portfoliosync.infra.kafka.serde.TaskObjectMapperFactory;
import com.portfoliosync.infra.kafka.topics.TaskTopics;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.Map;
import org.apache.kafka.clients.admin.NewTopic;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.common.serialization.StringDeserializer;
import org.apache.kafka.common.serialization.StringSerializer;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.kafka.config.ConcurrentKafkaListenerContainerFactory;
import org.springframework.kafka.core.ConsumerFactory;
import org.springframework.kafka.core.DefaultKafkaConsumerFactory;
import org.springframework.kafka.core.DefaultKafkaProducerFactory;
import org.springframework.kafka.core.KafkaAdmin;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.core.ProducerFactory;
import org.springframework.kafka.listener.ContainerProperties;

/**
 * Kafka wiring of the task queues: the dispatch publisher, the dead-letter publisher, topic
 * creation and the listener container the sync and analytics consumers run in.
 *
 * <p>Tasks are published from the dispatch queue, which retries on its own, so the producer is
 * idempotent with acks from all replicas and a single send is never retried for long. Listeners
 * take one record per poll and acknowledge manually once the handler has returned.
 */
@AutoConfiguration
@EnableConfigurationProperties(InfraKafkaProperties.class)
public class InfraKafkaAutoConfiguration {
  @Bean
  @ConditionalOnMissingBean(name = "taskObjectMapper")
  public ObjectMapper taskObjectMapper() {
    return TaskObjectMapperFactory.create();
  }

  @Bean
  @ConditionalOnMissingBean
  public TaskEnvelopeJsonCodec taskEnvelopeJsonCodec(@Qualifier("taskObjectMapper") ObjectMapper taskObjectMapper) {
    return new TaskEnvelopeJsonCodec(taskObjectMapper);
  }

  @Bean
  @ConditionalOnBean(MeterRegistry.class)
  @ConditionalOnMissingBean(KafkaTelemetry.class)
  public KafkaTelemetry micrometerKafkaTelemetry(MeterRegistry meterRegistry) {
    return new MicrometerKafkaTelemetry(meterRegistry);
  }

  @Bean
  @ConditionalOnMissingBean(KafkaTelemetry.class)
  public KafkaTelemetry noOpKafkaTelemetry() {
    return new NoOpKafkaTelemetry();
  }

  @Bean
  @ConditionalOnMissingBean
  public HandlerRetry taskHandlerRetry(InfraKafkaProperties properties) {
    return new HandlerRetry(properties.getRetry().getMaxAttempts(), properties.getRetry().getBackoff());
  }

  @Bean
  @ConditionalOnMissingBean(name = "infraKafkaProducerFactory")
  public ProducerFactory<String, String> infraKafkaProducerFactory(InfraKafkaProperties properties) {
    Map<String, Object> config =
        Map.of(
            ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, String.join(",", properties.getBootstrapServers()),
            ProducerConfig.CLIENT_ID_CONFIG, properties.getClientId(),
            ProducerConfig.ACKS_CONFIG, "all",
            ProducerConfig.ENABLE_IDEMPOTENCE_CONFIG, true,
            ProducerConfig.COMPRESSION_TYPE_CONFIG, "lz4",
            ProducerConfig.LINGER_MS_CONFIG, 5,
            ProducerConfig.DELIVERY_TIMEOUT_MS_CONFIG, 60_000,
            ProducerConfig.REQUEST_TIMEOUT_MS_CONFIG, 30_000,
            ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, StringSerializer.class,
            ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, StringSerializer.class);
    return new DefaultKafkaProducerFactory<>(config);
  }

  @Bean
  @ConditionalOnMissingBean(name = "infraKafkaTemplate")
  public KafkaTemplate<String, String> infraKafkaTemplate(ProducerFactory<String, String> infraKafkaProducerFactory) {
    return new KafkaTemplate<>(infraKafkaProducerFactory);
  }

  @Bean
  @ConditionalOnMissingBean
  public DeadLetterPublisher deadLetterPublisher(KafkaTemplate<String, String> infraKafkaTemplate) {
    return new KafkaDeadLetterPublisher(infraKafkaTemplate);
  }

  @Bean
  @ConditionalOnMissingBean
  public TaskPublisher taskPublisher(
      KafkaTemplate<String, String> infraKafkaTemplate,
      TaskEnvelopeJsonCodec taskEnvelopeJsonCodec,
      KafkaTelemetry kafkaTelemetry,
      InfraKafkaProperties properties) {
    return new KafkaTaskPublisher(
        infraKafkaTemplate, taskEnvelopeJsonCodec, kafkaTelemetry, properties.getSendTimeout());
  }

  @Bean
  @ConditionalOnProperty(prefix = "infra.kafka.topics", name = "enabled", havingValue = "true", matchIfMissing = true)
  @ConditionalOnMissingBean(name = "infraKafkaTopics")
  public KafkaAdmin.NewTopics infraKafkaTopics(InfraKafkaProperties properties) {
    InfraKafkaProperties.Topics topics = properties.getTopics();
    return new KafkaAdmin.NewTopics(
        TaskTopics.newTopics(topics.getPartitions(), topics.getReplicationFactor()).toArray(NewTopic[]::new));
  }

  @Bean
  @ConditionalOnMissingBean(name = "infraKafkaConsumerFactory")
  public ConsumerFactory<String, String> infraKafkaConsumerFactory(InfraKafkaProperties properties) {
    InfraKafkaProperties.Consumer consumer = properties.getConsumer();
    Map<String, Object> config =
        Map.of(
            ConsumerConfig.BOOTSTRAP_SERVERS_CONFIG, String.join(",", properties.getBootstrapServers()),
            ConsumerConfig.GROUP_ID_CONFIG, consumer.getGroupId(),
            ConsumerConfig.AUTO_OFFSET_RESET_CONFIG, "earliest",
            ConsumerConfig.ENABLE_AUTO_COMMIT_CONFIG, false,
            ConsumerConfig.MAX_POLL_RECORDS_CONFIG, 1,
            ConsumerConfig.MAX_POLL_INTERVAL_MS_CONFIG, (int) consumer.getMaxPollInterval().toMillis(),
            ConsumerConfig.KEY_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class,
            ConsumerConfig.VALUE_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class);
    return new DefaultKafkaConsumerFactory<>(config);
  }

  @Bean(name = "infraKafkaListenerContainerFactory")
  @ConditionalOnMissingBean(name = "infraKafkaListenerContainerFactory")
  public ConcurrentKafkaListenerContainerFactory<String, String> infraKafkaListenerContainerFactory(
      ConsumerFactory<String, String> infraKafkaConsumerFactory, InfraKafkaProperties properties) {
    ConcurrentKafkaListenerContainerFactory<String, String> factory = new ConcurrentKafkaListenerContainerFactory<>();
    factory.setConsumerFactory(infraKafkaConsumerFactory);
    factory.setConcurrency(Math.max(1, properties.getConsumer().getConcurrency()));
    factory.getContainerProperties().setAckMode(ContainerProperties.AckMode.MANUAL_IMMEDIATE);
    return factory;
  }
}
