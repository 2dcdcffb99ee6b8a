package com.portfoliosync.infra.kafka.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;

import com.portfoliosync.infra.kafka.consumer.HandlerRetry;
import com.portfoliosync.infra.kafka.errors.DeadLetterPublisher;
import com.portfoliosync.infra.kafka.errors.KafkaDeadLetterPublisher;
import com.portfoliosync.infra.kafka.observability.KafkaTelemetry;
import com.portfoliosync.infra.kafka.observability.MicrometerKafkaTelemetry;
import com.portfoliosync.infra.kafka.observability.NoOpKafkaTelemetry;
import com.portfoliosync.infra.kafka.producer.KafkaTaskPublisher;
import com.portfoliosync.infra.kafka.producer.TaskPublisher;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.util.Map;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.kafka.core.ConsumerFactory;
import org.springframework.kafka.core.KafkaAdmin;

class InfraKafkaAutoConfigurationTest {
  private final ApplicationContextRunner contextRunner =
      new ApplicationContextRunner().withUserConfiguration(InfraKafkaAutoConfiguration.class);

  @Test
  void shouldWireTaskPublisherAndTopicDeadLetterByDefault() {
    contextRunner.run(
        context -> {
          assertInstanceOf(KafkaTaskPublisher.class, context.getBean(TaskPublisher.class));
          assertEquals(
              KafkaDeadLetterPublisher.class, context.getBean(DeadLetterPublisher.class).getClass());
          assertEquals(NoOpKafkaTelemetry.class, context.getBean(KafkaTelemetry.class).getClass());
          assertEquals(1, context.getBeansOfType(KafkaAdmin.NewTopics.class).size());
        });
  }

  @Test
  void shouldRunHandlersOnceUnlessConfigured() {
    contextRunner.run(context -> assertEquals(HandlerRetry.once(), context.getBean(HandlerRetry.class)));
    contextRunner
        .withPropertyValues("infra.kafka.retry.max-attempts=3", "infra.kafka.retry.backoff=250ms")
        .run(
            context ->
                assertEquals(
                    new HandlerRetry(3, Duration.ofMillis(250)), context.getBean(HandlerRetry.class)));
  }

  @Test
  void shouldUseMicrometerTelemetryWhenRegistryIsPresent() {
    contextRunner
        .withBean(SimpleMeterRegistry.class, SimpleMeterRegistry::new)
        .run(
            context ->
                assertEquals(
                    MicrometerKafkaTelemetry.class,
                    context.getBean(KafkaTelemetry.class).getClass()));
  }

  @Test
  void shouldBindMaxPollIntervalAsDuration() {
    contextRunner
        .withPropertyValues("infra.kafka.consumer.max-poll-interval=25m")
        .run(
            context -> {
              @SuppressWarnings("unchecked")
              ConsumerFactory<String, String> factory =
                  context.getBean("infraKafkaConsumerFactory", ConsumerFactory.class);
              assertEquals(
                  1_500_000,
                  factory.getConfigurationProperties().get(ConsumerConfig.MAX_POLL_INTERVAL_MS_CONFIG));
            });
  }

  @Test
  void shouldSkipTopicsWhenDisabled() {
    contextRunner
        .withPropertyValues("infra.kafka.topics.enabled=false")
        .run(context -> assertEquals(0, context.getBeansOfType(KafkaAdmin.NewTopics.class).size()));
  }

  @Test
  void consumerShouldPollOneLongRunningTaskAtATime() {
    contextRunner.run(
        context -> {
          @SuppressWarnings("unchecked")
          ConsumerFactory<String, String> factory =
              context.getBean("infraKafkaConsumerFactory", ConsumerFactory.class);
          Map<String, Object> config = factory.getConfigurationProperties();
          assertEquals(1, config.get(ConsumerConfig.MAX_POLL_RECORDS_CONFIG));
          assertEquals(1_200_000, config.get(ConsumerConfig.MAX_POLL_INTERVAL_MS_CONFIG));
          assertEquals("cg-sync-worker", config.get(ConsumerConfig.GROUP_ID_CONFIG));
          assertEquals(false, config.get(ConsumerConfig.ENABLE_AUTO_COMMIT_CONFIG));
        });
  }
}
