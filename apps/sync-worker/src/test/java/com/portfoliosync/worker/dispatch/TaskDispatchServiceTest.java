package com.portfoliosync.worker.dispatch;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.JsonNode;
import com.portfoliosync.infra.kafka.contract.TaskEnvelope;
import com.portfoliosync.infra.kafka.producer.KafkaPublishException;
import com.portfoliosync.infra.kafka.producer.TaskPublisher;
import com.portfoliosync.infra.kafka.serde.TaskObjectMapperFactory;
import com.portfoliosync.worker.config.DispatchProperties;
import com.portfoliosync.worker.config.SyncTaskProperties;
import com.portfoliosync.worker.metrics.PipelineMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.kafka.support.SendResult;

@ExtendWith(MockitoExtension.class)
class TaskDispatchServiceTest {
  @Mock private TaskDispatchRepository dispatchRepository;

  @Mock private TaskPublisher taskPublisher;

  @Mock private DeadDispatchListener deadDispatchListener;

  private SimpleMeterRegistry meterRegistry;
  private TaskDispatchService service;

  @BeforeEach
  void setUp() {
    DispatchProperties properties = new DispatchProperties();
    properties.setBatchSize(50);
    SyncTaskProperties taskProperties = new SyncTaskProperties();
    taskProperties.setProducerName("sync-worker-dispatch");
    meterRegistry = new SimpleMeterRegistry();
    service =
        new TaskDispatchService(
            dispatchRepository,
            taskPublisher,
            properties,
            taskProperties,
            TaskObjectMapperFactory.create(),
            new PipelineMetrics(meterRegistry),
            deadDispatchListener);
  }

  @Test
  void shouldPublishDueTaskWithBatchCorrelationAndMarkPublished() {
    UUID id = UUID.randomUUID();
    TaskDispatchRecord record =
        new TaskDispatchRecord(
            id,
            "SYNC_CONNECTOR",
            "sync.crypto.v1",
            "INTEGRATION:11",
            "{\"batchId\":42,\"userId\":7,\"connectionId\":11}",
            "PROCESSING",
            0,
            Instant.parse("2026-03-01T02:30:00Z"),
            Instant.parse("2026-03-01T02:30:00Z"));
    when(dispatchRepository.claimDueBatch(50)).thenReturn(List.of(record));
    CompletableFuture<SendResult<String, String>> sent = CompletableFuture.completedFuture(null);
    when(taskPublisher.publish(eq("sync.crypto.v1"), any(TaskEnvelope.class))).thenReturn(sent);

    service.dispatchDueTasks();

    @SuppressWarnings("unchecked")
    ArgumentCaptor<TaskEnvelope<JsonNode>> envelopeCaptor = ArgumentCaptor.forClass(TaskEnvelope.class);
    verify(taskPublisher).publish(eq("sync.crypto.v1"), envelopeCaptor.capture());
    TaskEnvelope<JsonNode> envelope = envelopeCaptor.getValue();
    assertEquals("SYNC_CONNECTOR", envelope.taskType());
    assertEquals(1, envelope.taskVersion());
    assertEquals("sync-worker-dispatch", envelope.producer());
    assertEquals("batch-42", envelope.correlationId());
    assertEquals("INTEGRATION:11", envelope.key());
    assertEquals(11L, envelope.payload().get("connectionId").asLong());

    verify(dispatchRepository).markPublished(eq(id), any(Instant.class));
    verify(dispatchRepository, never()).markFailed(eq(id), any());
    assertEquals(
        1.0,
        meterRegistry.get("pipeline.dispatch.total").tag("outcome", "published").counter().count());
  }

  @Test
  void shouldMarkFailedWhenPublishFails() {
    UUID id = UUID.randomUUID();
    TaskDispatchRecord record =
        new TaskDispatchRecord(
            id,
            "RUN_USER_ANALYTICS",
            "analytics.user.v1",
            "user:7",
            "{\"userId\":7}",
            "PROCESSING",
            2,
            Instant.parse("2026-03-01T02:30:00Z"),
            Instant.parse("2026-03-01T02:30:00Z"));
    when(dispatchRepository.claimDueBatch(50)).thenReturn(List.of(record));
    CompletableFuture<SendResult<String, String>> failed = new CompletableFuture<>();
    failed.completeExceptionally(new KafkaPublishException("analytics.user.v1", "user:7", "RUN_USER_ANALYTICS", "kafka unavailable", null));
    when(taskPublisher.publish(eq("analytics.user.v1"), any(TaskEnvelope.class))).thenReturn(failed);

    service.dispatchDueTasks();

    verify(dispatchRepository, never()).markPublished(eq(id), any(Instant.class));
    ArgumentCaptor<String> errorCaptor = ArgumentCaptor.forClass(String.class);
    verify(dispatchRepository).markFailed(eq(id), errorCaptor.capture());
    assertTrue(errorCaptor.getValue().contains("kafka unavailable"));
    verify(deadDispatchListener, never()).onDeadDispatch(any(), any());
  }

  @Test
  void shouldReportRowThatRanOutOfAttempts() {
    UUID id = UUID.randomUUID();
    TaskDispatchRecord record =
        new TaskDispatchRecord(
            id,
            "SYNC_CONNECTOR",
            "sync.ton.v1",
            "TON_WALLET:4",
            "{\"batchId\":42,\"userId\":7,\"connectionId\":4}",
            "PROCESSING",
            24,
            Instant.parse("2026-03-01T02:30:00Z"),
            Instant.parse("2026-03-01T02:30:00Z"));
    when(dispatchRepository.claimDueBatch(50)).thenReturn(List.of(record));
    CompletableFuture<SendResult<String, String>> failed = new CompletableFuture<>();
    failed.completeExceptionally(new KafkaPublishException("sync.ton.v1", "TON_WALLET:4", "SYNC_CONNECTOR", "broker down", null));
    when(taskPublisher.publish(eq("sync.ton.v1"), any(TaskEnvelope.class))).thenReturn(failed);
    when(dispatchRepository.markFailed(eq(id), any())).thenReturn(true);

    service.dispatchDueTasks();

    ArgumentCaptor<String> errorCaptor = ArgumentCaptor.forClass(String.class);
    verify(deadDispatchListener).onDeadDispatch(eq(record), errorCaptor.capture());
    assertTrue(errorCaptor.getValue().contains("broker down"));
    assertEquals(
        1.0,
        meterRegistry.get("pipeline.dispatch.total").tag("outcome", "dead").counter().count());
  }

  @Test
  void shouldKeepDispatchingWhenDeadRowHandlingFails() {
    UUID first = UUID.randomUUID();
    UUID second = UUID.randomUUID();
    TaskDispatchRecord dead = syncRecord(first);
    TaskDispatchRecord next = syncRecord(second);
    when(dispatchRepository.claimDueBatch(50)).thenReturn(List.of(dead, next));
    CompletableFuture<SendResult<String, String>> failed = new CompletableFuture<>();
    failed.completeExceptionally(new KafkaPublishException("sync.crypto.v1", "INTEGRATION:11", "SYNC_CONNECTOR", "broker down", null));
    when(taskPublisher.publish(eq("sync.crypto.v1"), any(TaskEnvelope.class)))
        .thenReturn(failed)
        .thenReturn(CompletableFuture.completedFuture(null));
    when(dispatchRepository.markFailed(eq(first), any())).thenReturn(true);
    doThrow(new IllegalStateException("db gone")).when(deadDispatchListener).onDeadDispatch(eq(dead), any());

    service.dispatchDueTasks();

    verify(dispatchRepository).markPublished(eq(second), any(Instant.class));
  }

  private static TaskDispatchRecord syncRecord(UUID id) {
    return new TaskDispatchRecord(
        id,
        "SYNC_CONNECTOR",
        "sync.crypto.v1",
        "INTEGRATION:11",
        "{\"batchId\":42,\"userId\":7,\"connectionId\":11}",
        "PROCESSING",
        24,
        Instant.parse("2026-03-01T02:30:00Z"),
        Instant.parse("2026-03-01T02:30:00Z"));
  }
}
