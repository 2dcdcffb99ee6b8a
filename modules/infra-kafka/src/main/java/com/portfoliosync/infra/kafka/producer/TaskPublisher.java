package com.portfoliosync.infra.kafka.producer;

import com.portfoliosync.infra.kafka.contract.TaskEnvelope;
import java.util.concurrent.CompletableFuture;
import org.springframework.kafka.support.SendResult;

public interface TaskPublisher {
  <T> CompletableFuture<SendResult<String, String>> publish(String topic, TaskEnvelope<T> envelope);
}
