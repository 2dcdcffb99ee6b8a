package com.portfoliosync.infra.kafka.config;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;

/** Broker, listener and topic settings of the task queues under {@code infra.kafka}. */
@ConfigurationProperties(prefix = "infra.kafka")
public class InfraKafkaProperties {
  private List<String> bootstrapServers = new ArrayList<>(List.of("localhost:9092"));
  private String clientId = "sync-worker";
  private Duration sendTimeout = Duration.ofSeconds(10);
  private Consumer consumer = new Consumer();
  private Retry retry = new Retry();
  private Topics topics = new Topics();

  public List<String> getBootstrapServers() {
    return bootstrapServers;
  }

  public void setBootstrapServers(List<String> bootstrapServers) {
    this.bootstrapServers = bootstrapServers;
  }

  public String getClientId() {
    return clientId;
  }

  public void setClientId(String clientId) {
    this.clientId = clientId;
  }

  public Duration getSendTimeout() {
    return sendTimeout;
  }

  public void setSendTimeout(Duration sendTimeout) {
    this.sendTimeout = sendTimeout;
  }

  public Consumer getConsumer() {
    return consumer;
  }

  public void setConsumer(Consumer consumer) {
    this.consumer = consumer;
  }

  public Retry getRetry() {
    return retry;
  }

  public void setRetry(Retry retry) {
    this.retry = retry;
  }

  public Topics getTopics() {
    return topics;
  }

  public void setTopics(Topics topics) {
    this.topics = topics;
  }

  /**
   * A sync task may run for ten minutes and an analytics task for fifteen, so the poll interval
   * has to outlast the longest hard limit.
   */
  public static class Consumer {
    private String groupId = "cg-sync-worker";
    private Duration maxPollInterval = Duration.ofMinutes(20);
    private int concurrency = 2;

    public String getGroupId() {
      return groupId;
    }

    public void setGroupId(String groupId) {
      this.groupId = groupId;
    }

    public Duration getMaxPollInterval() {
      return maxPollInterval;
    }

    public void setMaxPollInterval(Duration maxPollInterval) {
      this.maxPollInterval = maxPollInterval;
    }

    public int getConcurrency() {
      return concurrency;
    }

    public void setConcurrency(int concurrency) {
      this.concurrency = concurrency;
    }
  }

  public static class Retry {
    private int maxAttempts = 1;
    private Duration backoff = Duration.ZERO;

    public int getMaxAttempts() {
      return maxAttempts;
    }

    public void setMaxAttempts(int maxAttempts) {
      this.maxAttempts = maxAttempts;
    }

    public Duration getBackoff() {
      return backoff;
    }

    public void setBackoff(Duration backoff) {
      this.backoff = backoff;
    }
  }

  public static class Topics {
    private boolean enabled = true;
    private int partitions = 6;
    private short replicationFactor = 1;

    public boolean isEnabled() {
      return enabled;
    }

    public void setEnabled(boolean enabled) {
      this.enabled = enabled;
    }

    public int getPartitions() {
      return partitions;
    }

    public void setPartitions(int partitions) {
      this.partitions = partitions;
    }

    public short getReplicationFactor() {
      return replicationFactor;
    }

    public void setReplicationFactor(short replicationFactor) {
      this.replicationFactor = replicationFactor;
    }
  }
}
