package com.portfoliosync.worker.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "sync.venues")
public class VenueProperties {
  private Duration connectTimeout = Duration.ofSeconds(10);
  private int executorThreads = 16;
  private final Retry retry = new Retry();

  public Duration getConnectTimeout() {
    return connectTimeout;
  }

  public void setConnectTimeout(Duration connectTimeout) {
    this.connectTimeout = connectTimeout;
  }

  public int getExecutorThreads() {
    return executorThreads;
  }

  public void setExecutorThreads(int executorThreads) {
    this.executorThreads = executorThreads;
  }

  public Retry getRetry() {
    return retry;
  }

  public static class Retry {
    private int maxAttempts = 4;
    private Duration baseBackoff = Duration.ofMillis(200);
    private Duration maxBackoff = Duration.ofSeconds(2);
    private boolean jitterEnabled = true;

    public int getMaxAttempts() {
      return maxAttempts;
    }

    public void setMaxAttempts(int maxAttempts) {
      this.maxAttempts = maxAttempts;
    }

    public Duration getBaseBackoff() {
      return baseBackoff;
    }

    public void setBaseBackoff(Duration baseBackoff) {
      this.baseBackoff = baseBackoff;
    }

    public Duration getMaxBackoff() {
      return maxBackoff;
    }

    public void setMaxBackoff(Duration maxBackoff) {
      this.maxBackoff = maxBackoff;
    }

    public boolean isJitterEnabled() {
      return jitterEnabled;
    }

    public void setJitterEnabled(boolean jitterEnabled) {
      this.jitterEnabled = jitterEnabled;
    }
  }
}
