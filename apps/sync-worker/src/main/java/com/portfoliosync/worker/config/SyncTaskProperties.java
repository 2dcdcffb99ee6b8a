package com.portfoliosync.worker.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "sync.tasks")
public class SyncTaskProperties {
  private int activityLimit = 200;
  private int maxRetries = 5;
  private Duration retryBaseBackoff = Duration.ofSeconds(1);
  private Duration retryMaxBackoff = Duration.ofSeconds(300);
  private String producerName = "sync-worker";
  private TimeLimits sync = new TimeLimits(Duration.ofMinutes(9), Duration.ofMinutes(10));
  private TimeLimits analytics = new TimeLimits(Duration.ofMinutes(10), Duration.ofMinutes(15));

  public int getActivityLimit() {
    return activityLimit;
  }

  public void setActivityLimit(int activityLimit) {
    this.activityLimit = activityLimit;
  }

  public int getMaxRetries() {
    return maxRetries;
  }

  public void setMaxRetries(int maxRetries) {
    this.maxRetries = maxRetries;
  }

  public Duration getRetryBaseBackoff() {
    return retryBaseBackoff;
  }

  public void setRetryBaseBackoff(Duration retryBaseBackoff) {
    this.retryBaseBackoff = retryBaseBackoff;
  }

  public Duration getRetryMaxBackoff() {
    return retryMaxBackoff;
  }

  public void setRetryMaxBackoff(Duration retryMaxBackoff) {
    this.retryMaxBackoff = retryMaxBackoff;
  }

  public String getProducerName() {
    return producerName;
  }

  public void setProducerName(String producerName) {
    this.producerName = producerName;
  }

  public TimeLimits getSync() {
    return sync;
  }

  public void setSync(TimeLimits sync) {
    this.sync = sync;
  }

  public TimeLimits getAnalytics() {
    return analytics;
  }

  public void setAnalytics(TimeLimits analytics) {
    this.analytics = analytics;
  }

  /** The soft limit only logs; the hard limit cancels the run. */
  public static class TimeLimits {
    private Duration softLimit;
    private Duration hardLimit;

    public TimeLimits() {}

    public TimeLimits(Duration softLimit, Duration hardLimit) {
      this.softLimit = softLimit;
      this.hardLimit = hardLimit;
    }

    public Duration getSoftLimit() {
      return softLimit;
    }

    public void setSoftLimit(Duration softLimit) {
      this.softLimit = softLimit;
    }

    public Duration getHardLimit() {
      return hardLimit;
    }

    public void setHardLimit(Duration hardLimit) {
      this.hardLimit = hardLimit;
    }
  }
}
