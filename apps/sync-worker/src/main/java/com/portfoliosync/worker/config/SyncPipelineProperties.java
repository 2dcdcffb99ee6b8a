package com.portfoliosync.worker.config;

import java.time.Duration;
import java.time.LocalDate;
import java.time.ZoneId;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "sync.pipeline")
public class SyncPipelineProperties {
  private boolean enabled = true;
  private String cron = "0 30 2 * * *";
  private String zone = "UTC";
  private Duration lockTtl = Duration.ofHours(6);
  private Duration maxJitter = Duration.ofMinutes(30);
  private boolean runOnStartup = false;
  private LocalDate asOfDate;
  private Duration staleRunTimeout = Duration.ofHours(6);

  public boolean isEnabled() {
    return enabled;
  }

  public void setEnabled(boolean enabled) {
    this.enabled = enabled;
  }

  public String getCron() {
    return cron;
  }

  public void setCron(String cron) {
    this.cron = cron;
  }

  public String getZone() {
    return zone;
  }

  public void setZone(String zone) {
    this.zone = zone;
  }

  public ZoneId zoneId() {
    return ZoneId.of(zone);
  }

  public Duration getLockTtl() {
    return lockTtl;
  }

  public void setLockTtl(Duration lockTtl) {
    this.lockTtl = lockTtl;
  }

  public Duration getMaxJitter() {
    return maxJitter;
  }

  public void setMaxJitter(Duration maxJitter) {
    this.maxJitter = maxJitter;
  }

  public boolean isRunOnStartup() {
    return runOnStartup;
  }

  public void setRunOnStartup(boolean runOnStartup) {
    this.runOnStartup = runOnStartup;
  }

  public LocalDate getAsOfDate() {
    return asOfDate;
  }

  public void setAsOfDate(LocalDate asOfDate) {
    this.asOfDate = asOfDate;
  }

  /** Age of a batch after which its unfinished runs are failed so the barrier can close. */
  public Duration getStaleRunTimeout() {
    return staleRunTimeout;
  }

  public void setStaleRunTimeout(Duration staleRunTimeout) {
    this.staleRunTimeout = staleRunTimeout;
  }
}
