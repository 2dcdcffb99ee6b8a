package com.portfoliosync.worker.pipeline;

import java.util.Optional;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(
    prefix = "sync.pipeline",
    name = "enabled",
    havingValue = "true",
    matchIfMissing = true)
public class NightlyPipelineScheduler {
  private final NightlyPipelineService pipelineService;

  public NightlyPipelineScheduler(NightlyPipelineService pipelineService) {
    this.pipelineService = pipelineService;
  }

  @Scheduled(cron = "${sync.pipeline.cron:0 30 2 * * *}", zone = "${sync.pipeline.zone:UTC}")
  public void runScheduled() {
    pipelineService.runNightly(Optional.empty());
  }
}
