package com.portfoliosync.worker.pipeline;

import com.portfoliosync.worker.config.SyncPipelineProperties;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/** Manual trigger: {@code sync.pipeline.run-on-startup=true}, optionally with {@code as-of-date}. */
@Component
@ConditionalOnProperty(prefix = "sync.pipeline", name = "run-on-startup", havingValue = "true")
public class PipelineStartupRunner implements ApplicationRunner {
  private static final Logger log = LoggerFactory.getLogger(PipelineStartupRunner.class);

  private final NightlyPipelineService pipelineService;
  private final SyncPipelineProperties properties;

  public PipelineStartupRunner(
      NightlyPipelineService pipelineService, SyncPipelineProperties properties) {
    this.pipelineService = pipelineService;
    this.properties = properties;
  }

  @Override
  public void run(ApplicationArguments args) {
    PipelineRunResult result = pipelineService.runNightly(Optional.ofNullable(properties.getAsOfDate()));
    log.info(
        "Startup pipeline run finished as_of_date={} scheduled_users={} scheduled_connections={}",
        properties.getAsOfDate(),
        result.scheduledUsers(),
        result.scheduledConnections());
  }
}
