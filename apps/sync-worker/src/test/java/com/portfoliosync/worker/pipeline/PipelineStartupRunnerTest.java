package com.portfoliosync.worker.pipeline;

import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.portfoliosync.worker.config.SyncPipelineProperties;
import java.time.LocalDate;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.DefaultApplicationArguments;

@ExtendWith(MockitoExtension.class)
class PipelineStartupRunnerTest {
  @Mock private NightlyPipelineService pipelineService;

  @Test
  void shouldRunForConfiguredDate() {
    SyncPipelineProperties properties = new SyncPipelineProperties();
    properties.setAsOfDate(LocalDate.of(2026, 3, 1));
    when(pipelineService.runNightly(Optional.of(LocalDate.of(2026, 3, 1))))
        .thenReturn(new PipelineRunResult(1, 2));

    new PipelineStartupRunner(pipelineService, properties).run(new DefaultApplicationArguments());

    verify(pipelineService).runNightly(Optional.of(LocalDate.of(2026, 3, 1)));
  }

  @Test
  void shouldUseTodayWhenNoDateConfigured() {
    when(pipelineService.runNightly(Optional.empty())).thenReturn(PipelineRunResult.skipped());

    new PipelineStartupRunner(pipelineService, new SyncPipelineProperties())
        .run(new DefaultApplicationArguments());

    verify(pipelineService).runNightly(Optional.empty());
  }
}
