package com.portfoliosync.worker.metrics;

import com.portfoliosync.domain.ledger.SkipReason;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import org.springframework.stereotype.Component;

@Component
public class PipelineMetrics {
  private final MeterRegistry meterRegistry;

  public PipelineMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
  }

  public void nightlyRun(String outcome) {
    Counter.builder("pipeline.nightly.runs.total")
        .tag("outcome", outcome)
        .register(meterRegistry)
        .increment();
  }

  public void syncTask(String sourceType, String outcome, Duration duration) {
    Counter.builder("pipeline.sync.tasks.total")
        .tag("source_type", sourceType)
        .tag("outcome", outcome)
        .register(meterRegistry)
        .increment();
    if (duration != null) {
      Timer.builder("pipeline.sync.duration")
          .tag("source_type", sourceType)
          .register(meterRegistry)
          .record(duration);
    }
  }

  public void normalizerSkipped(Map<SkipReason, Integer> skipped) {
    skipped.forEach(
        (reason, count) ->
            Counter.builder("pipeline.normalizer.skipped.total")
                .tag("reason", reason.name().toLowerCase(Locale.ROOT))
                .register(meterRegistry)
                .increment(count));
  }

  public void analyticsRun(String outcome) {
    Counter.builder("pipeline.analytics.runs.total")
        .tag("outcome", outcome)
        .register(meterRegistry)
        .increment();
  }

  public void dispatch(String taskType, String outcome) {
    Counter.builder("pipeline.dispatch.total")
        .tag("task_type", taskType)
        .tag("outcome", outcome)
        .register(meterRegistry)
        .increment();
  }
}
