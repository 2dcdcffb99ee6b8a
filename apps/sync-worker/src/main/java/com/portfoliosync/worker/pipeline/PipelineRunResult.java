package com.portfoliosync.worker.pipeline;

public record PipelineRunResult(int scheduledUsers, int scheduledConnections) {
  public static PipelineRunResult skipped() {
    return new PipelineRunResult(0, 0);
  }
}
