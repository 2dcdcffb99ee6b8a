package com.portfoliosync.worker.pipeline;

public enum TaskRunStatus {
  PENDING,
  RUNNING,
  RETRYING,
  SUCCEEDED,
  FAILED;

  public boolean isTerminal() {
    return this == SUCCEEDED || this == FAILED;
  }
}
