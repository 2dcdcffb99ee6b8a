package com.portfoliosync.worker.task;

import java.time.Duration;

public class TaskTimeLimitExceededException extends RuntimeException {
  public TaskTimeLimitExceededException(String taskName, Duration hardLimit) {
    super(taskName + " exceeded hard time limit of " + hardLimit.toSeconds() + "s");
  }
}
