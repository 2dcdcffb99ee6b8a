package com.portfoliosync.worker.task;

/** Raised inside a task body that outlived its hard limit, before it commits {@code stage}. */
public class TaskCancelledException extends RuntimeException {
  public TaskCancelledException(String stage) {
    super("Task cancelled before " + stage);
  }
}
