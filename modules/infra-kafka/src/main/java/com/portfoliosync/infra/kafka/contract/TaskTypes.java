package com.portfoliosync.infra.kafka.contract;

public final class TaskTypes {
  public static final String SYNC_CONNECTOR = "SYNC_CONNECTOR";
  public static final String RUN_USER_ANALYTICS = "RUN_USER_ANALYTICS";

  private TaskTypes() {}
}
