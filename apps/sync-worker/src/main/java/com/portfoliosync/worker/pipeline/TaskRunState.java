package com.portfoliosync.worker.pipeline;

public record TaskRunState(long id, long batchId, TaskRunStatus status, int attempt) {}
