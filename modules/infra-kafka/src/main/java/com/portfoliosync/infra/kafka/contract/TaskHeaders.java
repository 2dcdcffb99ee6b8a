package com.portfoliosync.infra.kafka.contract;

import com.portfoliosync.infra.kafka.errors.InvalidTaskMetadataException;
import java.nio.charset.StandardCharsets;
import org.apache.kafka.common.header.Header;
import org.apache.kafka.common.header.Headers;

/**
 * Headers carried next to every task envelope. The consumer checks them before decoding the body,
 * so a record from a foreign producer is dead-lettered untouched. The correlation id is the
 * nightly batch ({@code batch-<id>}) for sync and analytics tasks alike.
 */
public final class TaskHeaders {
  public static final String TASK_TYPE = "x-task-type";
  public static final String TASK_VERSION = "x-task-version";
  public static final String CORRELATION_ID = "x-correlation-id";
  public static final String CONTENT_TYPE = "content-type";
  public static final String JSON = "application/json";

  private TaskHeaders() {}

  public static void write(Headers headers, TaskEnvelope<?> envelope) {
    put(headers, TASK_TYPE, envelope.taskType());
    put(headers, TASK_VERSION, Integer.toString(envelope.taskVersion()));
    put(headers, CORRELATION_ID, envelope.correlationId());
    put(headers, CONTENT_TYPE, JSON);
  }

  /** Last value of {@code name}, or null when the header is absent. */
  public static String read(Headers headers, String name) {
    Header header = headers.lastHeader(name);
    if (header == null || header.value() == null) {
      return null;
    }
    return new String(header.value(), StandardCharsets.UTF_8);
  }

  /** Returns the task type after checking that type, a positive version and a correlation id are present. */
  public static String requireValid(Headers headers) {
    String taskType = require(headers, TASK_TYPE);
    String version = require(headers, TASK_VERSION);
    int parsed;
    try {
      parsed = Integer.parseInt(version.trim());
    } catch (NumberFormatException ex) {
      throw new InvalidTaskMetadataException("Header " + TASK_VERSION + " is not an integer: " + version);
    }
    if (parsed < 1) {
      throw new InvalidTaskMetadataException("Header " + TASK_VERSION + " must be >= 1");
    }
    require(headers, CORRELATION_ID);
    return taskType;
  }

  private static String require(Headers headers, String name) {
    String value = read(headers, name);
    if (value == null || value.isBlank()) {
      throw new InvalidTaskMetadataException("Missing required header: " + name);
    }
    return value;
  }

  private static void put(Headers headers, String name, String value) {
    headers.add(name, value.getBytes(StandardCharsets.UTF_8));
  }
}
