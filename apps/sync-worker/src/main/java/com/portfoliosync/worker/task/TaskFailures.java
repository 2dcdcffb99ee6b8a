package com.portfoliosync.worker.task;

import com.portfoliosync.integration.venues.VenueApiException;
import com.portfoliosync.worker.sync.TransientSyncException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/** Compact failure descriptions for {@code sync_task_runs.last_error} and logs. */
public final class TaskFailures {
  static final int MAX_MESSAGE_LENGTH = 500;

  private TaskFailures() {}

  /** {@code HTTP_<status>} for venue API errors, otherwise the exception's simple class name. */
  public static String errorCode(Throwable failure) {
    Throwable current = failure;
    while (current != null) {
      if (current instanceof VenueApiException apiException) {
        return "HTTP_" + apiException.statusCode();
      }
      current = current.getCause() == current ? null : current.getCause();
    }
    return unwrap(failure).getClass().getSimpleName();
  }

  /** Whitespace collapsed to single spaces and cut to 500 characters. */
  public static String sanitizeMessage(String message) {
    if (message == null) {
      return "";
    }
    String collapsed = message.replaceAll("\\s+", " ").trim();
    return collapsed.length() <= MAX_MESSAGE_LENGTH
        ? collapsed
        : collapsed.substring(0, MAX_MESSAGE_LENGTH);
  }

  public static String describe(Throwable failure) {
    Throwable cause = unwrap(failure);
    String message = sanitizeMessage(cause.getMessage());
    String code = errorCode(failure);
    return message.isEmpty() ? code : code + ": " + message;
  }

  private static Throwable unwrap(Throwable failure) {
    Throwable current = failure;
    while ((current instanceof TransientSyncException
            || current instanceof CompletionException
            || current instanceof ExecutionException)
        && current.getCause() != null) {
      current = current.getCause();
    }
    return current;
  }
}
