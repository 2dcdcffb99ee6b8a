package com.portfoliosync.worker.sync;

import com.portfoliosync.integration.venues.VenueException;
import java.io.InterruptedIOException;
import java.net.ConnectException;
import java.net.http.HttpTimeoutException;
import java.util.concurrent.TimeoutException;
import org.springframework.stereotype.Component;

/**
 * Venue 429 and 5xx responses, timeouts and refused connections are transient anywhere in the
 * cause chain. Authentication, configuration and other client errors are not.
 */
@Component
public class TransientFailureClassifier {
  private static final int MAX_CAUSE_DEPTH = 10;

  public boolean isTransient(Throwable failure) {
    Throwable current = failure;
    for (int depth = 0; current != null && depth < MAX_CAUSE_DEPTH; depth++) {
      if (current instanceof TransientSyncException) {
        return true;
      }
      if (current instanceof VenueException venueException) {
        return venueException.isTransient();
      }
      if (current instanceof TimeoutException
          || current instanceof HttpTimeoutException
          || current instanceof InterruptedIOException
          || current instanceof ConnectException) {
        return true;
      }
      if (current.getCause() == current) {
        break;
      }
      current = current.getCause();
    }
    return false;
  }
}
