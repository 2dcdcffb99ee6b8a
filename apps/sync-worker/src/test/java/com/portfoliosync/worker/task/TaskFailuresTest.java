package com.portfoliosync.worker.task;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.portfoliosync.integration.venues.Venue;
import com.portfoliosync.integration.venues.VenueApiException;
import com.portfoliosync.worker.sync.TransientSyncException;
import java.util.concurrent.CompletionException;
import org.junit.jupiter.api.Test;

class TaskFailuresTest {
  @Test
  void venueApiErrorsAreCodedByStatus() {
    VenueApiException apiException = new VenueApiException(Venue.BINANCE, "account", 429, null, "too many");

    assertEquals("HTTP_429", TaskFailures.errorCode(new TransientSyncException("binance sync failed", apiException)));
    assertTrue(TaskFailures.describe(apiException).startsWith("HTTP_429: binance API error"));
  }

  @Test
  void otherErrorsUseUnwrappedClassName() {
    IllegalStateException failure = new IllegalStateException("Integration 5 not found");

    assertEquals(
        "IllegalStateException: Integration 5 not found",
        TaskFailures.describe(new CompletionException(failure)));
    assertEquals("NullPointerException", TaskFailures.describe(new NullPointerException()));
  }

  @Test
  void sanitizeCollapsesWhitespaceAndTruncates() {
    assertEquals("a b c", TaskFailures.sanitizeMessage(" a\n\tb   c "));
    assertEquals(TaskFailures.MAX_MESSAGE_LENGTH, TaskFailures.sanitizeMessage("x".repeat(900)).length());
  }
}
