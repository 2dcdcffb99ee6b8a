package com.portfoliosync.integration.venues;

import java.util.Objects;
import java.util.Optional;
import org.springframework.http.HttpHeaders;

public class VenueApiException extends VenueException {
  private final int statusCode;
  private final HttpHeaders responseHeaders;
  private final String responseBody;

  public VenueApiException(
      Venue venue, String action, int statusCode, HttpHeaders responseHeaders, String responseBody) {
    super(venue, venue.code() + " API error action=" + action + " status=" + statusCode + " body=" + abbreviate(responseBody));
    this.statusCode = statusCode;
    this.responseHeaders =
        HttpHeaders.readOnlyHttpHeaders(
            responseHeaders == null ? HttpHeaders.EMPTY : responseHeaders);
    this.responseBody = Objects.requireNonNullElse(responseBody, "");
  }

  public int statusCode() {
    return statusCode;
  }

  public HttpHeaders responseHeaders() {
    return responseHeaders;
  }

  public String responseBody() {
    return responseBody;
  }

  public Optional<String> retryAfterHeader() {
    return Optional.ofNullable(responseHeaders.getFirst(HttpHeaders.RETRY_AFTER));
  }

  public boolean isRateLimitError() {
    return statusCode == 429;
  }

  public boolean isServerError() {
    return statusCode >= 500 && statusCode < 600;
  }

  public boolean isUnauthorized() {
    return statusCode == 401 || statusCode == 403;
  }

  @Override
  public boolean isTransient() {
    return isRateLimitError() || isServerError();
  }

  private static String abbreviate(String body) {
    if (body == null) {
      return "";
    }
    return body.length() <= 200 ? body : body.substring(0, 200) + "...";
  }
}
