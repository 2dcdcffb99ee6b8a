package com.portfoliosync.integration.venues.http;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.portfoliosync.integration.venues.Venue;
import com.portfoliosync.integration.venues.VenueApiException;
import com.portfoliosync.integration.venues.VenueException;
import com.portfoliosync.integration.venues.VenueTransportException;
import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.StringJoiner;
import java.util.function.Consumer;
import java.util.function.Supplier;
import org.springframework.http.HttpHeaders;

/**
 * JSON-over-HTTP calls for one venue. Every attempt waits on the given rate limiter, then sends a
 * freshly built request so that signatures and timestamps are recomputed on retry.
 */
public class VenueHttpClient {
  private final Venue venue;
  private final HttpClient httpClient;
  private final ObjectMapper objectMapper;
  private final Duration timeout;
  private final VenueRetryExecutor retryExecutor;

  public VenueHttpClient(
      Venue venue,
      HttpClient httpClient,
      ObjectMapper objectMapper,
      Duration timeout,
      VenueRetryExecutor retryExecutor) {
    this.venue = Objects.requireNonNull(venue, "venue must not be null");
    this.httpClient = Objects.requireNonNull(httpClient, "httpClient must not be null");
    this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
    this.timeout = Objects.requireNonNull(timeout, "timeout must not be null");
    this.retryExecutor = Objects.requireNonNull(retryExecutor, "retryExecutor must not be null");
  }

  public HttpRequest.Builder request(URI uri) {
    return HttpRequest.newBuilder(uri).timeout(timeout).header("Accept", "application/json");
  }

  public ObjectMapper objectMapper() {
    return objectMapper;
  }

  public JsonNode get(String action, RequestRateLimiter limiter, Supplier<URI> uri) {
    return send(action, limiter, () -> request(uri.get()).GET().build());
  }

  public JsonNode send(String action, RequestRateLimiter limiter, Supplier<HttpRequest> request) {
    return retryExecutor.execute(action, () -> sendOnce(action, limiter, request.get()));
  }

  /**
   * Like {@link #send} for venues that report errors inside a 2xx body: {@code bodyCheck} runs
   * within the retry loop and may throw a {@link VenueException} of its own.
   */
  public JsonNode send(
      String action, RequestRateLimiter limiter, Supplier<HttpRequest> request, Consumer<JsonNode> bodyCheck) {
    return retryExecutor.execute(
        action,
        () -> {
          JsonNode body = sendOnce(action, limiter, request.get());
          bodyCheck.accept(body);
          return body;
        });
  }

  /** Single attempt without retry, for callers that handle failures themselves. */
  public JsonNode sendOnce(String action, RequestRateLimiter limiter, HttpRequest request) {
    acquire(limiter, action);
    HttpResponse<String> response;
    try {
      response = httpClient.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      throw new VenueException(venue, venue.code() + " " + action + " request was interrupted", ex);
    } catch (IOException ex) {
      throw new VenueTransportException(
          venue, "Failed to call " + venue.code() + " " + action + " endpoint: " + ex, ex);
    }
    if (response.statusCode() < 200 || response.statusCode() >= 300) {
      throw new VenueApiException(
          venue, action, response.statusCode(), toSpringHeaders(response), response.body());
    }
    return parseJson(action, response.body());
  }

  public String toJson(Object body) {
    try {
      return objectMapper.writeValueAsString(body);
    } catch (IOException ex) {
      throw new IllegalStateException("Failed to serialize " + venue.code() + " request body", ex);
    }
  }

  private JsonNode parseJson(String action, String body) {
    if (body == null || body.isBlank()) {
      return objectMapper.createObjectNode();
    }
    try {
      return objectMapper.readTree(body);
    } catch (IOException ex) {
      throw new VenueException(
          venue, "Failed to parse " + venue.code() + " " + action + " response JSON", ex);
    }
  }

  private void acquire(RequestRateLimiter limiter, String action) {
    try {
      limiter.acquire();
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      throw new VenueException(venue, venue.code() + " " + action + " rate-limit wait was interrupted", ex);
    }
  }

  private static HttpHeaders toSpringHeaders(HttpResponse<?> response) {
    HttpHeaders headers = new HttpHeaders();
    response.headers().map().forEach(headers::addAll);
    return headers;
  }

  public static URI resolve(URI baseUri, String path, String rawQuery) {
    String base = baseUri.toString();
    if (base.endsWith("/")) {
      base = base.substring(0, base.length() - 1);
    }
    String suffix = rawQuery == null || rawQuery.isEmpty() ? "" : "?" + rawQuery;
    return URI.create(base + path + suffix);
  }

  public static URI resolve(URI baseUri, String path, Map<String, String> query) {
    return resolve(baseUri, path, queryString(query));
  }

  public static String queryString(Map<String, String> query) {
    StringJoiner joiner = new StringJoiner("&");
    if (query != null) {
      query.forEach(
          (key, value) -> {
            if (value != null && !value.isBlank()) {
              joiner.add(encode(key) + "=" + encode(value));
            }
          });
    }
    return joiner.toString();
  }

  /** Ordered query parameters from key/value pairs; pairs with a null value are left out. */
  public static Map<String, String> params(String... keyValues) {
    Map<String, String> params = new LinkedHashMap<>();
    for (int i = 0; i + 1 < keyValues.length; i += 2) {
      if (keyValues[i + 1] != null) {
        params.put(keyValues[i], keyValues[i + 1]);
      }
    }
    return params;
  }

  public static String encode(String value) {
    return URLEncoder.encode(value, StandardCharsets.UTF_8);
  }
}
