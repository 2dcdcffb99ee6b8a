package com.portfoliosync.integration.venues;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Function;
import okhttp3.mockwebserver.Dispatcher;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.RecordedRequest;

/**
 * Answers by request path, since adapters issue their calls concurrently. Unknown paths get 404.
 */
public class PathDispatcher extends Dispatcher {
  private final Map<String, Function<RecordedRequest, MockResponse>> routes = new ConcurrentHashMap<>();
  private final List<RecordedRequest> requests = new CopyOnWriteArrayList<>();

  public PathDispatcher json(String path, String body) {
    return route(path, request -> ok(body));
  }

  public PathDispatcher route(String path, Function<RecordedRequest, MockResponse> handler) {
    routes.put(path, handler);
    return this;
  }

  public List<RecordedRequest> requests(String path) {
    return requests.stream().filter(request -> path.equals(request.getRequestUrl().encodedPath())).toList();
  }

  @Override
  public MockResponse dispatch(RecordedRequest request) {
    requests.add(request);
    Function<RecordedRequest, MockResponse> handler = routes.get(request.getRequestUrl().encodedPath());
    if (handler == null) {
      return new MockResponse().setResponseCode(404).setBody("{\"error\":\"not found\"}");
    }
    return handler.apply(request);
  }

  public static MockResponse ok(String body) {
    return new MockResponse()
        .setResponseCode(200)
        .setHeader("Content-Type", "application/json")
        .setBody(body);
  }
}
