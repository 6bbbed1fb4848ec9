package io.b2mash.secops.bridge.remote;

import java.util.Map;

/**
 * Parameters for one remote operation. Path parameters fill the route template, query parameters
 * go on the URL and the body (when present) is sent as JSON. Null-valued entries are stripped on
 * construction so they never reach the wire.
 */
public record RemoteRequest(
    Map<String, Object> pathParams, Map<String, Object> queryParams, Map<String, Object> body) {

  public RemoteRequest {
    pathParams = Parameters.prepare(pathParams);
    queryParams = Parameters.prepare(queryParams);
    body = body == null ? null : Parameters.prepare(body);
  }

  public static RemoteRequest empty() {
    return new RemoteRequest(null, null, null);
  }

  public static RemoteRequest ofQuery(Map<String, ?> queryParams) {
    return new RemoteRequest(null, copy(queryParams), null);
  }

  public static RemoteRequest ofBody(Map<String, ?> body) {
    return new RemoteRequest(null, null, copy(body));
  }

  public RemoteRequest withPath(Map<String, ?> pathParams) {
    return new RemoteRequest(copy(pathParams), queryParams, body);
  }

  public boolean hasBody() {
    return body != null;
  }

  private static Map<String, Object> copy(Map<String, ?> source) {
    return source == null ? null : Parameters.prepare(source);
  }
}
