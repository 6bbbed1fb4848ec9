package io.b2mash.secops.bridge.remote;

import java.util.List;
import java.util.Map;

/**
 * Result of invoking a remote operation. {@code statusCode} is null when the call never produced
 * an HTTP status (transport failure). {@code content} is only set for binary download operations,
 * in which case {@code body} is null.
 */
public record RemoteResponse(Integer statusCode, Map<String, Object> body, byte[] content) {

  public static RemoteResponse of(int statusCode, Map<String, Object> body) {
    return new RemoteResponse(statusCode, body, null);
  }

  public static RemoteResponse binary(int statusCode, byte[] content) {
    return new RemoteResponse(statusCode, null, content);
  }

  public static RemoteResponse transportFailure(String message) {
    return new RemoteResponse(null, Map.of("errors", List.of(Map.of("message", message))), null);
  }

  public boolean isBinary() {
    return content != null;
  }

  /** Body with a null body mapped to an empty map. */
  public Map<String, Object> bodyOrEmpty() {
    return body != null ? body : Map.of();
  }
}
