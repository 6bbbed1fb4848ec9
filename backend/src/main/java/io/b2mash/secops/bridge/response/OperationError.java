package io.b2mash.secops.bridge.response;

import io.b2mash.secops.bridge.remote.RemoteResponse;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Normalized failure of a remote operation, returned as a value rather than thrown so the calling
 * agent can always inspect it.
 *
 * @param message human-readable summary, always present
 * @param details raw response or structured context, may be null
 * @param operation the remote operation that failed, may be null
 * @param requiredScopes scopes the operation needs; only set for permission failures
 * @param resolution remediation sentence naming the scopes; set iff {@code requiredScopes} is
 *     non-empty
 */
public record OperationError(
    String message,
    Object details,
    String operation,
    List<String> requiredScopes,
    String resolution) {

  public OperationError {
    if (message == null || message.isBlank()) {
      throw new IllegalArgumentException("message is required");
    }
    requiredScopes = requiredScopes == null ? null : List.copyOf(requiredScopes);
    if ((resolution != null) != (requiredScopes != null && !requiredScopes.isEmpty())) {
      throw new IllegalArgumentException("resolution must accompany a non-empty scope list");
    }
  }

  public static OperationError of(String message) {
    return new OperationError(message, null, null, null, null);
  }

  public static OperationError of(String message, Object details, String operation) {
    return new OperationError(message, details, operation, null, null);
  }

  /** Shape handed to tool callers: {@code {error, details?, operation?, required_scopes?, ...}}. */
  public Map<String, Object> toMap() {
    var map = new LinkedHashMap<String, Object>();
    map.put("error", message);
    if (details != null) {
      map.put("details", renderDetails(details));
    }
    if (operation != null) {
      map.put("operation", operation);
    }
    if (requiredScopes != null && !requiredScopes.isEmpty()) {
      map.put("required_scopes", requiredScopes);
      map.put("resolution", resolution);
    }
    return map;
  }

  private static Object renderDetails(Object details) {
    if (details instanceof RemoteResponse response) {
      var rendered = new LinkedHashMap<String, Object>();
      rendered.put("status_code", response.statusCode());
      rendered.put("body", response.bodyOrEmpty());
      return rendered;
    }
    return details;
  }
}
