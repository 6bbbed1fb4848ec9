package io.b2mash.secops.bridge.response;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Outcome of classifying one remote response: a resource list, a raw body for {@link
 * ResponseKind#RAW_BODY} operations, or an {@link OperationError}. Exactly one is set.
 */
public record ApiResult(List<Object> resources, Map<String, Object> body, OperationError error) {

  public static ApiResult success(List<?> resources) {
    return new ApiResult(Collections.unmodifiableList(new ArrayList<>(resources)), null, null);
  }

  public static ApiResult rawBody(Map<String, Object> body) {
    return new ApiResult(null, body, null);
  }

  public static ApiResult failure(OperationError error) {
    return new ApiResult(null, null, error);
  }

  public boolean isError() {
    return error != null;
  }

  /** True for a successful resource list with no entries. */
  public boolean isEmpty() {
    return resources != null && resources.isEmpty();
  }

  /** JSON-ready value for tool callers. */
  public Object toToolOutput() {
    if (error != null) {
      return error.toMap();
    }
    return body != null ? body : resources;
  }

  /** Errors wrapped in a single-element list, matching the list shape of a successful search. */
  public Object toListOutput() {
    if (error != null) {
      return List.of(error.toMap());
    }
    return toToolOutput();
  }
}
