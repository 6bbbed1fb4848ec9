package io.b2mash.secops.bridge.response;

import io.b2mash.secops.bridge.remote.RemoteResponse;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Pulls the resources envelope out of a response. A failed response and an empty result both
 * fall back to the default; callers that must tell them apart use {@link
 * ResponseClassifier#handleApiResponse}.
 */
public final class ResourceExtractor {

  private ResourceExtractor() {}

  public static List<Object> extractResources(RemoteResponse response) {
    return extractResources(response, null);
  }

  public static List<Object> extractResources(RemoteResponse response, List<?> defaultResult) {
    List<Object> fallback =
        defaultResult != null
            ? Collections.unmodifiableList(new ArrayList<>(defaultResult))
            : List.of();
    if (!ResponseClassifier.isSuccess(response)) {
      return fallback;
    }
    Object resources = response.bodyOrEmpty().get("resources");
    if (resources instanceof List<?> list && !list.isEmpty()) {
      return Collections.unmodifiableList(new ArrayList<>(list));
    }
    return fallback;
  }

  /**
   * First resource of a successful response, or an error carrying {@code notFoundMessage} when
   * the call failed or returned nothing.
   */
  public static FirstResource extractFirstResource(
      RemoteResponse response, String operation, String notFoundMessage) {
    var resources = extractResources(response);
    if (resources.isEmpty()) {
      return new FirstResource(
          null, ResponseClassifier.logged(OperationError.of(notFoundMessage, null, operation)));
    }
    return new FirstResource(resources.get(0), null);
  }

  /** Either the first record or the error explaining why there is none. */
  public record FirstResource(Object resource, OperationError error) {

    public boolean isError() {
      return error != null;
    }

    public Object toToolOutput() {
      return error != null ? error.toMap() : resource;
    }
  }
}
