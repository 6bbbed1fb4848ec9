package io.b2mash.secops.bridge.response;

import io.b2mash.secops.bridge.remote.RemoteResponse;
import io.b2mash.secops.bridge.scope.ScopeRegistry;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decides success or failure for every remote response and normalizes failures into {@link
 * OperationError} values. Permission failures are enriched with the scopes the operation requires.
 */
public final class ResponseClassifier {

  private static final Logger log = LoggerFactory.getLogger(ResponseClassifier.class);

  private ResponseClassifier() {}

  /** Success iff a status code is present and below 400. */
  public static boolean isSuccess(RemoteResponse response) {
    return response != null && response.statusCode() != null && response.statusCode() < 400;
  }

  /** 401 and 403 mean the credentials lack a scope. */
  public static boolean isPermissionDenied(RemoteResponse response) {
    if (response == null || response.statusCode() == null) {
      return false;
    }
    int status = response.statusCode();
    return status == 401 || status == 403;
  }

  public static ApiResult handleApiResponse(
      RemoteResponse response, String operation, String errorMessage) {
    return handleApiResponse(response, operation, errorMessage, List.of());
  }

  /**
   * Success returns the extracted resources ({@code defaultResult} when there are none), or the
   * whole body for {@link ResponseKind#RAW_BODY} operations. Failure returns an error built from
   * {@code errorMessage} and the platform's own message.
   */
  public static ApiResult handleApiResponse(
      RemoteResponse response, String operation, String errorMessage, List<?> defaultResult) {
    if (isSuccess(response)) {
      if (ResponseKind.forOperation(operation) == ResponseKind.RAW_BODY) {
        return ApiResult.rawBody(response.bodyOrEmpty());
      }
      return ApiResult.success(ResourceExtractor.extractResources(response, defaultResult));
    }
    return ApiResult.failure(toError(response, operation, errorMessage));
  }

  /** Builds the normalized error for a failed response. */
  public static OperationError toError(
      RemoteResponse response, String operation, String errorMessage) {
    String message = errorMessage + ": " + platformMessage(response);

    if (isPermissionDenied(response)) {
      List<String> scopes = ScopeRegistry.requiredScopes(operation);
      if (!scopes.isEmpty()) {
        String joined = String.join(", ", scopes);
        message = message + "\nRequired scopes: " + joined;
        return logged(
            new OperationError(message, response, operation, scopes, resolution(joined)));
      }
    }
    return logged(OperationError.of(message, response, operation));
  }

  static OperationError logged(OperationError error) {
    log.error("Error: {}", error.message());
    return error;
  }

  private static String resolution(String joinedScopes) {
    return "This operation requires the following API scopes: "
        + joinedScopes
        + ". Grant these scopes to the API client in the Falcon console and retry.";
  }

  private static String platformMessage(RemoteResponse response) {
    if (response == null) {
      return "no response";
    }
    Object errors = response.bodyOrEmpty().get("errors");
    if (errors instanceof List<?> list
        && !list.isEmpty()
        && list.get(0) instanceof Map<?, ?> first
        && first.get("message") instanceof String text
        && !text.isBlank()) {
      return text;
    }
    return response.statusCode() != null ? "HTTP " + response.statusCode() : "no status code";
  }
}
