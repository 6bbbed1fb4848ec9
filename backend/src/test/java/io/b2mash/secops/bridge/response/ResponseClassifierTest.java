package io.b2mash.secops.bridge.response;

import static org.assertj.core.api.Assertions.assertThat;

import io.b2mash.secops.bridge.remote.RemoteResponse;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class ResponseClassifierTest {

  private static RemoteResponse errorResponse(int status, String message) {
    return RemoteResponse.of(status, Map.of("errors", List.of(Map.of("message", message))));
  }

  @Nested
  class Success {

    @Test
    void statusBelow400IsSuccess() {
      assertThat(ResponseClassifier.isSuccess(RemoteResponse.of(200, Map.of()))).isTrue();
      assertThat(ResponseClassifier.isSuccess(RemoteResponse.of(399, Map.of()))).isTrue();
    }

    @Test
    void statusFrom400IsFailure() {
      assertThat(ResponseClassifier.isSuccess(RemoteResponse.of(400, Map.of()))).isFalse();
      assertThat(ResponseClassifier.isSuccess(RemoteResponse.of(500, Map.of()))).isFalse();
    }

    @Test
    void missingStatusIsFailure() {
      assertThat(ResponseClassifier.isSuccess(RemoteResponse.transportFailure("refused")))
          .isFalse();
    }
  }

  @Nested
  class HandleApiResponse {

    @Test
    void returnsResourcesInOrder() {
      var response =
          RemoteResponse.of(
              200, Map.of("resources", List.of(Map.of("id", "a"), Map.of("id", "b"))));

      var result =
          ResponseClassifier.handleApiResponse(response, "GetIncidents", "Failed to get incidents");

      assertThat(result.isError()).isFalse();
      assertThat(result.resources()).containsExactly(Map.of("id", "a"), Map.of("id", "b"));
    }

    @Test
    void returnsDefaultWhenResourcesMissing() {
      var response = RemoteResponse.of(200, Map.of("meta", Map.of()));

      var result =
          ResponseClassifier.handleApiResponse(
              response, "GetIncidents", "Failed", List.of("fallback"));

      assertThat(result.resources()).containsExactly("fallback");
    }

    @Test
    void graphqlOperationReturnsWholeBody() {
      Map<String, Object> body = Map.of("data", Map.of("entities", Map.of("nodes", List.of())));
      var response = RemoteResponse.of(200, body);

      var result =
          ResponseClassifier.handleApiResponse(
              response, "api_preempt_proxy_post_graphql", "Failed");

      assertThat(result.isError()).isFalse();
      assertThat(result.body()).isEqualTo(body);
      assertThat(result.toToolOutput()).isEqualTo(body);
    }

    @Test
    void otherOperationIgnoresNonEnvelopeBody() {
      var response = RemoteResponse.of(200, Map.of("data", Map.of("x", 1)));

      var result = ResponseClassifier.handleApiResponse(response, "GetIncidents", "Failed");

      assertThat(result.resources()).isEmpty();
      assertThat(result.body()).isNull();
    }

    @Test
    void failureUsesPlatformMessage() {
      var result =
          ResponseClassifier.handleApiResponse(
              errorResponse(400, "invalid filter"), "QueryIncidents", "Failed to search incidents");

      assertThat(result.isError()).isTrue();
      assertThat(result.error().message()).isEqualTo("Failed to search incidents: invalid filter");
      assertThat(result.error().operation()).isEqualTo("QueryIncidents");
      assertThat(result.error().requiredScopes()).isNull();
      assertThat(result.error().resolution()).isNull();
    }

    @Test
    void failureWithoutPlatformMessageUsesStatus() {
      var result =
          ResponseClassifier.handleApiResponse(
              RemoteResponse.of(502, Map.of()), "QueryIncidents", "Failed");

      assertThat(result.error().message()).isEqualTo("Failed: HTTP 502");
    }
  }

  @Nested
  class PermissionFailures {

    @Test
    void forbiddenAddsScopesAndResolution() {
      var result =
          ResponseClassifier.handleApiResponse(
              errorResponse(403, "access denied"), "GetQueriesAlertsV2", "Failed to search");

      var error = result.error();
      assertThat(error.message())
          .isEqualTo("Failed to search: access denied\nRequired scopes: Alerts:read");
      assertThat(error.requiredScopes()).containsExactly("Alerts:read");
      assertThat(error.resolution()).contains("Alerts:read");
    }

    @Test
    void unauthorizedIsAlsoAPermissionFailure() {
      var result =
          ResponseClassifier.handleApiResponse(
              errorResponse(401, "unauthorized"), "StartSearchV1", "Failed to start NGSIEM search");

      assertThat(result.error().requiredScopes()).containsExactly("NGSIEM:write");
    }

    @Test
    void unknownOperationKeepsGenericMessage() {
      var result =
          ResponseClassifier.handleApiResponse(
              errorResponse(403, "access denied"), "UnknownOperation", "Failed");

      assertThat(result.error().message()).isEqualTo("Failed: access denied");
      assertThat(result.error().toMap()).doesNotContainKeys("required_scopes", "resolution");
    }

    @Test
    void nonPermissionStatusCarriesNoScopes() {
      var result =
          ResponseClassifier.handleApiResponse(
              errorResponse(500, "boom"), "GetQueriesAlertsV2", "Failed");

      assertThat(result.error().toMap()).doesNotContainKeys("required_scopes", "resolution");
    }

    @Test
    void renderedErrorCarriesResponseDetails() {
      var map =
          ResponseClassifier.handleApiResponse(
                  errorResponse(403, "denied"), "GetIncidents", "Failed")
              .error()
              .toMap();

      assertThat(map)
          .containsKeys("error", "details", "operation", "required_scopes", "resolution");
      @SuppressWarnings("unchecked")
      var details = (Map<String, Object>) map.get("details");
      assertThat(details).containsEntry("status_code", 403);
    }
  }
}
