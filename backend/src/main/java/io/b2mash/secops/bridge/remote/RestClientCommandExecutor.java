package io.b2mash.secops.bridge.remote;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClient.RequestHeadersSpec.ConvertibleClientHttpResponse;
import org.springframework.web.client.RestClientException;

/**
 * {@link RemoteCommandExecutor} backed by Spring's {@link RestClient}. Operation names are resolved
 * to HTTP routes through {@link OperationCatalog}. Non-2xx responses are returned, not thrown, so
 * the response classifier sees every status code.
 */
@Component
public class RestClientCommandExecutor implements RemoteCommandExecutor {

  private static final Logger log = LoggerFactory.getLogger(RestClientCommandExecutor.class);

  private static final ParameterizedTypeReference<Map<String, Object>> JSON_OBJECT =
      new ParameterizedTypeReference<>() {};

  private final RestClient restClient;

  @Autowired
  public RestClientCommandExecutor(FalconApiProperties properties) {
    this(RestClient.builder(), properties);
  }

  RestClientCommandExecutor(RestClient.Builder builder, FalconApiProperties properties) {
    this.restClient =
        builder
            .baseUrl(properties.baseUrl())
            .defaultHeaders(
                headers -> {
                  headers.set(HttpHeaders.USER_AGENT, properties.userAgent());
                  headers.setAccept(List.of(MediaType.APPLICATION_JSON, MediaType.ALL));
                  if (properties.apiToken() != null && !properties.apiToken().isBlank()) {
                    headers.setBearerAuth(properties.apiToken());
                  }
                })
            .build();
  }

  @Override
  public RemoteResponse execute(String operation, RemoteRequest request) {
    var route = OperationCatalog.require(operation);
    log.debug("Executing {} {} {}", operation, route.method(), route.pathTemplate());

    try {
      var spec =
          restClient
              .method(route.method())
              .uri(
                  uriBuilder -> {
                    uriBuilder.path(route.pathTemplate());
                    request
                        .queryParams()
                        .forEach(
                            (name, value) -> {
                              if (value instanceof Collection<?> values) {
                                uriBuilder.queryParam(name, values);
                              } else {
                                uriBuilder.queryParam(name, value);
                              }
                            });
                    return uriBuilder.build(request.pathParams());
                  });
      if (request.hasBody()) {
        spec.contentType(MediaType.APPLICATION_JSON).body(request.body());
      }
      return spec.exchange((clientRequest, clientResponse) -> toRemoteResponse(clientResponse));
    } catch (RestClientException e) {
      log.error(
          "Remote call {} failed before a response was received: {}", operation, e.getMessage());
      return RemoteResponse.transportFailure(operation + " request failed: " + e.getMessage());
    }
  }

  private RemoteResponse toRemoteResponse(ConvertibleClientHttpResponse response)
      throws IOException {
    int status = response.getStatusCode().value();
    MediaType contentType = response.getHeaders().getContentType();

    if (contentType != null && contentType.isCompatibleWith(MediaType.APPLICATION_JSON)) {
      Map<String, Object> body = response.bodyTo(JSON_OBJECT);
      return RemoteResponse.of(status, body != null ? body : Map.of());
    }

    byte[] content = response.getBody().readAllBytes();
    if (status >= 400) {
      // Gateways answer errors with HTML or plain text; keep the text as the error message.
      var text = new String(content, StandardCharsets.UTF_8);
      return RemoteResponse.of(status, Map.of("errors", List.of(Map.of("message", text))));
    }
    return RemoteResponse.binary(status, content);
  }
}
