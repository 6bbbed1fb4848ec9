package io.b2mash.secops.bridge.module;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.InstanceOfAssertFactories.MAP;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import io.b2mash.secops.bridge.remote.RemoteCommandExecutor;
import io.b2mash.secops.bridge.remote.RemoteRequest;
import io.b2mash.secops.bridge.remote.RemoteResponse;
import io.b2mash.secops.bridge.search.SearchResolveEngine;
import io.b2mash.secops.bridge.tool.ToolArguments;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class IdpModuleTest {

  @Mock private RemoteCommandExecutor executor;

  private IdpModule module;

  @BeforeEach
  void setUp() {
    module = new IdpModule(executor, new SearchResolveEngine(executor));
  }

  private static RemoteResponse nodes(List<?> nodes) {
    return RemoteResponse.of(200, Map.of("data", Map.of("entities", Map.of("nodes", nodes))));
  }

  @Test
  void requiresAtLeastOneIdentifier() {
    var result = module.investigateEntity(ToolArguments.of(Map.of("limit", 5)));

    assertThat(result)
        .asInstanceOf(MAP)
        .containsEntry(
            "error",
            "At least one of entity_ids, entity_names or email_addresses must be provided")
        .containsEntry("investigation_summary", Map.of("status", "failed", "entity_count", 0));
    verifyNoInteractions(executor);
  }

  @Test
  void resolvesNamesThenFetchesDetails() {
    var detailData =
        Map.<String, Object>of(
            "entities",
            Map.of("nodes", List.of(Map.of("entityId", "e-1", "riskScore", 0.7))));
    when(executor.execute(eq(IdpModule.GRAPHQL_OPERATION), any()))
        .thenReturn(
            nodes(List.of(Map.of("entityId", "e-1", "primaryDisplayName", "Jane Doe"))),
            RemoteResponse.of(200, Map.of("data", detailData)));

    var result =
        module.investigateEntity(ToolArguments.of(Map.of("entity_names", List.of("Jane Doe"))));

    assertThat(result)
        .asInstanceOf(MAP)
        .containsEntry("entity_details", detailData)
        .containsEntry(
            "investigation_summary",
            Map.of(
                "status", "completed",
                "entity_count", 1,
                "resolved_entity_ids", List.of("e-1"),
                "investigation_types", List.of("entity_details")));

    var captor = ArgumentCaptor.forClass(RemoteRequest.class);
    verify(executor, times(2)).execute(eq(IdpModule.GRAPHQL_OPERATION), captor.capture());
    assertThat((String) captor.getAllValues().get(0).body().get("query"))
        .contains("primaryDisplayNames: [\"Jane Doe\"]")
        .contains("first: 10");
    assertThat((String) captor.getAllValues().get(1).body().get("query"))
        .contains("entityIds: [\"e-1\"]");
  }

  @Test
  void emailsResolveThroughSecondaryDisplayNames() {
    when(executor.execute(eq(IdpModule.GRAPHQL_OPERATION), any()))
        .thenReturn(nodes(List.of()));

    var result =
        module.investigateEntity(
            ToolArguments.of(Map.of("email_addresses", "jane@example.com")));

    assertThat(result)
        .asInstanceOf(MAP)
        .containsEntry("error", "No entities found matching the provided identifiers");
    var captor = ArgumentCaptor.forClass(RemoteRequest.class);
    verify(executor).execute(eq(IdpModule.GRAPHQL_OPERATION), captor.capture());
    assertThat((String) captor.getValue().body().get("query"))
        .contains("secondaryDisplayNames: [\"jane@example.com\"]");
  }

  @Test
  void resolutionFailureIsReported() {
    when(executor.execute(eq(IdpModule.GRAPHQL_OPERATION), any()))
        .thenReturn(RemoteResponse.of(403, Map.of()));

    var result =
        module.investigateEntity(ToolArguments.of(Map.of("entity_names", List.of("x"))));

    assertThat(result)
        .asInstanceOf(MAP)
        .containsKeys("error", "required_scopes")
        .containsEntry("investigation_summary", Map.of("status", "failed", "entity_count", 0));
  }

  @Test
  void quotesAndBackslashesAreEscaped() {
    assertThat(IdpModule.graphqlString("a\"b\\c")).isEqualTo("\"a\\\"b\\\\c\"");
    assertThat(IdpModule.graphqlList(List.of("x", "y"))).isEqualTo("[\"x\", \"y\"]");
  }
}
