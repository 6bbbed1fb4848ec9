package io.b2mash.secops.bridge.module;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.InstanceOfAssertFactories.LIST;
import static org.assertj.core.api.InstanceOfAssertFactories.MAP;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.b2mash.secops.bridge.remote.RemoteCommandExecutor;
import io.b2mash.secops.bridge.remote.RemoteRequest;
import io.b2mash.secops.bridge.remote.RemoteResponse;
import io.b2mash.secops.bridge.search.SearchResolveEngine;
import io.b2mash.secops.bridge.tool.ToolArguments;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class IntelModuleTest {

  @Mock private RemoteCommandExecutor executor;

  private IntelModule module;

  @BeforeEach
  void setUp() {
    module = new IntelModule(executor, new SearchResolveEngine(executor));
  }

  @Nested
  class Searches {

    @Test
    void indicatorSearchSendsRelationFlags() {
      when(executor.execute(eq(IntelModule.INDICATORS_OPERATION), any()))
          .thenReturn(
              RemoteResponse.of(200, Map.of("resources", List.of(Map.of("indicator", "1.2.3.4")))));

      var result =
          module.searchIndicators(
              ToolArguments.of(Map.of("filter", "type:'ip_address'", "include_relations", true)));

      assertThat(result).isEqualTo(List.of(Map.of("indicator", "1.2.3.4")));
      var captor = ArgumentCaptor.forClass(RemoteRequest.class);
      verify(executor).execute(eq(IntelModule.INDICATORS_OPERATION), captor.capture());
      assertThat(captor.getValue().queryParams())
          .containsEntry("include_deleted", false)
          .containsEntry("include_relations", true)
          .containsEntry("limit", 10);
    }

    @Test
    void failedActorSearchIsWrappedInList() {
      when(executor.execute(eq(IntelModule.ACTORS_OPERATION), any()))
          .thenReturn(
              RemoteResponse.of(
                  400, Map.of("errors", List.of(Map.of("message", "invalid filter")))));

      var result = module.searchActors(ToolArguments.of(Map.of("filter", "name:")));

      assertThat(result)
          .asInstanceOf(LIST)
          .singleElement()
          .asInstanceOf(MAP)
          .containsEntry("error", "Failed to search actors: invalid filter");
    }
  }

  @Nested
  class MitreReport {

    @Test
    void numericActorSkipsNameLookup() {
      when(executor.execute(eq(IntelModule.MITRE_OPERATION), any()))
          .thenReturn(
              RemoteResponse.binary(200, "{\"tactics\":[]}".getBytes(StandardCharsets.UTF_8)));

      var result = module.getMitreReport(ToolArguments.of(Map.of("actor", "12345")));

      assertThat(result).isEqualTo("{\"tactics\":[]}");
      verify(executor, never()).execute(eq(IntelModule.ACTORS_OPERATION), any());
      var captor = ArgumentCaptor.forClass(RemoteRequest.class);
      verify(executor).execute(eq(IntelModule.MITRE_OPERATION), captor.capture());
      assertThat(captor.getValue().queryParams())
          .containsEntry("actor_id", "12345")
          .containsEntry("format", "json");
    }

    @Test
    void actorNameIsResolvedToId() {
      when(executor.execute(eq(IntelModule.ACTORS_OPERATION), any()))
          .thenReturn(
              RemoteResponse.of(
                  200, Map.of("resources", List.of(Map.of("id", 156, "name", "FANCY BEAR")))));
      when(executor.execute(eq(IntelModule.MITRE_OPERATION), any()))
          .thenReturn(
              RemoteResponse.binary(200, "tactic,technique".getBytes(StandardCharsets.UTF_8)));

      var result =
          module.getMitreReport(ToolArguments.of(Map.of("actor", "FANCY BEAR", "format", "csv")));

      assertThat(result).isEqualTo("tactic,technique");
      var lookup = ArgumentCaptor.forClass(RemoteRequest.class);
      verify(executor).execute(eq(IntelModule.ACTORS_OPERATION), lookup.capture());
      assertThat(lookup.getValue().queryParams())
          .containsEntry("filter", "name:'FANCY BEAR'")
          .containsEntry("limit", 1);
      var download = ArgumentCaptor.forClass(RemoteRequest.class);
      verify(executor).execute(eq(IntelModule.MITRE_OPERATION), download.capture());
      assertThat(download.getValue().queryParams())
          .containsEntry("actor_id", "156")
          .containsEntry("format", "csv");
    }

    @Test
    void unknownActorNameReturnsNotFoundError() {
      when(executor.execute(eq(IntelModule.ACTORS_OPERATION), any()))
          .thenReturn(RemoteResponse.of(200, Map.of("resources", List.of())));

      var result = module.getMitreReport(ToolArguments.of(Map.of("actor", "NOBODY")));

      assertThat(result)
          .asInstanceOf(LIST)
          .singleElement()
          .asInstanceOf(MAP)
          .containsEntry("error", "Actor not found: no actor found with name NOBODY");
      verify(executor, never()).execute(eq(IntelModule.MITRE_OPERATION), any());
    }

    @Test
    void actorWithoutIdIsReported() {
      when(executor.execute(eq(IntelModule.ACTORS_OPERATION), any()))
          .thenReturn(
              RemoteResponse.of(200, Map.of("resources", List.of(Map.of("name", "GHOST")))));

      var result = module.getMitreReport(ToolArguments.of(Map.of("actor", "GHOST")));

      assertThat(result)
          .asInstanceOf(LIST)
          .singleElement()
          .asInstanceOf(MAP)
          .containsEntry("error", "Invalid actor data: found actor without an ID");
    }

    @Test
    void downloadFailureIsWrappedInList() {
      when(executor.execute(eq(IntelModule.MITRE_OPERATION), any()))
          .thenReturn(RemoteResponse.of(404, Map.of()));

      var result = module.getMitreReport(ToolArguments.of(Map.of("actor", "7")));

      assertThat(result)
          .asInstanceOf(LIST)
          .singleElement()
          .asInstanceOf(MAP)
          .containsEntry("error", "Failed to get MITRE report: HTTP 404");
    }
  }
}
