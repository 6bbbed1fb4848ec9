package io.b2mash.secops.bridge.response;

import static org.assertj.core.api.Assertions.assertThat;

import io.b2mash.secops.bridge.remote.RemoteResponse;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ResourceExtractorTest {

  @Test
  void extractResources_failedResponseYieldsDefault() {
    var response = RemoteResponse.of(500, Map.of("resources", List.of("ignored")));

    assertThat(ResourceExtractor.extractResources(response)).isEmpty();
    assertThat(ResourceExtractor.extractResources(response, List.of("d"))).containsExactly("d");
  }

  @Test
  void extractResources_emptyListYieldsDefault() {
    var response = RemoteResponse.of(200, Map.of("resources", List.of()));

    assertThat(ResourceExtractor.extractResources(response, List.of("d"))).containsExactly("d");
  }

  @Test
  void extractResources_keepsNullEntries() {
    var resources = new ArrayList<Object>();
    resources.add("a");
    resources.add(null);
    var response = RemoteResponse.of(200, Map.of("resources", resources));

    assertThat(ResourceExtractor.extractResources(response)).containsExactly("a", null);
  }

  @Test
  void extractFirstResource_returnsFirstRecord() {
    var response =
        RemoteResponse.of(200, Map.of("resources", List.of(Map.of("id", 1), Map.of("id", 2))));

    var first = ResourceExtractor.extractFirstResource(response, "QueryIntelActorEntities", "none");

    assertThat(first.isError()).isFalse();
    assertThat(first.resource()).isEqualTo(Map.of("id", 1));
  }

  @Test
  void extractFirstResource_emptyResultIsNotFoundError() {
    var response = RemoteResponse.of(200, Map.of("resources", List.of()));

    var first =
        ResourceExtractor.extractFirstResource(
            response, "QueryIntelActorEntities", "Actor not found");

    assertThat(first.isError()).isTrue();
    assertThat(first.error().message()).isEqualTo("Actor not found");
    assertThat(first.error().operation()).isEqualTo("QueryIntelActorEntities");
  }

  @Test
  void extractFirstResource_failedResponseIsNotFoundError() {
    var first =
        ResourceExtractor.extractFirstResource(
            RemoteResponse.transportFailure("timeout"), "GetIncidents", "Incident not found");

    assertThat(first.isError()).isTrue();
    assertThat(first.toToolOutput())
        .isEqualTo(Map.of("error", "Incident not found", "operation", "GetIncidents"));
  }
}
