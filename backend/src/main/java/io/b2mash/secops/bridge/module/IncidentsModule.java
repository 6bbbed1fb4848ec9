package io.b2mash.secops.bridge.module;

import io.b2mash.secops.bridge.remote.RemoteCommandExecutor;
import io.b2mash.secops.bridge.search.SearchParams;
import io.b2mash.secops.bridge.search.SearchResolveEngine;
import io.b2mash.secops.bridge.search.SearchSpec;
import io.b2mash.secops.bridge.tool.ToolArguments;
import io.b2mash.secops.bridge.tool.ToolModuleComponent;
import io.b2mash.secops.bridge.tool.ToolRegistrar;
import java.util.Map;
import org.springframework.stereotype.Component;

@Component
@ToolModuleComponent(name = "incidents")
public class IncidentsModule extends FalconModule {

  static final String SEARCH_OPERATION = "QueryIncidents";
  static final String DETAILS_OPERATION = "GetIncidents";

  private final String fqlGuide;
  private final SearchSpec searchSpec;

  public IncidentsModule(RemoteCommandExecutor executor, SearchResolveEngine searchEngine) {
    super(executor, searchEngine);
    this.fqlGuide = FqlGuides.load("incidents");
    this.searchSpec =
        new SearchSpec(
            SEARCH_OPERATION,
            "Failed to search incidents",
            DETAILS_OPERATION,
            "ids",
            false,
            fqlGuide);
  }

  @Override
  public void registerTools(ToolRegistrar registrar) {
    registrar.addTool(
        "search_incidents",
        "Search for incidents by state, score, tags or time range and return their full details.",
        this::searchIncidents);
    registrar.addTool(
        "get_incident_details",
        "Retrieve details for incident IDs you already have.",
        this::getIncidentDetails);
  }

  @Override
  public void registerResources(ToolRegistrar registrar) {
    addFqlGuide(registrar, "falcon://incidents/search/fql-guide", "search_incidents", fqlGuide);
  }

  Object searchIncidents(ToolArguments args) {
    var params =
        SearchParams.of(
            args.optionalString("filter"),
            args.intInRange("limit", 10, 1, 500),
            args.optionalInt("offset"),
            null,
            args.optionalString("sort"));
    return searchEngine.searchThenFetch(searchSpec, params).toToolOutput();
  }

  Object getIncidentDetails(ToolArguments args) {
    return searchEngine
        .getByIds(DETAILS_OPERATION, args.requiredStringList("ids"), "ids", false, Map.of())
        .toToolOutput();
  }
}
