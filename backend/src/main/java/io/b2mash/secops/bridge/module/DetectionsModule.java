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

/** Alert search and lookup. */
@Component
@ToolModuleComponent(name = "detections")
public class DetectionsModule extends FalconModule {

  static final String SEARCH_OPERATION = "GetQueriesAlertsV2";
  static final String DETAILS_OPERATION = "PostEntitiesAlertsV2";
  static final String FQL_GUIDE_URI = "falcon://detections/search/fql-guide";

  private final String fqlGuide;
  private final SearchSpec searchSpec;

  public DetectionsModule(RemoteCommandExecutor executor, SearchResolveEngine searchEngine) {
    super(executor, searchEngine);
    this.fqlGuide = FqlGuides.load("detections");
    this.searchSpec =
        new SearchSpec(
            SEARCH_OPERATION,
            "Failed to search detections",
            DETAILS_OPERATION,
            "composite_ids",
            false,
            fqlGuide);
  }

  @Override
  public void registerTools(ToolRegistrar registrar) {
    registrar.addTool(
        "search_detections",
        "Find detections by criteria and return their complete details. Filter by severity,"
            + " status, hostname or time range. Returns the FQL guide on errors or empty results.",
        this::searchDetections);
    registrar.addTool(
        "get_detection_details",
        "Retrieve details for composite detection IDs you already have. To find detections by"
            + " criteria use falcon_search_detections.",
        this::getDetectionDetails);
  }

  @Override
  public void registerResources(ToolRegistrar registrar) {
    addFqlGuide(registrar, FQL_GUIDE_URI, "search_detections", fqlGuide);
  }

  Object searchDetections(ToolArguments args) {
    var params =
        SearchParams.of(
            args.optionalString("filter"),
            args.intInRange("limit", 10, 1, 9999),
            args.optionalInt("offset"),
            args.optionalString("q"),
            args.optionalString("sort"));
    var includeHidden = args.bool("include_hidden", true);
    return searchEngine
        .searchThenFetch(searchSpec, params, Map.of("include_hidden", includeHidden))
        .toToolOutput();
  }

  Object getDetectionDetails(ToolArguments args) {
    var ids = args.requiredStringList("ids");
    var includeHidden = args.bool("include_hidden", true);
    return searchEngine
        .getByIds(
            DETAILS_OPERATION, ids, "composite_ids", false, Map.of("include_hidden", includeHidden))
        .toToolOutput();
  }
}
