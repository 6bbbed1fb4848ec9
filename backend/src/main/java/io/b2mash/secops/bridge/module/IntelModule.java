package io.b2mash.secops.bridge.module;

import io.b2mash.secops.bridge.remote.Parameters;
import io.b2mash.secops.bridge.remote.RemoteCommandExecutor;
import io.b2mash.secops.bridge.remote.RemoteRequest;
import io.b2mash.secops.bridge.response.ResourceExtractor;
import io.b2mash.secops.bridge.response.ResponseClassifier;
import io.b2mash.secops.bridge.search.SearchParams;
import io.b2mash.secops.bridge.search.SearchResolveEngine;
import io.b2mash.secops.bridge.tool.ToolArguments;
import io.b2mash.secops.bridge.tool.ToolModuleComponent;
import io.b2mash.secops.bridge.tool.ToolRegistrar;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Threat intelligence: actors, indicators, reports and MITRE ATT&CK reports.
 *
 * <p>The intel searches use the combined endpoints, which return full records in one call, so
 * there is no separate fetch step. Errors are wrapped in a list to keep the result shape stable.
 */
@Component
@ToolModuleComponent(name = "intel")
public class IntelModule extends FalconModule {

  private static final Logger log = LoggerFactory.getLogger(IntelModule.class);

  static final String ACTORS_OPERATION = "QueryIntelActorEntities";
  static final String INDICATORS_OPERATION = "QueryIntelIndicatorEntities";
  static final String REPORTS_OPERATION = "QueryIntelReportEntities";
  static final String MITRE_OPERATION = "GetMitreReport";

  private static final List<String> MITRE_FORMATS = List.of("json", "csv");

  private final String actorsGuide;
  private final String indicatorsGuide;
  private final String reportsGuide;

  public IntelModule(RemoteCommandExecutor executor, SearchResolveEngine searchEngine) {
    super(executor, searchEngine);
    this.actorsGuide = FqlGuides.load("intel-actors");
    this.indicatorsGuide = FqlGuides.load("intel-indicators");
    this.reportsGuide = FqlGuides.load("intel-reports");
  }

  @Override
  public void registerTools(ToolRegistrar registrar) {
    registrar.addTool(
        "search_actors",
        "Research threat actors and adversary groups tracked by CrowdStrike intelligence. Use the"
            + " falcon://intel/actors/fql-guide resource when building the filter.",
        this::searchActors);
    registrar.addTool(
        "search_indicators",
        "Search for threat indicators and indicators of compromise (IOCs). Use the"
            + " falcon://intel/indicators/fql-guide resource when building the filter.",
        this::searchIndicators);
    registrar.addTool(
        "search_reports",
        "Access CrowdStrike intelligence publications and threat reports. Use the"
            + " falcon://intel/reports/fql-guide resource when building the filter.",
        this::searchReports);
    registrar.addTool(
        "get_mitre_report",
        "Generate the MITRE ATT&CK report (tactics, techniques and procedures) for a threat actor"
            + " given by name or numeric ID.",
        this::getMitreReport);
  }

  @Override
  public void registerResources(ToolRegistrar registrar) {
    addFqlGuide(registrar, "falcon://intel/actors/fql-guide", "search_actors", actorsGuide);
    addFqlGuide(
        registrar, "falcon://intel/indicators/fql-guide", "search_indicators", indicatorsGuide);
    addFqlGuide(registrar, "falcon://intel/reports/fql-guide", "search_reports", reportsGuide);
  }

  Object searchActors(ToolArguments args) {
    return searchEngine
        .search(ACTORS_OPERATION, searchParams(args), "Failed to search actors")
        .toListOutput();
  }

  Object searchIndicators(ToolArguments args) {
    var params =
        searchParams(args)
            .withExtra("include_deleted", args.bool("include_deleted", false))
            .withExtra("include_relations", args.bool("include_relations", false));
    return searchEngine
        .search(INDICATORS_OPERATION, params, "Failed to search indicators")
        .toListOutput();
  }

  Object searchReports(ToolArguments args) {
    return searchEngine
        .search(REPORTS_OPERATION, searchParams(args), "Failed to search reports")
        .toListOutput();
  }

  /** Returns the report text, or a single-element list holding the error. */
  Object getMitreReport(ToolArguments args) {
    var actor = args.requiredString("actor").strip();
    var format = args.oneOf("format", "json", MITRE_FORMATS);

    String actorId = actor;
    if (!actor.chars().allMatch(Character::isDigit)) {
      log.debug("Searching for actor: {}", actor);
      var response =
          executor.execute(
              ACTORS_OPERATION,
              RemoteRequest.ofQuery(
                  Parameters.of("filter", "name:'" + actor + "'", "limit", 1)));
      if (!ResponseClassifier.isSuccess(response)) {
        return List.of(
            ResponseClassifier.toError(
                    response, ACTORS_OPERATION, "Failed to search for actor by name")
                .toMap());
      }
      var first =
          ResourceExtractor.extractFirstResource(
              response, ACTORS_OPERATION, "Actor not found: no actor found with name " + actor);
      if (first.isError()) {
        return List.of(first.toToolOutput());
      }
      Object id = first.resource() instanceof Map<?, ?> found ? found.get("id") : null;
      if (id == null) {
        return List.of(
            Map.of(
                "error", "Invalid actor data: found actor without an ID",
                "details", first.resource()));
      }
      actorId = String.valueOf(id);
      log.debug("Resolved actor '{}' to ID: {}", actor, actorId);
    }

    return download(
        MITRE_OPERATION,
        Parameters.of("actor_id", actorId, "format", format),
        "Failed to get MITRE report");
  }

  private static SearchParams searchParams(ToolArguments args) {
    return SearchParams.of(
        args.optionalString("filter"),
        args.intInRange("limit", 10, 1, 5000),
        args.optionalInt("offset"),
        args.optionalString("q"),
        args.optionalString("sort"));
  }
}
