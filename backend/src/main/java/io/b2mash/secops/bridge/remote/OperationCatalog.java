package io.b2mash.secops.bridge.remote;

import java.util.Map;
import java.util.Optional;
import org.springframework.http.HttpMethod;

/** Maps remote operation names to their HTTP route on the Falcon API. */
public final class OperationCatalog {

  public record Route(HttpMethod method, String pathTemplate) {}

  private static final Map<String, Route> ROUTES =
      Map.ofEntries(
          Map.entry("GetQueriesAlertsV2", get("/alerts/queries/alerts/v2")),
          Map.entry("PostEntitiesAlertsV2", post("/alerts/entities/alerts/v2")),
          Map.entry("QueryDevicesByFilter", get("/devices/queries/devices/v1")),
          Map.entry("PostDeviceDetailsV2", post("/devices/entities/devices/v2")),
          Map.entry("QueryIncidents", get("/incidents/queries/incidents/v1")),
          Map.entry("GetIncidents", post("/incidents/entities/incidents/GET/v1")),
          Map.entry("QueryIntelActorEntities", get("/intel/combined/actors/v1")),
          Map.entry("QueryIntelIndicatorEntities", get("/intel/combined/indicators/v1")),
          Map.entry("QueryIntelReportEntities", get("/intel/combined/reports/v1")),
          Map.entry("GetMitreReport", get("/intel/entities/mitre-reports/v1")),
          Map.entry("scheduled_reports_query", get("/reports/queries/scheduled-reports/v1")),
          Map.entry("scheduled_reports_get", get("/reports/entities/scheduled-reports/v1")),
          Map.entry(
              "scheduled_reports_launch", post("/reports/entities/scheduled-reports/execution/v1")),
          Map.entry("report_executions_query", get("/reports/queries/report-executions/v1")),
          Map.entry("report_executions_get", get("/reports/entities/report-executions/v1")),
          Map.entry(
              "report_executions_download_get",
              get("/reports/entities/report-executions-download/v1")),
          Map.entry(
              "api_preempt_proxy_post_graphql", post("/identity-protection/combined/graphql/v1")),
          Map.entry("StartSearchV1", post("/humio/api/v1/repositories/{repository}/queryjobs")),
          Map.entry(
              "GetSearchStatusV1",
              get("/humio/api/v1/repositories/{repository}/queryjobs/{search_id}")),
          Map.entry(
              "StopSearchV1", delete("/humio/api/v1/repositories/{repository}/queryjobs/{id}")));

  private OperationCatalog() {}

  public static Optional<Route> find(String operation) {
    return Optional.ofNullable(operation).map(ROUTES::get);
  }

  public static Route require(String operation) {
    return find(operation)
        .orElseThrow(
            () -> new IllegalArgumentException("No route registered for operation " + operation));
  }

  private static Route get(String path) {
    return new Route(HttpMethod.GET, path);
  }

  private static Route post(String path) {
    return new Route(HttpMethod.POST, path);
  }

  private static Route delete(String path) {
    return new Route(HttpMethod.DELETE, path);
  }
}
