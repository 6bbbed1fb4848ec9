package io.b2mash.secops.bridge.scope;

import java.util.List;
import java.util.Map;

/**
 * Static lookup from remote operation name to the API scopes the client credentials must hold.
 * Used only to annotate permission-denied errors.
 */
public final class ScopeRegistry {

  private static final Map<String, List<String>> REQUIREMENTS =
      Map.ofEntries(
          // Alerts
          Map.entry("GetQueriesAlertsV2", List.of("Alerts:read")),
          Map.entry("PostEntitiesAlertsV2", List.of("Alerts:read")),
          // Hosts
          Map.entry("QueryDevicesByFilter", List.of("Hosts:read")),
          Map.entry("PostDeviceDetailsV2", List.of("Hosts:read")),
          // Incidents
          Map.entry("QueryIncidents", List.of("Incidents:read")),
          Map.entry("GetIncidents", List.of("Incidents:read")),
          // Intel
          Map.entry("QueryIntelActorEntities", List.of("Actors (Falcon Intelligence):read")),
          Map.entry(
              "QueryIntelIndicatorEntities", List.of("Indicators (Falcon Intelligence):read")),
          Map.entry("QueryIntelReportEntities", List.of("Reports (Falcon Intelligence):read")),
          Map.entry("GetMitreReport", List.of("Actors (Falcon Intelligence):read")),
          // Scheduled reports
          Map.entry("scheduled_reports_query", List.of("Scheduled Reports:read")),
          Map.entry("scheduled_reports_get", List.of("Scheduled Reports:read")),
          Map.entry("scheduled_reports_launch", List.of("Scheduled Reports:write")),
          Map.entry("report_executions_query", List.of("Scheduled Reports:read")),
          Map.entry("report_executions_get", List.of("Scheduled Reports:read")),
          Map.entry("report_executions_download_get", List.of("Scheduled Reports:read")),
          // Identity protection
          Map.entry("api_preempt_proxy_post_graphql", List.of("Identity Protection GraphQL:write")),
          // Next-Gen SIEM
          Map.entry("StartSearchV1", List.of("NGSIEM:write")),
          Map.entry("GetSearchStatusV1", List.of("NGSIEM:read")),
          Map.entry("StopSearchV1", List.of("NGSIEM:write")));

  private ScopeRegistry() {}

  /** Scopes required by {@code operation}; empty for unknown, empty or null names. */
  public static List<String> requiredScopes(String operation) {
    if (operation == null || operation.isEmpty()) {
      return List.of();
    }
    return REQUIREMENTS.getOrDefault(operation, List.of());
  }

  /** The full table, for validation and documentation. */
  public static Map<String, List<String>> requirements() {
    return REQUIREMENTS;
  }
}
