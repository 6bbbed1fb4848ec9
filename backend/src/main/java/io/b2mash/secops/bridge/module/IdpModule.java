package io.b2mash.secops.bridge.module;

import io.b2mash.secops.bridge.remote.RemoteCommandExecutor;
import io.b2mash.secops.bridge.response.OperationError;
import io.b2mash.secops.bridge.search.SearchResolveEngine;
import io.b2mash.secops.bridge.tool.ToolArguments;
import io.b2mash.secops.bridge.tool.ToolModuleComponent;
import io.b2mash.secops.bridge.tool.ToolRegistrar;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Identity Protection entity investigation over the GraphQL endpoint. Names and email addresses
 * are first resolved to entity IDs, then the entities are fetched with their risk details.
 *
 * <p>The GraphQL endpoint answers with a {@code data} document instead of the resources envelope,
 * so its successful responses are returned whole.
 */
@Component
@ToolModuleComponent(name = "idp")
public class IdpModule extends FalconModule {

  private static final Logger log = LoggerFactory.getLogger(IdpModule.class);

  static final String GRAPHQL_OPERATION = "api_preempt_proxy_post_graphql";

  private static final String ENTITY_DETAIL_FIELDS =
      """
      entityId
      primaryDisplayName
      secondaryDisplayName
      type
      riskScore
      riskScoreSeverity
      riskFactors { type severity }
      accounts { ... on ActiveDirectoryAccountDescriptor { domain samAccountName } }\
      """;

  public IdpModule(RemoteCommandExecutor executor, SearchResolveEngine searchEngine) {
    super(executor, searchEngine);
  }

  @Override
  public void registerTools(ToolRegistrar registrar) {
    registrar.addTool(
        "idp_investigate_entity",
        "Investigate identity entities (users, endpoints) in Falcon Identity Protection. Accepts"
            + " entity IDs, display names or email addresses and returns entity details with risk"
            + " scores and risk factors.",
        this::investigateEntity);
  }

  Object investigateEntity(ToolArguments args) {
    var entityIds = args.stringList("entity_ids");
    var entityNames = args.stringList("entity_names");
    var emailAddresses = args.stringList("email_addresses");
    int limit = args.intInRange("limit", 10, 1, 200);

    if (entityIds.isEmpty() && entityNames.isEmpty() && emailAddresses.isEmpty()) {
      return failed(
          OperationError.of(
              "At least one of entity_ids, entity_names or email_addresses must be provided"));
    }

    Set<String> resolved = new LinkedHashSet<>(entityIds);
    if (!entityNames.isEmpty()) {
      var outcome = resolve("primaryDisplayNames", entityNames, limit);
      if (outcome.error() != null) {
        return failed(outcome.error());
      }
      resolved.addAll(outcome.ids());
    }
    if (!emailAddresses.isEmpty()) {
      var outcome = resolve("secondaryDisplayNames", emailAddresses, limit);
      if (outcome.error() != null) {
        return failed(outcome.error());
      }
      resolved.addAll(outcome.ids());
    }

    if (resolved.isEmpty()) {
      return failed(OperationError.of("No entities found matching the provided identifiers"));
    }
    log.debug("Investigating {} identity entities", resolved.size());

    var query =
        "query { entities(entityIds: "
            + graphqlList(resolved)
            + ", first: "
            + resolved.size()
            + ") { nodes { "
            + ENTITY_DETAIL_FIELDS
            + " } } }";
    var details =
        query(GRAPHQL_OPERATION, null, Map.of("query", query), "Failed to fetch entity details");
    if (details.isError()) {
      return failed(details.error());
    }

    var summary = new LinkedHashMap<String, Object>();
    summary.put("status", "completed");
    summary.put("entity_count", resolved.size());
    summary.put("resolved_entity_ids", List.copyOf(resolved));
    summary.put("investigation_types", List.of("entity_details"));

    var result = new LinkedHashMap<String, Object>();
    result.put("investigation_summary", summary);
    result.put("entity_details", details.body().get("data"));
    return result;
  }

  private Resolution resolve(String filterField, List<String> values, int limit) {
    var query =
        "query { entities("
            + filterField
            + ": "
            + graphqlList(values)
            + ", first: "
            + limit
            + ") { nodes { entityId primaryDisplayName } } }";
    var result =
        query(GRAPHQL_OPERATION, null, Map.of("query", query), "Failed to resolve entities");
    if (result.isError()) {
      return new Resolution(List.of(), result.error());
    }
    var ids = new ArrayList<String>();
    for (Object node : nodes(result.body())) {
      if (node instanceof Map<?, ?> entity && entity.get("entityId") instanceof String id) {
        ids.add(id);
      }
    }
    return new Resolution(ids, null);
  }

  /** {@code data.entities.nodes}, or an empty list when any level is missing. */
  private static List<?> nodes(Map<String, Object> body) {
    if (body.get("data") instanceof Map<?, ?> data
        && data.get("entities") instanceof Map<?, ?> entities
        && entities.get("nodes") instanceof List<?> nodes) {
      return nodes;
    }
    return List.of();
  }

  private static Map<String, Object> failed(OperationError error) {
    var result = new LinkedHashMap<String, Object>(error.toMap());
    result.put("investigation_summary", Map.of("status", "failed", "entity_count", 0));
    return result;
  }

  static String graphqlList(Iterable<String> values) {
    var quoted = new ArrayList<String>();
    values.forEach(value -> quoted.add(graphqlString(value)));
    return quoted.stream().collect(Collectors.joining(", ", "[", "]"));
  }

  static String graphqlString(String value) {
    return "\"" + value.replace("\\", "\\\\").replace("\"", "\\\"") + "\"";
  }

  private record Resolution(List<String> ids, OperationError error) {}
}
