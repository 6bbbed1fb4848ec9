package io.b2mash.secops.bridge.response;

import java.util.Set;

/**
 * How a successful response body is turned into a result. Resolved from the operation name once,
 * at the call site, never by inspecting the body.
 */
public enum ResponseKind {
  /** Payload sits under {@code body.resources}. */
  RESOURCES,
  /** The whole body is the payload (GraphQL proxy). */
  RAW_BODY;

  private static final Set<String> RAW_BODY_OPERATIONS = Set.of("api_preempt_proxy_post_graphql");

  public static ResponseKind forOperation(String operation) {
    return operation != null && RAW_BODY_OPERATIONS.contains(operation) ? RAW_BODY : RESOURCES;
  }
}
