package io.b2mash.secops.bridge.search;

import java.util.Map;

/**
 * Static description of a two-step search: which operation resolves identifiers, which one fetches
 * details and how the identifiers are passed to it.
 *
 * @param searchOperation operation returning identifiers
 * @param searchErrorMessage prefix for search-step errors
 * @param fetchOperation bulk detail operation
 * @param idField parameter name carrying the identifiers, e.g. {@code composite_ids}
 * @param fetchUsesQueryParams send identifiers as query parameters instead of a JSON body
 * @param fqlGuide filter syntax documentation attached to search-side errors and empty results;
 *     null disables guidance
 */
public record SearchSpec(
    String searchOperation,
    String searchErrorMessage,
    String fetchOperation,
    String idField,
    boolean fetchUsesQueryParams,
    String fqlGuide) {

  /** Fetch request for the given identifiers plus endpoint-specific extras. */
  FetchRequest fetch(Object ids, Map<String, Object> extras) {
    return new FetchRequest(fetchOperation, idField, ids, fetchUsesQueryParams, extras);
  }

  record FetchRequest(
      String operation,
      String idField,
      Object ids,
      boolean useQueryParams,
      Map<String, Object> extras) {}
}
