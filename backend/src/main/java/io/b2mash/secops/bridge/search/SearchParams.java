package io.b2mash.secops.bridge.search;

import io.b2mash.secops.bridge.remote.Parameters;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Parameters of a filtered search. Every field is optional; unset values are stripped before the
 * request is sent.
 *
 * @param extra endpoint-specific parameters appended after the standard ones
 */
public record SearchParams(
    String filter,
    Integer limit,
    Integer offset,
    String q,
    String sort,
    Map<String, Object> extra) {

  public static SearchParams of(
      String filter, Integer limit, Integer offset, String q, String sort) {
    return new SearchParams(filter, limit, offset, q, sort, Map.of());
  }

  public SearchParams withExtra(String key, Object value) {
    var merged = new LinkedHashMap<String, Object>(extra != null ? extra : Map.of());
    merged.put(key, value);
    return new SearchParams(filter, limit, offset, q, sort, merged);
  }

  public Map<String, Object> toQueryParams() {
    var params =
        Parameters.of("filter", filter, "limit", limit, "offset", offset, "q", q, "sort", sort);
    if (extra != null) {
      params.putAll(extra);
    }
    return Parameters.prepare(params);
  }
}
