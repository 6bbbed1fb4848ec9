package io.b2mash.secops.bridge.search;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Envelope returned when the search step failed or matched nothing, pairing the outcome with the
 * filter syntax guide so the caller can refine the filter.
 */
public record FqlGuidance(List<Object> results, String filterUsed, String fqlGuide, String hint) {

  static final String ERROR_HINT =
      "Filter error occurred. Review the FQL guide above to correct your query syntax.";
  static final String EMPTY_HINT =
      "No results matched your filter. Review the FQL guide above to refine your query.";

  static FqlGuidance forError(Map<String, Object> error, String filterUsed, String fqlGuide) {
    return new FqlGuidance(List.of(error), filterUsed, fqlGuide, ERROR_HINT);
  }

  static FqlGuidance forEmpty(String filterUsed, String fqlGuide) {
    return new FqlGuidance(List.of(), filterUsed, fqlGuide, EMPTY_HINT);
  }

  public Map<String, Object> toMap() {
    var map = new LinkedHashMap<String, Object>();
    map.put("results", results);
    map.put("filter_used", filterUsed);
    map.put("fql_guide", fqlGuide);
    map.put("hint", hint);
    return map;
  }
}
