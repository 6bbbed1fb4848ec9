package io.b2mash.secops.bridge.search;

import io.b2mash.secops.bridge.remote.RemoteCommandExecutor;
import io.b2mash.secops.bridge.remote.RemoteRequest;
import io.b2mash.secops.bridge.response.ApiResult;
import io.b2mash.secops.bridge.response.ResponseClassifier;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Runs the two-step search used by nearly every searchable entity: a filtered query resolving
 * identifiers, then a bulk fetch of their details.
 *
 * <p>Filter guidance is attached only to the search step. Once the filter has matched, a failing
 * detail fetch is a platform problem and is returned as a plain error.
 */
@Service
public class SearchResolveEngine {

  private static final Logger log = LoggerFactory.getLogger(SearchResolveEngine.class);

  private static final String FETCH_ERROR_MESSAGE = "Failed to perform operation";

  private final RemoteCommandExecutor executor;

  public SearchResolveEngine(RemoteCommandExecutor executor) {
    this.executor = executor;
  }

  /** Single search call; returns whatever the operation lists, or the error. */
  public ApiResult search(String operation, SearchParams params, String errorMessage) {
    var query = params.toQueryParams();
    log.debug("Executing {} with params: {}", operation, query);
    var response = executor.execute(operation, RemoteRequest.ofQuery(query));
    return ResponseClassifier.handleApiResponse(response, operation, errorMessage);
  }

  /** Bulk detail fetch for identifiers the caller already has. */
  public ApiResult getByIds(
      String operation,
      Object ids,
      String idField,
      boolean useQueryParams,
      Map<String, Object> extras) {
    var params = new LinkedHashMap<String, Object>();
    params.put(idField, ids);
    if (extras != null) {
      params.putAll(extras);
    }
    var request = useQueryParams ? RemoteRequest.ofQuery(params) : RemoteRequest.ofBody(params);
    var response = executor.execute(operation, request);
    return ResponseClassifier.handleApiResponse(response, operation, FETCH_ERROR_MESSAGE);
  }

  public SearchOutcome searchThenFetch(SearchSpec spec, SearchParams params) {
    return searchThenFetch(spec, params, Map.of());
  }

  public SearchOutcome searchThenFetch(
      SearchSpec spec, SearchParams params, Map<String, Object> fetchExtras) {
    var ids = search(spec.searchOperation(), params, spec.searchErrorMessage());

    if (ids.isError()) {
      if (spec.fqlGuide() == null) {
        return new SearchOutcome.Failed(ids.error());
      }
      return new SearchOutcome.Guided(
          FqlGuidance.forError(ids.error().toMap(), params.filter(), spec.fqlGuide()));
    }

    List<Object> found = ids.resources();
    if (found.isEmpty()) {
      if (spec.fqlGuide() == null) {
        return new SearchOutcome.Found(List.of());
      }
      return new SearchOutcome.Guided(FqlGuidance.forEmpty(params.filter(), spec.fqlGuide()));
    }

    log.debug("{} resolved {} identifiers", spec.searchOperation(), found.size());
    var fetch = spec.fetch(found, fetchExtras);
    var details =
        getByIds(
            fetch.operation(),
            fetch.ids(),
            fetch.idField(),
            fetch.useQueryParams(),
            fetch.extras());
    if (details.isError()) {
      return new SearchOutcome.Failed(details.error());
    }
    return new SearchOutcome.Found(details.resources());
  }
}
