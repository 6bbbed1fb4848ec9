package io.b2mash.secops.bridge.module;

import io.b2mash.secops.bridge.remote.Parameters;
import io.b2mash.secops.bridge.remote.RemoteCommandExecutor;
import io.b2mash.secops.bridge.remote.RemoteRequest;
import io.b2mash.secops.bridge.remote.RemoteResponse;
import io.b2mash.secops.bridge.response.ApiResult;
import io.b2mash.secops.bridge.response.ResponseClassifier;
import io.b2mash.secops.bridge.search.SearchResolveEngine;
import io.b2mash.secops.bridge.tool.ToolModule;
import io.b2mash.secops.bridge.tool.ToolRegistrar;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Base class for modules backed by the Falcon API. */
public abstract class FalconModule implements ToolModule {

  private static final Logger log = LoggerFactory.getLogger(FalconModule.class);

  protected final RemoteCommandExecutor executor;
  protected final SearchResolveEngine searchEngine;

  protected FalconModule(RemoteCommandExecutor executor, SearchResolveEngine searchEngine) {
    this.executor = executor;
    this.searchEngine = searchEngine;
  }

  /**
   * One call carrying query parameters, a JSON body or both. Null or empty maps are not sent.
   * Classification follows the operation's response kind.
   */
  protected ApiResult query(
      String operation,
      Map<String, ?> queryParams,
      Map<String, ?> bodyParams,
      String errorMessage) {
    var body = bodyParams == null || bodyParams.isEmpty() ? null : Parameters.prepare(bodyParams);
    var request = new RemoteRequest(null, Parameters.prepare(queryParams), body);
    log.debug("Executing {} with query={} body={}", operation, request.queryParams(), body);
    var response = executor.execute(operation, request);
    return ResponseClassifier.handleApiResponse(response, operation, errorMessage);
  }

  /**
   * GET that may answer with a file. Binary content is decoded as UTF-8 text; JSON answers are
   * classified as usual.
   */
  protected Object download(String operation, Map<String, ?> params, String errorMessage) {
    RemoteResponse response = executor.execute(operation, RemoteRequest.ofQuery(params));
    if (response.isBinary() && ResponseClassifier.isSuccess(response)) {
      return new String(response.content(), StandardCharsets.UTF_8);
    }
    return ResponseClassifier.handleApiResponse(response, operation, errorMessage).toListOutput();
  }

  /** Publishes a filter guide as a resource named after the tool it documents. */
  protected static void addFqlGuide(
      ToolRegistrar registrar, String uri, String toolName, String guide) {
    registrar.addResource(
        uri,
        toolName + "_fql_guide",
        "Contains the guide for the `filter` param of the `falcon_" + toolName + "` tool.",
        guide);
  }
}
