package io.b2mash.secops.bridge.module;

import io.b2mash.secops.bridge.ngsiem.AsyncSearchPoller;
import io.b2mash.secops.bridge.remote.RemoteCommandExecutor;
import io.b2mash.secops.bridge.search.SearchResolveEngine;
import io.b2mash.secops.bridge.tool.ToolArguments;
import io.b2mash.secops.bridge.tool.ToolModuleComponent;
import io.b2mash.secops.bridge.tool.ToolRegistrar;
import java.util.List;
import org.springframework.stereotype.Component;

/** Runs caller-supplied CQL queries against Next-Gen SIEM. Query construction is not offered. */
@Component
@ToolModuleComponent(name = "ngsiem")
public class NgSiemModule extends FalconModule {

  static final String DEFAULT_REPOSITORY = "search-all";

  static final List<String> REPOSITORIES =
      List.of(
          "search-all", "investigate_view", "third-party", "falcon_for_it_view", "forensics_view");

  private final AsyncSearchPoller poller;

  public NgSiemModule(
      RemoteCommandExecutor executor, SearchResolveEngine searchEngine, AsyncSearchPoller poller) {
    super(executor, searchEngine);
    this.poller = poller;
  }

  @Override
  public void registerTools(ToolRegistrar registrar) {
    registrar.addTool(
        "search_ngsiem",
        "Execute a complete, pre-written CQL query against CrowdStrike Next-Gen SIEM and return"
            + " the matching events. start and end are ISO 8601 timestamps; end defaults to now."
            + " The search times out after the configured limit (default 300 seconds).",
        this::searchNgSiem);
  }

  Object searchNgSiem(ToolArguments args) {
    var queryString = args.requiredString("query_string");
    var start = args.requiredString("start");
    var end = args.optionalString("end");
    var repository = args.oneOf("repository", DEFAULT_REPOSITORY, REPOSITORIES);
    return poller.runAsyncSearch(queryString, start, end, repository).toToolOutput();
  }
}
