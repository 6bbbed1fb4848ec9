package io.b2mash.secops.bridge.module;

import io.b2mash.secops.bridge.remote.RemoteCommandExecutor;
import io.b2mash.secops.bridge.search.SearchParams;
import io.b2mash.secops.bridge.search.SearchResolveEngine;
import io.b2mash.secops.bridge.search.SearchSpec;
import io.b2mash.secops.bridge.tool.ToolArguments;
import io.b2mash.secops.bridge.tool.ToolModuleComponent;
import io.b2mash.secops.bridge.tool.ToolRegistrar;
import java.util.Map;
import org.springframework.stereotype.Component;

@Component
@ToolModuleComponent(name = "hosts")
public class HostsModule extends FalconModule {

  static final String SEARCH_OPERATION = "QueryDevicesByFilter";
  static final String DETAILS_OPERATION = "PostDeviceDetailsV2";

  private final String fqlGuide;
  private final SearchSpec searchSpec;

  public HostsModule(RemoteCommandExecutor executor, SearchResolveEngine searchEngine) {
    super(executor, searchEngine);
    this.fqlGuide = FqlGuides.load("hosts");
    this.searchSpec =
        new SearchSpec(
            SEARCH_OPERATION, "Failed to search hosts", DETAILS_OPERATION, "ids", false, fqlGuide);
  }

  @Override
  public void registerTools(ToolRegistrar registrar) {
    registrar.addTool(
        "search_hosts",
        "Search for hosts (devices) by platform, hostname, status or other criteria and return"
            + " their full details.",
        this::searchHosts);
    registrar.addTool(
        "get_host_details",
        "Retrieve details for device IDs you already have.",
        this::getHostDetails);
  }

  @Override
  public void registerResources(ToolRegistrar registrar) {
    addFqlGuide(registrar, "falcon://hosts/search/fql-guide", "search_hosts", fqlGuide);
  }

  Object searchHosts(ToolArguments args) {
    var params =
        SearchParams.of(
            args.optionalString("filter"),
            args.intInRange("limit", 10, 1, 5000),
            args.optionalInt("offset"),
            null,
            args.optionalString("sort"));
    return searchEngine.searchThenFetch(searchSpec, params).toToolOutput();
  }

  Object getHostDetails(ToolArguments args) {
    return searchEngine
        .getByIds(DETAILS_OPERATION, args.requiredStringList("ids"), "ids", false, Map.of())
        .toToolOutput();
  }
}
