package io.b2mash.secops.bridge.module;

import io.b2mash.secops.bridge.remote.Parameters;
import io.b2mash.secops.bridge.remote.RemoteCommandExecutor;
import io.b2mash.secops.bridge.remote.RemoteRequest;
import io.b2mash.secops.bridge.response.ResourceExtractor;
import io.b2mash.secops.bridge.response.ResponseClassifier;
import io.b2mash.secops.bridge.search.SearchParams;
import io.b2mash.secops.bridge.search.SearchResolveEngine;
import io.b2mash.secops.bridge.search.SearchSpec;
import io.b2mash.secops.bridge.tool.ToolArguments;
import io.b2mash.secops.bridge.tool.ToolModuleComponent;
import io.b2mash.secops.bridge.tool.ToolRegistrar;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Scheduled reports and searches, and their executions.
 *
 * <p>These searches carry no filter guidance in their results; a failed search returns the error
 * in a list and an empty search returns an empty list. The guides are still published as
 * resources.
 */
@Component
@ToolModuleComponent(name = "scheduled_reports")
public class ScheduledReportsModule extends FalconModule {

  static final String REPORTS_QUERY = "scheduled_reports_query";
  static final String REPORTS_GET = "scheduled_reports_get";
  static final String REPORTS_LAUNCH = "scheduled_reports_launch";
  static final String EXECUTIONS_QUERY = "report_executions_query";
  static final String EXECUTIONS_GET = "report_executions_get";
  static final String EXECUTIONS_DOWNLOAD = "report_executions_download_get";

  static final String PDF_NOT_SUPPORTED =
      "PDF format not supported for LLM consumption. "
          + "Please configure the scheduled report to use CSV or JSON format instead.";

  private static final byte[] PDF_MAGIC = "%PDF".getBytes(StandardCharsets.US_ASCII);

  private static final SearchSpec REPORTS_SPEC =
      new SearchSpec(
          REPORTS_QUERY, "Failed to search for scheduled reports", REPORTS_GET, "ids", true, null);

  private static final SearchSpec EXECUTIONS_SPEC =
      new SearchSpec(
          EXECUTIONS_QUERY,
          "Failed to search for report executions",
          EXECUTIONS_GET,
          "ids",
          true,
          null);

  private final String reportsGuide;
  private final String executionsGuide;

  public ScheduledReportsModule(RemoteCommandExecutor executor, SearchResolveEngine searchEngine) {
    super(executor, searchEngine);
    this.reportsGuide = FqlGuides.load("scheduled-reports");
    this.executionsGuide = FqlGuides.load("report-executions");
  }

  @Override
  public void registerTools(ToolRegistrar registrar) {
    registrar.addTool(
        "search_scheduled_reports",
        "Search for scheduled reports and searches and return their full details. Use"
            + " filter=id:'<id>' to fetch specific entities.",
        this::searchScheduledReports);
    registrar.addTool(
        "launch_scheduled_report",
        "Launch a scheduled report or search on demand. Returns the execution, whose ID can be"
            + " used with falcon_search_report_executions and falcon_download_report_execution.",
        this::launchScheduledReport);
    registrar.addTool(
        "search_report_executions",
        "Search for scheduled report and search executions and return their full details.",
        this::searchReportExecutions);
    registrar.addTool(
        "download_report_execution",
        "Download the results of a completed (status DONE) execution. CSV reports are returned"
            + " as text, JSON reports as a list of records. PDF reports are not supported.",
        this::downloadReportExecution);
  }

  @Override
  public void registerResources(ToolRegistrar registrar) {
    addFqlGuide(
        registrar,
        "falcon://scheduled-reports/search/fql-guide",
        "search_scheduled_reports",
        reportsGuide);
    addFqlGuide(
        registrar,
        "falcon://scheduled-reports/executions/search/fql-guide",
        "search_report_executions",
        executionsGuide);
  }

  Object searchScheduledReports(ToolArguments args) {
    var params =
        SearchParams.of(
            args.optionalString("filter"),
            args.intInRange("limit", 10, 1, 5000),
            args.optionalInt("offset"),
            args.optionalString("q"),
            args.optionalString("sort"));
    return searchEngine.searchThenFetch(REPORTS_SPEC, params).toToolOutput();
  }

  Object launchScheduledReport(ToolArguments args) {
    var id = args.requiredString("id");
    return query(REPORTS_LAUNCH, null, Map.of("id", id), "Failed to launch scheduled report")
        .toListOutput();
  }

  Object searchReportExecutions(ToolArguments args) {
    var params =
        SearchParams.of(
            args.optionalString("filter"),
            args.intInRange("limit", 10, 1, 5000),
            args.optionalInt("offset"),
            null,
            args.optionalString("sort"));
    return searchEngine.searchThenFetch(EXECUTIONS_SPEC, params).toToolOutput();
  }

  /** CSV text, a list of JSON records, or an error object. */
  Object downloadReportExecution(ToolArguments args) {
    var id = args.requiredString("id");
    var response =
        executor.execute(EXECUTIONS_DOWNLOAD, RemoteRequest.ofQuery(Parameters.of("ids", id)));

    if (!ResponseClassifier.isSuccess(response)) {
      return ResponseClassifier.toError(
              response, EXECUTIONS_DOWNLOAD, "Failed to download report execution")
          .toMap();
    }
    if (response.isBinary()) {
      if (isPdf(response.content())) {
        return Map.of("error", PDF_NOT_SUPPORTED);
      }
      return new String(response.content(), StandardCharsets.UTF_8);
    }
    return ResourceExtractor.extractResources(response);
  }

  private static boolean isPdf(byte[] content) {
    return content.length >= PDF_MAGIC.length
        && Arrays.equals(Arrays.copyOf(content, PDF_MAGIC.length), PDF_MAGIC);
  }
}
