package io.b2mash.secops.bridge.ngsiem;

import io.b2mash.secops.bridge.remote.Parameters;
import io.b2mash.secops.bridge.remote.RemoteCommandExecutor;
import io.b2mash.secops.bridge.remote.RemoteRequest;
import io.b2mash.secops.bridge.response.ApiResult;
import io.b2mash.secops.bridge.response.OperationError;
import io.b2mash.secops.bridge.response.ResponseClassifier;
import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Runs a SIEM query through the job-based search API: submit, poll until done, and stop the job
 * when the polling budget runs out.
 *
 * <p>State lives on the call stack, so concurrent searches share nothing but the executor. Status
 * checks for one job are strictly sequential. The first failed status check ends the search; there
 * is no retry and no cleanup on that path.
 */
@Service
public class AsyncSearchPoller {

  private static final Logger log = LoggerFactory.getLogger(AsyncSearchPoller.class);

  static final String START_OPERATION = "StartSearchV1";
  static final String STATUS_OPERATION = "GetSearchStatusV1";
  static final String STOP_OPERATION = "StopSearchV1";

  private final RemoteCommandExecutor executor;
  private final PollSleeper sleeper;
  private final int pollIntervalSeconds;
  private final int timeoutSeconds;

  public AsyncSearchPoller(
      RemoteCommandExecutor executor, AsyncSearchProperties properties, PollSleeper sleeper) {
    this.executor = executor;
    this.sleeper = sleeper;
    this.pollIntervalSeconds = properties.pollIntervalSeconds();
    this.timeoutSeconds = properties.timeoutSeconds();
  }

  /**
   * Executes {@code query} against {@code repository} between {@code start} and {@code end} (ISO
   * 8601). A null {@code end} is left to the platform, which defaults it to now.
   *
   * @return the job's events on success (possibly empty), otherwise the error
   */
  public ApiResult runAsyncSearch(String query, String start, String end, String repository) {
    long startMs;
    Long endMs;
    try {
      startMs = IsoTimestamps.toEpochMillis(start);
      endMs = end != null ? IsoTimestamps.toEpochMillis(end) : null;
    } catch (DateTimeParseException e) {
      log.warn("Rejected NGSIEM search with invalid timestamp: {}", e.getParsedString());
      return ApiResult.failure(
          OperationError.of(
              "Invalid ISO 8601 timestamp: " + e.getParsedString(), null, START_OPERATION));
    }

    var job = submit(query, startMs, endMs, repository);
    if (job.isError()) {
      return ApiResult.failure(job.error());
    }
    return poll(job.job());
  }

  private Submission submit(String query, long startMs, Long endMs, String repository) {
    log.debug("Starting NGSIEM search with query: {}", query);
    var request =
        RemoteRequest.ofBody(Parameters.of("queryString", query, "start", startMs, "end", endMs))
            .withPath(Map.of("repository", repository));
    var response = executor.execute(START_OPERATION, request);

    if (!ResponseClassifier.isSuccess(response)) {
      return Submission.failed(
          ResponseClassifier.toError(
              response, START_OPERATION, "Failed to start NGSIEM search"));
    }

    Object id = response.bodyOrEmpty().get("id");
    if (!(id instanceof String jobId) || jobId.isBlank()) {
      log.error("NGSIEM search started without a job ID");
      return Submission.failed(
          OperationError.of(
              "Failed to start NGSIEM search: no job ID returned",
              response.bodyOrEmpty(),
              START_OPERATION));
    }

    log.debug("NGSIEM search job started: {}", jobId);
    return Submission.started(new SearchJob(jobId, repository, query, startMs, endMs));
  }

  private ApiResult poll(SearchJob job) {
    var interval = Duration.ofSeconds(pollIntervalSeconds);
    var statusRequest =
        RemoteRequest.empty()
            .withPath(Map.of("repository", job.repository(), "search_id", job.id()));

    while (job.elapsedSeconds() < timeoutSeconds) {
      sleeper.sleep(interval);
      job.advance(pollIntervalSeconds);

      var response = executor.execute(STATUS_OPERATION, statusRequest);
      if (!ResponseClassifier.isSuccess(response)) {
        return ApiResult.failure(
            ResponseClassifier.toError(
                response, STATUS_OPERATION, "Failed to poll NGSIEM search status"));
      }

      var body = response.bodyOrEmpty();
      if (Boolean.TRUE.equals(body.get("done"))) {
        log.debug("NGSIEM search job completed: {} after {}s", job.id(), job.elapsedSeconds());
        return ApiResult.success(body.get("events") instanceof List<?> events ? events : List.of());
      }
      log.debug("NGSIEM search job {} still running after {}s", job.id(), job.elapsedSeconds());
    }

    log.warn("NGSIEM search job timed out: {}", job.id());
    stopJob(job);

    var details = new LinkedHashMap<String, Object>();
    details.put("job_id", job.id());
    details.put("timeout_seconds", timeoutSeconds);
    return ApiResult.failure(
        OperationError.of(
            "NGSIEM search timed out after "
                + timeoutSeconds
                + " seconds. Try narrowing your query or reducing the time range.",
            details,
            STATUS_OPERATION));
  }

  /** Asks the platform to stop the job. Never fails the caller; the job expires remotely anyway. */
  private void stopJob(SearchJob job) {
    BestEffort.run(
        "stop of NGSIEM search job " + job.id(),
        () -> {
          var response =
              executor.execute(
                  STOP_OPERATION,
                  RemoteRequest.empty()
                      .withPath(Map.of("repository", job.repository(), "id", job.id())));
          if (!ResponseClassifier.isSuccess(response)) {
            log.warn(
                "StopSearchV1 for job {} returned status {}", job.id(), response.statusCode());
          }
        });
  }

  private record Submission(SearchJob job, OperationError error) {

    static Submission started(SearchJob job) {
      return new Submission(job, null);
    }

    static Submission failed(OperationError error) {
      return new Submission(null, error);
    }

    boolean isError() {
      return error != null;
    }
  }
}
