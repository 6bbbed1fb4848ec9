package io.b2mash.secops.bridge.ngsiem;

/**
 * In-flight search job. Lives only for the duration of one {@link AsyncSearchPoller#runAsyncSearch}
 * call; nothing about it is persisted.
 */
final class SearchJob {

  private final String id;
  private final String repository;
  private final String query;
  private final long startMs;
  private final Long endMs;
  private double elapsedSeconds;

  SearchJob(String id, String repository, String query, long startMs, Long endMs) {
    this.id = id;
    this.repository = repository;
    this.query = query;
    this.startMs = startMs;
    this.endMs = endMs;
  }

  String id() {
    return id;
  }

  String repository() {
    return repository;
  }

  String query() {
    return query;
  }

  long startMs() {
    return startMs;
  }

  Long endMs() {
    return endMs;
  }

  double elapsedSeconds() {
    return elapsedSeconds;
  }

  /** Accounts one poll interval. Elapsed time never decreases. */
  void advance(double seconds) {
    if (seconds < 0) {
      throw new IllegalArgumentException("Elapsed time cannot go backwards");
    }
    elapsedSeconds += seconds;
  }
}
