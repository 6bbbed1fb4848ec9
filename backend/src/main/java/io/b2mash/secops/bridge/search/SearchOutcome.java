package io.b2mash.secops.bridge.search;

import io.b2mash.secops.bridge.response.OperationError;
import java.util.List;

/** Result of a two-step search. */
public sealed interface SearchOutcome
    permits SearchOutcome.Found, SearchOutcome.Guided, SearchOutcome.Failed {

  /** JSON-ready value for tool callers. */
  Object toToolOutput();

  /** Detail records exactly as the fetch operation returned them. */
  record Found(List<Object> records) implements SearchOutcome {
    @Override
    public Object toToolOutput() {
      return records;
    }
  }

  /** Search-side error or empty result, paired with the filter guide. */
  record Guided(FqlGuidance guidance) implements SearchOutcome {
    @Override
    public Object toToolOutput() {
      return guidance.toMap();
    }
  }

  /** Error without filter guidance: fetch failures, or searches that carry no guide. */
  record Failed(OperationError error) implements SearchOutcome {
    @Override
    public Object toToolOutput() {
      return List.of(error.toMap());
    }
  }
}
