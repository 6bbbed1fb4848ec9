package io.b2mash.secops.bridge.ngsiem;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs cleanup calls whose failure must not affect the caller's result. Failures are logged at
 * warn and dropped; nothing is returned.
 */
final class BestEffort {

  private static final Logger log = LoggerFactory.getLogger(BestEffort.class);

  private BestEffort() {}

  static void run(String description, Runnable action) {
    try {
      action.run();
    } catch (RuntimeException e) {
      log.warn("Best-effort {} failed: {}", description, e.getMessage());
    }
  }
}
