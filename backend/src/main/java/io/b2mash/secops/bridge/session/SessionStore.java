package io.b2mash.secops.bridge.session;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Storage for agent sessions. Exactly one implementation is active, chosen by {@code
 * secops.session.store}.
 */
public interface SessionStore {

  Optional<ToolSession> get(String sessionId);

  void set(ToolSession session);

  /**
   * Atomically counts one tool call for the session, creating it on first use. Concurrent calls
   * under the same id are never lost.
   *
   * @return the session after the update
   */
  ToolSession recordCall(String sessionId, Instant now);

  /** Returns true if a session was removed. */
  boolean delete(String sessionId);

  /**
   * Removes sessions idle for longer than {@code maxIdle}.
   *
   * @return number of sessions removed
   */
  int sweepExpired(Duration maxIdle);
}
