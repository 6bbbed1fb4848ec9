package io.b2mash.secops.bridge.session;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/** Process-local session store for single-instance deployments. */
@Component
@ConditionalOnProperty(name = "secops.session.store", havingValue = "memory", matchIfMissing = true)
public class InMemorySessionStore implements SessionStore {

  private static final Logger log = LoggerFactory.getLogger(InMemorySessionStore.class);

  private final ConcurrentMap<String, ToolSession> sessions = new ConcurrentHashMap<>();
  private final Clock clock;

  public InMemorySessionStore() {
    this(Clock.systemUTC());
  }

  /** Package-private constructor for testing with a fixed clock. */
  InMemorySessionStore(Clock clock) {
    this.clock = clock;
    log.info("Initialized in-memory session store (single-instance mode)");
  }

  @Override
  public Optional<ToolSession> get(String sessionId) {
    return Optional.ofNullable(sessions.get(sessionId));
  }

  @Override
  public void set(ToolSession session) {
    sessions.put(session.id(), session);
  }

  @Override
  public ToolSession recordCall(String sessionId, Instant now) {
    return sessions.compute(
        sessionId,
        (id, current) -> (current != null ? current : ToolSession.start(id, now)).recordCall(now));
  }

  @Override
  public boolean delete(String sessionId) {
    return sessions.remove(sessionId) != null;
  }

  @Override
  public int sweepExpired(Duration maxIdle) {
    var cutoff = clock.instant().minus(maxIdle);
    int removed = 0;
    for (var entry : sessions.entrySet()) {
      if (entry.getValue().lastActivity().isBefore(cutoff)
          && sessions.remove(entry.getKey(), entry.getValue())) {
        removed++;
      }
    }
    if (removed > 0) {
      log.info("Cleaned up {} expired sessions", removed);
    }
    return removed;
  }

  int size() {
    return sessions.size();
  }
}
