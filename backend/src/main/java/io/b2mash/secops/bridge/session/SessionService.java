package io.b2mash.secops.bridge.session;

import java.time.Clock;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

@Service
public class SessionService {

  private static final Logger log = LoggerFactory.getLogger(SessionService.class);

  private final SessionStore store;
  private final Clock clock;

  @Autowired
  public SessionService(SessionStore store) {
    this(store, Clock.systemUTC());
  }

  SessionService(SessionStore store, Clock clock) {
    this.store = store;
    this.clock = clock;
  }

  /** Records a tool call for the session, creating it on first use. */
  public ToolSession recordCall(String sessionId) {
    var session = store.recordCall(sessionId, clock.instant());
    log.debug("Session {} has made {} tool calls", sessionId, session.toolCalls());
    return session;
  }

  public Optional<ToolSession> find(String sessionId) {
    return store.get(sessionId);
  }

  public boolean end(String sessionId) {
    var removed = store.delete(sessionId);
    if (removed) {
      log.debug("Ended session {}", sessionId);
    }
    return removed;
  }
}
