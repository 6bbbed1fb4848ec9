package io.b2mash.secops.bridge.session;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/** Drops idle sessions from stores that do not expire keys on their own. */
@Component
public class SessionSweepJob {

  private static final Logger log = LoggerFactory.getLogger(SessionSweepJob.class);

  private final SessionStore store;
  private final SessionProperties properties;

  public SessionSweepJob(SessionStore store, SessionProperties properties) {
    this.store = store;
    this.properties = properties;
  }

  @Scheduled(fixedRateString = "${secops.session.sweep-interval-ms:300000}")
  public void sweep() {
    int removed = store.sweepExpired(properties.idleTimeout());
    log.debug("Session sweep removed {} sessions", removed);
  }
}
