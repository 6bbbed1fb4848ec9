package io.b2mash.secops.bridge.ngsiem;

import java.time.Duration;

/** The pause between status checks. Injected so tests do not sleep. */
@FunctionalInterface
public interface PollSleeper {

  void sleep(Duration duration);
}
