package io.b2mash.secops.bridge.ngsiem;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Polling behaviour of asynchronous SIEM searches. Bound once at startup; changing either value
 * requires a restart.
 *
 * @param pollIntervalSeconds pause before each status check
 * @param timeoutSeconds total polling budget before the job is stopped
 */
@ConfigurationProperties(prefix = "secops.ngsiem")
public record AsyncSearchProperties(
    @DefaultValue("5") int pollIntervalSeconds, @DefaultValue("300") int timeoutSeconds) {

  public AsyncSearchProperties {
    if (pollIntervalSeconds < 1) {
      throw new IllegalArgumentException("secops.ngsiem.poll-interval-seconds must be at least 1");
    }
    if (timeoutSeconds < 0) {
      throw new IllegalArgumentException("secops.ngsiem.timeout-seconds must not be negative");
    }
  }
}
