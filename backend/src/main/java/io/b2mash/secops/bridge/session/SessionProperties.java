package io.b2mash.secops.bridge.session;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * @param store {@code memory} (single instance) or {@code redis} (shared)
 * @param idleTimeout sessions idle longer than this are dropped
 */
@ConfigurationProperties(prefix = "secops.session")
public record SessionProperties(
    @DefaultValue("memory") String store, @DefaultValue("30m") Duration idleTimeout) {}
