package io.b2mash.secops.bridge.tool;

import java.util.Set;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Settings of the tool surface.
 *
 * @param apiKey expected {@code X-API-KEY} header value; blank leaves the API unauthenticated
 * @param enabledModules module names to expose; empty exposes every module
 * @param toolPrefix prefix added to every tool name
 */
@ConfigurationProperties(prefix = "secops.bridge")
public record BridgeProperties(
    String apiKey,
    @DefaultValue Set<String> enabledModules,
    @DefaultValue("falcon_") String toolPrefix) {

  public boolean apiKeyRequired() {
    return apiKey != null && !apiKey.isBlank();
  }

  public boolean isEnabled(String module) {
    return enabledModules.isEmpty() || enabledModules.contains(module);
  }
}
