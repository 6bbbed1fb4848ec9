package io.b2mash.secops.bridge.remote;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * Connection settings for the Falcon API.
 *
 * @param baseUrl API root, e.g. {@code https://api.us-2.crowdstrike.com}
 * @param apiToken bearer token sent on every request; obtaining and refreshing it happens outside
 *     this service
 * @param userAgent value of the User-Agent header
 */
@Validated
@ConfigurationProperties(prefix = "secops.falcon")
public record FalconApiProperties(
    @NotBlank @DefaultValue("https://api.crowdstrike.com") String baseUrl,
    String apiToken,
    @DefaultValue("secops-mcp-bridge") String userAgent) {}
