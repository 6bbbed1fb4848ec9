package io.b2mash.secops.bridge.security;

import io.b2mash.secops.bridge.tool.BridgeProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configuration.EnableWebSecurity;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.authentication.AnonymousAuthenticationFilter;

@Configuration
@EnableWebSecurity
public class SecurityConfig {

  private final ApiKeyAuthFilter apiKeyAuthFilter;
  private final RequestLoggingFilter requestLoggingFilter;
  private final BridgeProperties properties;

  public SecurityConfig(
      ApiKeyAuthFilter apiKeyAuthFilter,
      RequestLoggingFilter requestLoggingFilter,
      BridgeProperties properties) {
    this.apiKeyAuthFilter = apiKeyAuthFilter;
    this.requestLoggingFilter = requestLoggingFilter;
    this.properties = properties;
  }

  /**
   * Single stateless chain. Tool endpoints need the API key when one is configured; health stays
   * open for probes.
   */
  @Bean
  public SecurityFilterChain securityFilterChain(HttpSecurity http) throws Exception {
    boolean apiKeyRequired = properties.apiKeyRequired();
    http.csrf(csrf -> csrf.disable())
        .sessionManagement(
            session -> session.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
        .authorizeHttpRequests(
            auth -> {
              auth.requestMatchers("/actuator/health/**", "/actuator/health").permitAll();
              if (apiKeyRequired) {
                auth.requestMatchers("/api/**").authenticated();
              } else {
                auth.requestMatchers("/api/**").permitAll();
              }
              auth.anyRequest().denyAll();
            })
        .addFilterBefore(requestLoggingFilter, AnonymousAuthenticationFilter.class)
        .addFilterBefore(apiKeyAuthFilter, AnonymousAuthenticationFilter.class);

    return http.build();
  }
}
