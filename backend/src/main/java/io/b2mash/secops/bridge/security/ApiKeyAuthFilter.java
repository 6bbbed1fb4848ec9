package io.b2mash.secops.bridge.security;

import io.b2mash.secops.bridge.tool.BridgeProperties;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.authentication.AbstractAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/** Requires a matching {@code X-API-KEY} header on {@code /api/**} when a key is configured. */
@Component
public class ApiKeyAuthFilter extends OncePerRequestFilter {

  private static final Logger log = LoggerFactory.getLogger(ApiKeyAuthFilter.class);

  static final String API_KEY_HEADER = "X-API-KEY";

  private final byte[] expectedApiKey;

  public ApiKeyAuthFilter(BridgeProperties properties) {
    this.expectedApiKey =
        properties.apiKeyRequired() ? properties.apiKey().getBytes(StandardCharsets.UTF_8) : null;
    if (expectedApiKey == null) {
      log.warn("No API key configured; /api/** is open to any caller");
    }
  }

  @Override
  protected void doFilterInternal(
      HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
      throws ServletException, IOException {
    String apiKey = request.getHeader(API_KEY_HEADER);

    if (apiKey != null
        && MessageDigest.isEqual(expectedApiKey, apiKey.getBytes(StandardCharsets.UTF_8))) {
      var auth = new ApiKeyAuthenticationToken();
      SecurityContextHolder.getContext().setAuthentication(auth);
      filterChain.doFilter(request, response);
    } else {
      log.warn("Rejected request to {} with missing or invalid API key", request.getRequestURI());
      response.sendError(HttpServletResponse.SC_UNAUTHORIZED, "Invalid API key");
    }
  }

  @Override
  protected boolean shouldNotFilter(HttpServletRequest request) {
    return expectedApiKey == null || !request.getRequestURI().startsWith("/api/");
  }

  private static class ApiKeyAuthenticationToken extends AbstractAuthenticationToken {

    ApiKeyAuthenticationToken() {
      super(List.of(new SimpleGrantedAuthority("ROLE_TOOL_CLIENT")));
      setAuthenticated(true);
    }

    @Override
    public Object getCredentials() {
      return null;
    }

    @Override
    public Object getPrincipal() {
      return "tool-client";
    }
  }
}
