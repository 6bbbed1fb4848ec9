package io.b2mash.secops.bridge.security;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.UUID;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

@Component
public class RequestLoggingFilter extends OncePerRequestFilter {

  static final String SESSION_HEADER = "Mcp-Session-Id";

  private static final String MDC_REQUEST_ID = "requestId";
  private static final String MDC_SESSION_ID = "sessionId";

  @Override
  protected void doFilterInternal(
      HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
      throws ServletException, IOException {
    try {
      MDC.put(MDC_REQUEST_ID, UUID.randomUUID().toString());

      String sessionId = request.getHeader(SESSION_HEADER);
      if (sessionId != null && !sessionId.isBlank()) {
        MDC.put(MDC_SESSION_ID, sessionId);
      }

      filterChain.doFilter(request, response);
    } finally {
      MDC.remove(MDC_SESSION_ID);
      MDC.remove(MDC_REQUEST_ID);
    }
  }
}
