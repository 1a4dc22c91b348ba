package com.scholary.transcriber.config;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.UUID;
import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Adds request-scoped values to the MDC for structured logging.
 *
 * <p>{@code requestId} comes from the X-Request-ID header or is generated, and is echoed back on
 * the response. The context is cleared after every request.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class RequestMdcFilter extends OncePerRequestFilter {

  static final String REQUEST_ID_HEADER = "X-Request-ID";

  @Override
  protected void doFilterInternal(
      HttpServletRequest request, HttpServletResponse response, FilterChain chain)
      throws ServletException, IOException {
    String requestId = request.getHeader(REQUEST_ID_HEADER);
    if (requestId == null || requestId.isBlank()) {
      requestId = UUID.randomUUID().toString();
    }
    try {
      MDC.put("requestId", requestId);
      MDC.put("method", request.getMethod());
      MDC.put("uri", request.getRequestURI());
      response.setHeader(REQUEST_ID_HEADER, requestId);
      chain.doFilter(request, response);
    } finally {
      MDC.remove("requestId");
      MDC.remove("method");
      MDC.remove("uri");
    }
  }
}
