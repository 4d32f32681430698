package com.staybooking.payment.gateway.filter;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Logs one line per HTTP request with method, path, status and latency.
 *
 * <p>A correlation id is kept in the SLF4J MDC for the lifetime of the request. An inbound
 * {@code X-Request-Id} from the booking front end is reused so checkout logs line up across
 * services; gateway callbacks get a fresh id. Query strings are not logged since callback
 * redirects carry trade data. The MDC is always cleared in a {@code finally} block.
 */
@Component
public class RequestLoggingFilter extends OncePerRequestFilter {

  public static final String REQUEST_ID_HEADER = "X-Request-Id";

  private static final Logger LOG = LoggerFactory.getLogger(RequestLoggingFilter.class);

  @Override
  protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response,
      FilterChain filterChain) throws ServletException, IOException {
    String correlationId = request.getHeader(REQUEST_ID_HEADER);
    if (correlationId == null || correlationId.isBlank() || correlationId.length() > 64) {
      correlationId = UUID.randomUUID().toString();
    }
    MDC.put("correlationId", correlationId);
    MDC.put("httpMethod", request.getMethod());
    MDC.put("httpPath", request.getRequestURI());
    response.setHeader(REQUEST_ID_HEADER, correlationId);

    long startTime = System.currentTimeMillis();
    try {
      filterChain.doFilter(request, response);
    } finally {
      long duration = System.currentTimeMillis() - startTime;
      MDC.put("httpStatus", String.valueOf(response.getStatus()));
      MDC.put("durationMs", String.valueOf(duration));

      LOG.info("{} {} {} {}ms",
          request.getMethod(),
          request.getRequestURI(),
          response.getStatus(),
          duration);

      MDC.clear();
    }
  }
}
