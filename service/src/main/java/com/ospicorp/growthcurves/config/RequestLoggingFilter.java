package com.ospicorp.growthcurves.config;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * One INFO line per request with status and duration. Smoothing and band requests can take
 * seconds, so the duration is what operators look at. A request id is put in the MDC for the
 * lines logged while the request runs.
 */
@Component
public class RequestLoggingFilter extends OncePerRequestFilter {

  private static final Logger log = LoggerFactory.getLogger(RequestLoggingFilter.class);
  static final String REQUEST_ID = "requestId";

  @Override
  protected void doFilterInternal(@NonNull HttpServletRequest request,
      @NonNull HttpServletResponse response, @NonNull FilterChain filterChain)
      throws ServletException, IOException {
    long startTime = System.nanoTime();
    MDC.put(REQUEST_ID, UUID.randomUUID().toString().substring(0, 8));
    try {
      filterChain.doFilter(request, response);
    } finally {
      long durationMs = (System.nanoTime() - startTime) / 1_000_000L;
      log.info("HTTP {} {} -> {} ({} ms)",
          request.getMethod(),
          uriWithQuery(request),
          response.getStatus(),
          durationMs);
      MDC.remove(REQUEST_ID);
    }
  }

  static String uriWithQuery(HttpServletRequest request) {
    String queryString = request.getQueryString();
    if (queryString == null || queryString.isBlank()) {
      return request.getRequestURI();
    }
    return request.getRequestURI() + "?" + queryString;
  }
}
