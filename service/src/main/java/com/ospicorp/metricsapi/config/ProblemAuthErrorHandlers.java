package com.ospicorp.metricsapi.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.security.core.AuthenticationException;
import org.springframework.security.web.AuthenticationEntryPoint;
import org.springframework.security.web.access.AccessDeniedHandler;
import org.springframework.stereotype.Component;

/**
 * Writes 401 and 403 responses raised inside the security filter chain in the same problem
 * shape {@link ApiExceptionHandler} uses for controller errors.
 */
@Component
public class ProblemAuthErrorHandlers implements AuthenticationEntryPoint, AccessDeniedHandler {

  private static final Logger log = LoggerFactory.getLogger(ProblemAuthErrorHandlers.class);

  private final ObjectMapper objectMapper;

  public ProblemAuthErrorHandlers(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  @Override
  public void commence(HttpServletRequest request, HttpServletResponse response,
      AuthenticationException authException) throws IOException {
    response.setHeader(HttpHeaders.WWW_AUTHENTICATE, "Bearer");
    writeProblem(request, response, HttpStatus.UNAUTHORIZED, "unauthorized", authException);
  }

  @Override
  public void handle(HttpServletRequest request, HttpServletResponse response,
      AccessDeniedException accessDeniedException) throws IOException {
    writeProblem(request, response, HttpStatus.FORBIDDEN, "forbidden", accessDeniedException);
  }

  private void writeProblem(HttpServletRequest request, HttpServletResponse response,
      HttpStatus status, String slug, Exception ex) throws IOException {
    if (response.isCommitted()) {
      return;
    }
    log.warn("Request {} {} from {} rejected with status {}: {}",
        request.getMethod(),
        HttpRequests.uriWithQuery(request),
        HttpRequests.clientIp(request),
        status.value(),
        ex.getMessage());

    Map<String, Object> body = new LinkedHashMap<>();
    body.put("type", ApiExceptionHandler.PROBLEM_TYPE_BASE + slug);
    body.put("title", status.getReasonPhrase());
    body.put("status", status.value());
    body.put("detail", ex.getMessage());
    body.put("instance", request.getRequestURI());
    body.put("path", request.getRequestURI());

    response.setStatus(status.value());
    response.setContentType(MediaType.APPLICATION_PROBLEM_JSON_VALUE);
    objectMapper.writeValue(response.getOutputStream(), body);
  }
}
