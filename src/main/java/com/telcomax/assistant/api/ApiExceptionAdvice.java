package com.telcomax.assistant.api;

import jakarta.servlet.http.HttpServletRequest;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps request validation failures (blank question, unknown strategy) to a JSON 400.
 */
@RestControllerAdvice(annotations = RestController.class)
public class ApiExceptionAdvice {

  private static final Logger log = LoggerFactory.getLogger(ApiExceptionAdvice.class);

  @ExceptionHandler(IllegalArgumentException.class)
  public ResponseEntity<Map<String, Object>> handleBadRequest(
      IllegalArgumentException ex,
      HttpServletRequest request) {
    log.info("Rejected request path={} reason={}", request.getRequestURI(), ex.getMessage());
    HttpStatus status = HttpStatus.BAD_REQUEST;
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("timestamp", Instant.now().toString());
    body.put("status", status.value());
    body.put("error", "bad_request");
    body.put("message", ex.getMessage());
    body.put("path", request.getRequestURI());
    body.put("requestId", MDC.get("requestId"));
    return ResponseEntity.status(status).body(body);
  }
}
