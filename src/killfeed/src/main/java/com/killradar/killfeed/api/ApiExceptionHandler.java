package com.killradar.killfeed.api;

import com.killradar.killfeed.http.UpstreamUnavailableException;
import com.killradar.killfeed.stream.PushFailedException;
import com.killradar.killfeed.subscription.InvalidSystemIdsException;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.servlet.NoHandlerFoundException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

/**
 * Maps domain and backend failures to stable JSON error payloads
 * ({@code error}, {@code message}, {@code timestamp}).
 */
@RestControllerAdvice
public class ApiExceptionHandler {
  private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

  @ExceptionHandler(BadRequestException.class)
  public ResponseEntity<Map<String, Object>> handleBadRequest(BadRequestException ex) {
    return ResponseEntity.badRequest().body(error("bad_request", ex.getMessage()));
  }

  @ExceptionHandler({HttpMessageNotReadableException.class, MethodArgumentTypeMismatchException.class})
  public ResponseEntity<Map<String, Object>> handleUnreadable(Exception ex) {
    return ResponseEntity.badRequest().body(error("bad_request", "malformed request"));
  }

  /** The whole batch was rejected; the offending ids are listed. */
  @ExceptionHandler(InvalidSystemIdsException.class)
  public ResponseEntity<Map<String, Object>> handleInvalidSystemIds(InvalidSystemIdsException ex) {
    Map<String, Object> body = error(InvalidSystemIdsException.CODE, ex.getMessage());
    body.put("invalid_ids", ex.invalidIds());
    return ResponseEntity.badRequest().body(body);
  }

  @ExceptionHandler(NotFoundException.class)
  public ResponseEntity<Map<String, Object>> handleNotFound(NotFoundException ex) {
    return ResponseEntity.status(HttpStatus.NOT_FOUND).body(error("not_found", ex.getMessage()));
  }

  @ExceptionHandler({NoResourceFoundException.class, NoHandlerFoundException.class})
  public ResponseEntity<Map<String, Object>> handleMissingRoute(Exception ex) {
    return ResponseEntity.status(HttpStatus.NOT_FOUND).body(error("not_found", "resource not found"));
  }

  @ExceptionHandler(UpstreamUnavailableException.class)
  public ResponseEntity<Map<String, Object>> handleUpstream(UpstreamUnavailableException ex) {
    log.warn("Upstream unavailable: {}", ex.getMessage());
    return ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(error("upstream_unavailable", ex.getMessage()));
  }

  @ExceptionHandler(PushFailedException.class)
  public ResponseEntity<Map<String, Object>> handlePushFailed(PushFailedException ex) {
    return ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(error("push_failed", ex.getMessage()));
  }

  /** Redis access failures. */
  @ExceptionHandler(DataAccessException.class)
  public ResponseEntity<Map<String, Object>> handleDataAccess(DataAccessException ex) {
    log.warn("Cache backend unavailable: {}", ex.getMessage());
    return ResponseEntity.status(HttpStatus.BAD_GATEWAY)
        .body(error("backend_unavailable", "cache backend unavailable"));
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<Map<String, Object>> handleGeneric(Exception ex) {
    log.error("Unhandled API failure", ex);
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
        .body(error("internal_error", "internal server error"));
  }

  private Map<String, Object> error(String code, String message) {
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("error", code);
    body.put("message", message);
    body.put("timestamp", Instant.now().toString());
    return body;
  }
}
