package com.gpstracker.tracker.api;

import com.gpstracker.tracker.history.PersistenceException;
import com.gpstracker.tracker.ingest.InvalidDeviceTokenException;
import com.gpstracker.tracker.ingest.ValidationException;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.servlet.NoHandlerFoundException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

/**
 * Centralized REST exception mapping for tracker API endpoints.
 *
 * <p>Every failure is rendered as {@code {success:false, error:<message>}}.
 */
@RestControllerAdvice
public class ApiExceptionHandler {
  private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

  /**
   * Maps payload validation errors to HTTP 400.
   *
   * @param ex validation exception thrown by the normalizer
   * @return standardized error payload
   */
  @ExceptionHandler(ValidationException.class)
  public ResponseEntity<Map<String, Object>> handleValidation(ValidationException ex) {
    return ResponseEntity.badRequest().body(error(ex.getMessage()));
  }

  /**
   * Maps unreadable JSON bodies to HTTP 400.
   *
   * @param ex body conversion failure
   * @return standardized error payload
   */
  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ResponseEntity<Map<String, Object>> handleUnreadable(HttpMessageNotReadableException ex) {
    return ResponseEntity.badRequest().body(error("Malformed JSON body"));
  }

  /**
   * Maps token mismatches to HTTP 401.
   *
   * @param ex token check failure
   * @return standardized error payload
   */
  @ExceptionHandler(InvalidDeviceTokenException.class)
  public ResponseEntity<Map<String, Object>> handleInvalidToken(InvalidDeviceTokenException ex) {
    return ResponseEntity.status(HttpStatus.UNAUTHORIZED).body(error(ex.getMessage()));
  }

  /**
   * Maps unmatched routes to HTTP 404 instead of generic 500.
   *
   * @param ex Spring MVC no-resource/no-handler exception
   * @return standardized not-found payload
   */
  @ExceptionHandler({NoResourceFoundException.class, NoHandlerFoundException.class})
  public ResponseEntity<Map<String, Object>> handleMissingRoute(Exception ex) {
    return ResponseEntity.status(HttpStatus.NOT_FOUND).body(error("Not found"));
  }

  /**
   * Maps history store failures to HTTP 500.
   *
   * @param ex history store failure
   * @return standardized error payload
   */
  @ExceptionHandler(PersistenceException.class)
  public ResponseEntity<Map<String, Object>> handlePersistence(PersistenceException ex) {
    log.warn("History read failed", ex);
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(error("Database error"));
  }

  /**
   * Maps unexpected failures to HTTP 500.
   *
   * @param ex unhandled server-side exception
   * @return standardized error payload
   */
  @ExceptionHandler(Exception.class)
  public ResponseEntity<Map<String, Object>> handleGeneric(Exception ex) {
    if (ex instanceof ErrorResponse response && response.getStatusCode().is4xxClientError()) {
      return ResponseEntity.status(response.getStatusCode()).body(error(ex.getMessage()));
    }
    log.error("Unhandled API error", ex);
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
        .body(error("Internal server error"));
  }

  private Map<String, Object> error(String message) {
    return Map.of("success", false, "error", message);
  }
}
