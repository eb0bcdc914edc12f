package com.warden.api.common;

import com.warden.api.catalog.CatalogUnavailableException;
import com.warden.domain.error.ConflictException;
import com.warden.domain.error.NotFoundException;
import com.warden.domain.error.ValidationException;
import com.warden.domain.error.WardenException;
import jakarta.validation.ConstraintViolationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

@RestControllerAdvice
public class ApiExceptionHandler {

  private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

  @ExceptionHandler(ValidationException.class)
  public ResponseEntity<Map<String, Object>> validation(ValidationException ex) {
    return body(HttpStatus.BAD_REQUEST, ex);
  }

  @ExceptionHandler(NotFoundException.class)
  public ResponseEntity<Map<String, Object>> notFound(NotFoundException ex) {
    return body(HttpStatus.NOT_FOUND, ex);
  }

  @ExceptionHandler(ConflictException.class)
  public ResponseEntity<Map<String, Object>> conflict(ConflictException ex) {
    return body(HttpStatus.CONFLICT, ex);
  }

  @ExceptionHandler(CatalogUnavailableException.class)
  public ResponseEntity<Map<String, Object>> catalog(CatalogUnavailableException ex) {
    log.error("Integration catalog pull failed: {}", ex.getMessage());
    return body(HttpStatus.BAD_GATEWAY, ex);
  }

  @ExceptionHandler(DataAccessException.class)
  public ResponseEntity<Map<String, Object>> store(DataAccessException ex) {
    log.error("Job store failure", ex);
    return error(HttpStatus.INTERNAL_SERVER_ERROR, "store_error", "Job store unavailable");
  }

  @ExceptionHandler(IllegalArgumentException.class)
  public ResponseEntity<Map<String, Object>> badRequest(IllegalArgumentException ex) {
    return error(HttpStatus.BAD_REQUEST, "bad_request", ex.getMessage() == null ? "invalid_request" : ex.getMessage());
  }

  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ResponseEntity<Map<String, Object>> unreadable(HttpMessageNotReadableException ex) {
    return error(HttpStatus.BAD_REQUEST, "bad_request", "Malformed JSON body");
  }

  @ExceptionHandler({MissingServletRequestParameterException.class, MethodArgumentTypeMismatchException.class})
  public ResponseEntity<Map<String, Object>> badParameter(Exception ex) {
    return error(HttpStatus.BAD_REQUEST, "bad_request", ex.getMessage() == null ? "invalid_request" : ex.getMessage());
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<Map<String, Object>> validation(MethodArgumentNotValidException ex) {
    Map<String, String> fields = new HashMap<>();
    for (FieldError fe : ex.getBindingResult().getFieldErrors()) {
      fields.put(fe.getField(), fe.getDefaultMessage() == null ? "invalid" : fe.getDefaultMessage());
    }
    return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(Map.of(
        "status", "error",
        "reason", "validation_error",
        "message", "invalid_request",
        "fields", fields,
        "ts", Instant.now().toString()
    ));
  }

  @ExceptionHandler(ConstraintViolationException.class)
  public ResponseEntity<Map<String, Object>> validation(ConstraintViolationException ex) {
    return error(HttpStatus.BAD_REQUEST, "validation_error", ex.getMessage() == null ? "invalid_request" : ex.getMessage());
  }

  private static ResponseEntity<Map<String, Object>> body(HttpStatus status, WardenException ex) {
    return error(status, ex.reason(), ex.getMessage());
  }

  public static ResponseEntity<Map<String, Object>> error(HttpStatus status, String reason, String message) {
    return ResponseEntity.status(status).body(errorBody(reason, message));
  }

  public static Map<String, Object> errorBody(String reason, String message) {
    return Map.of(
        "status", "error",
        "reason", reason,
        "message", message == null ? reason : message,
        "ts", Instant.now().toString()
    );
  }
}
