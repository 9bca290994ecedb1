package com.flamingo.ai.contextmemory.exception;

import io.micrometer.core.instrument.MeterRegistry;
import jakarta.servlet.http.HttpServletRequest;
import java.time.Instant;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/** Maps REST-facing exceptions to {@link ApiError} bodies. */
@RestControllerAdvice
@RequiredArgsConstructor
@Slf4j
public class GlobalExceptionHandler {

  private final MeterRegistry meterRegistry;

  @ExceptionHandler(MemoryNotFoundException.class)
  public ResponseEntity<ApiError> handleMemoryNotFound(
      MemoryNotFoundException ex, HttpServletRequest request) {
    String errorId = record("memory_not_found");
    log.warn("Memory not found [{}]: {}", errorId, ex.getConversationId());
    return respond(
        HttpStatus.NOT_FOUND, errorId, ApiError.MEMORY_NOT_FOUND, "Memory not found", request);
  }

  @ExceptionHandler(DocumentNotFoundException.class)
  public ResponseEntity<ApiError> handleDocumentNotFound(
      DocumentNotFoundException ex, HttpServletRequest request) {
    String errorId = record("document_not_found");
    log.warn("Document not found [{}]: {}", errorId, ex.getDocumentId());
    return respond(
        HttpStatus.NOT_FOUND, errorId, ApiError.DOCUMENT_NOT_FOUND, "Document not found", request);
  }

  @ExceptionHandler(SessionStateNotFoundException.class)
  public ResponseEntity<ApiError> handleSessionNotFound(
      SessionStateNotFoundException ex, HttpServletRequest request) {
    String errorId = record("session_not_found");
    log.warn("Session state not found [{}]: {}", errorId, ex.getSessionId());
    return respond(
        HttpStatus.NOT_FOUND, errorId, ApiError.SESSION_NOT_FOUND, "Session not found", request);
  }

  @ExceptionHandler(MemoryAccessDeniedException.class)
  public ResponseEntity<ApiError> handleAccessDenied(
      MemoryAccessDeniedException ex, HttpServletRequest request) {
    String errorId = record("memory_access_denied");
    log.warn(
        "Access denied [{}]: resource={}, user={}", errorId, ex.getResourceId(), ex.getUserId());
    return respond(
        HttpStatus.FORBIDDEN,
        errorId,
        ApiError.MEMORY_ACCESS_DENIED,
        "Access to this resource is denied",
        request);
  }

  @ExceptionHandler(StoreUnavailableException.class)
  public ResponseEntity<ApiError> handleStoreUnavailable(
      StoreUnavailableException ex, HttpServletRequest request) {
    String errorId = record("store_unavailable");
    log.error("Store unavailable [{}]: {}", errorId, ex.getMessage(), ex);
    return respond(
        HttpStatus.SERVICE_UNAVAILABLE,
        errorId,
        ApiError.STORE_UNAVAILABLE,
        ex.getUserMessage(),
        request);
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ApiError> handleValidation(
      MethodArgumentNotValidException ex, HttpServletRequest request) {
    String errorId = record("validation_error");
    String message =
        ex.getBindingResult().getFieldErrors().stream()
            .findFirst()
            .map(error -> error.getField() + ": " + error.getDefaultMessage())
            .orElse("Validation failed");
    log.warn("Validation error [{}]: {}", errorId, message);
    return respond(HttpStatus.BAD_REQUEST, errorId, ApiError.VALIDATION_ERROR, message, request);
  }

  @ExceptionHandler({HttpMessageNotReadableException.class, IllegalArgumentException.class})
  public ResponseEntity<ApiError> handleBadRequest(Exception ex, HttpServletRequest request) {
    String errorId = record("validation_error");
    log.warn("Bad request [{}]: {}", errorId, ex.getMessage());
    return respond(
        HttpStatus.BAD_REQUEST, errorId, ApiError.VALIDATION_ERROR, "Malformed request", request);
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ApiError> handleGeneric(Exception ex, HttpServletRequest request) {
    String errorId = record("internal_error");
    log.error("Unexpected error [{}]: {}", errorId, ex.getMessage(), ex);
    return respond(
        HttpStatus.INTERNAL_SERVER_ERROR,
        errorId,
        ApiError.INTERNAL_ERROR,
        "An unexpected error occurred. Please try again later.",
        request);
  }

  private ResponseEntity<ApiError> respond(
      HttpStatus status,
      String errorId,
      String code,
      String message,
      HttpServletRequest request) {
    return ResponseEntity.status(status)
        .body(
            ApiError.builder()
                .errorId(errorId)
                .code(code)
                .message(message)
                .path(request.getRequestURI())
                .timestamp(Instant.now())
                .build());
  }

  private String record(String errorType) {
    meterRegistry.counter("api_errors_total", "error_type", errorType).increment();
    return UUID.randomUUID().toString().substring(0, 8);
  }
}
