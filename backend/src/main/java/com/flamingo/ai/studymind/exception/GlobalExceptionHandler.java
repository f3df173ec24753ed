package com.flamingo.ai.studymind.exception;

import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.servlet.http.HttpServletRequest;
import java.time.Instant;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/** Global exception handler for REST controllers. */
@RestControllerAdvice
@RequiredArgsConstructor
@Slf4j
public class GlobalExceptionHandler {

  private final MeterRegistry meterRegistry;

  @ExceptionHandler(SessionNotFoundException.class)
  public ResponseEntity<ApiError> handleSessionNotFound(
      SessionNotFoundException ex, HttpServletRequest request) {

    incrementErrorCounter("session_not_found");
    String errorId = generateErrorId();
    log.warn("Session not found [{}]: {}", errorId, ex.getSessionUid());

    return build(
        HttpStatus.NOT_FOUND, errorId, ApiError.SESSION_NOT_FOUND, "Session not found", request);
  }

  @ExceptionHandler(LibraryItemNotFoundException.class)
  public ResponseEntity<ApiError> handleLibraryItemNotFound(
      LibraryItemNotFoundException ex, HttpServletRequest request) {

    incrementErrorCounter("library_item_not_found");
    String errorId = generateErrorId();
    log.warn("Library item not found [{}]: {}", errorId, ex.getItemRef());

    return build(
        HttpStatus.NOT_FOUND,
        errorId,
        ApiError.LIBRARY_ITEM_NOT_FOUND,
        "The referenced library item does not exist",
        request);
  }

  @ExceptionHandler(IntentClassificationException.class)
  public ResponseEntity<ApiError> handleIntentClassification(
      IntentClassificationException ex, HttpServletRequest request) {

    incrementErrorCounter("intent_unclear");
    String errorId = generateErrorId();
    log.warn("Intent classification failed [{}]: {}", errorId, ex.getMessage());

    return build(
        HttpStatus.UNPROCESSABLE_ENTITY,
        errorId,
        ApiError.INTENT_UNCLEAR,
        ex.getUserMessage(),
        request);
  }

  @ExceptionHandler(ContentPlanningException.class)
  public ResponseEntity<ApiError> handleContentPlanning(
      ContentPlanningException ex, HttpServletRequest request) {

    incrementErrorCounter("planning_failed");
    String errorId = generateErrorId();
    log.warn("Content planning failed [{}]: {}", errorId, ex.getMessage());

    return build(
        HttpStatus.UNPROCESSABLE_ENTITY,
        errorId,
        ApiError.PLANNING_FAILED,
        ex.getUserMessage(),
        request);
  }

  @ExceptionHandler(UnsupportedContentException.class)
  public ResponseEntity<ApiError> handleUnsupportedContent(
      UnsupportedContentException ex, HttpServletRequest request) {

    incrementErrorCounter("content_unsupported");
    String errorId = generateErrorId();
    log.info("Unsupported content requested [{}]: {}", errorId, ex.getFeature());

    return build(
        HttpStatus.UNPROCESSABLE_ENTITY,
        errorId,
        ApiError.CONTENT_UNSUPPORTED,
        ex.getUserMessage(),
        request);
  }

  @ExceptionHandler(ContentGenerationException.class)
  public ResponseEntity<ApiError> handleContentGeneration(
      ContentGenerationException ex, HttpServletRequest request) {

    incrementErrorCounter("content_generation_failed");
    String errorId = generateErrorId();
    log.error("Content generation failed [{}]: {}", errorId, ex.getMessage(), ex);

    return build(
        HttpStatus.BAD_GATEWAY,
        errorId,
        ApiError.CONTENT_GENERATION_FAILED,
        ex.getUserMessage(),
        request);
  }

  @ExceptionHandler(LlmServiceException.class)
  public ResponseEntity<ApiError> handleLlmService(
      LlmServiceException ex, HttpServletRequest request) {

    String errorType = ex.isRateLimited() ? "llm_rate_limited" : "llm_error";
    incrementErrorCounter(errorType);
    String errorId = generateErrorId();
    log.error("LLM service error [{}]: {}", errorId, ex.getMessage(), ex);

    String code = ex.isRateLimited() ? ApiError.LLM_RATE_LIMITED : ApiError.LLM_UNAVAILABLE;

    return build(HttpStatus.SERVICE_UNAVAILABLE, errorId, code, ex.getUserMessage(), request);
  }

  @ExceptionHandler(CallNotPermittedException.class)
  public ResponseEntity<ApiError> handleCircuitOpen(
      CallNotPermittedException ex, HttpServletRequest request) {

    incrementErrorCounter("circuit_open");
    String errorId = generateErrorId();
    log.warn("Circuit breaker open [{}]: {}", errorId, ex.getMessage());

    return build(
        HttpStatus.SERVICE_UNAVAILABLE,
        errorId,
        ApiError.LLM_UNAVAILABLE,
        "Content generation is temporarily unavailable. Please try again later.",
        request);
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ApiError> handleValidation(
      MethodArgumentNotValidException ex, HttpServletRequest request) {

    incrementErrorCounter("validation_error");
    String errorId = generateErrorId();

    String message =
        ex.getBindingResult().getFieldErrors().stream()
            .findFirst()
            .map(error -> error.getField() + ": " + error.getDefaultMessage())
            .orElse("Validation failed");

    log.warn("Validation error [{}]: {}", errorId, message);

    return build(HttpStatus.BAD_REQUEST, errorId, ApiError.VALIDATION_ERROR, message, request);
  }

  @ExceptionHandler(MissingRequestHeaderException.class)
  public ResponseEntity<ApiError> handleMissingHeader(
      MissingRequestHeaderException ex, HttpServletRequest request) {

    incrementErrorCounter("validation_error");
    String errorId = generateErrorId();
    log.warn("Missing header [{}]: {}", errorId, ex.getHeaderName());

    return build(
        HttpStatus.BAD_REQUEST,
        errorId,
        ApiError.VALIDATION_ERROR,
        "Missing required header: " + ex.getHeaderName(),
        request);
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ApiError> handleGeneric(Exception ex, HttpServletRequest request) {

    incrementErrorCounter("internal_error");
    String errorId = generateErrorId();
    log.error("Unexpected error [{}]: {}", errorId, ex.getMessage(), ex);

    return build(
        HttpStatus.INTERNAL_SERVER_ERROR,
        errorId,
        ApiError.INTERNAL_ERROR,
        "An unexpected error occurred. Please try again later.",
        request);
  }

  private ResponseEntity<ApiError> build(
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

  private void incrementErrorCounter(String errorType) {
    meterRegistry.counter("api_errors_total", "error_type", errorType).increment();
  }

  private String generateErrorId() {
    return UUID.randomUUID().toString().substring(0, 8);
  }
}
