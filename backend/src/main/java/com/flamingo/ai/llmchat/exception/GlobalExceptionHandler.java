package com.flamingo.ai.llmchat.exception;

import io.micrometer.core.instrument.MeterRegistry;
import jakarta.servlet.http.HttpServletRequest;
import java.time.Instant;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/** Global exception handler for REST controllers. */
@RestControllerAdvice
@RequiredArgsConstructor
@Slf4j
public class GlobalExceptionHandler {

  private final MeterRegistry meterRegistry;

  @ExceptionHandler(NoSessionException.class)
  public ResponseEntity<ApiError> handleNoSession(
      NoSessionException ex, HttpServletRequest request) {

    incrementErrorCounter("no_session");
    String errorId = generateErrorId();
    log.warn("No active session [{}]: {}", errorId, ex.getConversationId());

    return respond(
        HttpStatus.NOT_FOUND,
        errorId,
        ApiError.SESSION_NOT_ACTIVE,
        "No active chat session for this conversation",
        request);
  }

  @ExceptionHandler(AlreadyGeneratingException.class)
  public ResponseEntity<ApiError> handleAlreadyGenerating(
      AlreadyGeneratingException ex, HttpServletRequest request) {

    incrementErrorCounter("already_generating");
    String errorId = generateErrorId();
    log.info("Rejected concurrent send [{}]: {}", errorId, ex.getConversationId());

    return respond(
        HttpStatus.CONFLICT,
        errorId,
        ApiError.SESSION_BUSY,
        "A response is already being generated",
        request);
  }

  @ExceptionHandler(ConversationNotFoundException.class)
  public ResponseEntity<ApiError> handleConversationNotFound(
      ConversationNotFoundException ex, HttpServletRequest request) {

    incrementErrorCounter("conversation_not_found");
    String errorId = generateErrorId();
    log.warn("Conversation not found [{}]: {}", errorId, ex.getConversationId());

    return respond(
        HttpStatus.NOT_FOUND,
        errorId,
        ApiError.CONVERSATION_NOT_FOUND,
        "Conversation not found",
        request);
  }

  @ExceptionHandler(ProviderInstanceNotFoundException.class)
  public ResponseEntity<ApiError> handleProviderNotFound(
      ProviderInstanceNotFoundException ex, HttpServletRequest request) {

    incrementErrorCounter("provider_not_found");
    String errorId = generateErrorId();
    log.warn("Provider instance not found [{}]: {}", errorId, ex.getProviderInstanceId());

    return respond(
        HttpStatus.NOT_FOUND,
        errorId,
        ApiError.PROVIDER_NOT_FOUND,
        "Provider instance not found",
        request);
  }

  @ExceptionHandler(ProviderException.class)
  public ResponseEntity<ApiError> handleProvider(
      ProviderException ex, HttpServletRequest request) {

    boolean rateLimited = ex.getStatus() == 429;
    incrementErrorCounter(rateLimited ? "provider_rate_limited" : "provider_error");
    String errorId = generateErrorId();
    log.error("Provider error [{}]: status={} {}", errorId, ex.getStatus(), ex.getMessage());

    return respond(
        rateLimited ? HttpStatus.TOO_MANY_REQUESTS : HttpStatus.BAD_GATEWAY,
        errorId,
        rateLimited ? ApiError.PROVIDER_RATE_LIMITED : ApiError.PROVIDER_ERROR,
        ex.getUserMessage(),
        request);
  }

  @ExceptionHandler(IllegalStateException.class)
  public ResponseEntity<ApiError> handleIllegalState(
      IllegalStateException ex, HttpServletRequest request) {

    incrementErrorCounter("invalid_state");
    String errorId = generateErrorId();
    log.warn("Invalid state [{}]: {}", errorId, ex.getMessage());

    return respond(HttpStatus.CONFLICT, errorId, ApiError.INVALID_STATE, ex.getMessage(), request);
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

    return respond(HttpStatus.BAD_REQUEST, errorId, ApiError.VALIDATION_ERROR, message, request);
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ApiError> handleGeneric(Exception ex, HttpServletRequest request) {

    incrementErrorCounter("internal_error");
    String errorId = generateErrorId();
    log.error("Unexpected error [{}]: {}", errorId, ex.getMessage(), ex);

    return respond(
        HttpStatus.INTERNAL_SERVER_ERROR,
        errorId,
        ApiError.INTERNAL_ERROR,
        "An unexpected error occurred. Please try again later.",
        request);
  }

  private ResponseEntity<ApiError> respond(
      HttpStatus status, String errorId, String code, String message, HttpServletRequest request) {
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
