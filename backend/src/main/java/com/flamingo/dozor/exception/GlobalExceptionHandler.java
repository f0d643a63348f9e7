package com.flamingo.dozor.exception;

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

  @ExceptionHandler(ConfigurationException.class)
  public ResponseEntity<ApiError> handleConfiguration(
      ConfigurationException ex, HttpServletRequest request) {

    incrementErrorCounter("configuration");
    String errorId = generateErrorId();
    log.warn("Configuration error [{}]: {}", errorId, ex.getMessage());

    return build(
        HttpStatus.BAD_REQUEST,
        errorId,
        ApiError.CONFIGURATION_ERROR,
        ex.getUserMessage(),
        request);
  }

  @ExceptionHandler(PlotFormatException.class)
  public ResponseEntity<ApiError> handlePlotFormat(
      PlotFormatException ex, HttpServletRequest request) {

    incrementErrorCounter("plot_format");
    String errorId = generateErrorId();
    log.warn("Plot format error [{}]: {}", errorId, ex.getMessage());

    return build(
        HttpStatus.UNPROCESSABLE_ENTITY,
        errorId,
        ApiError.PLOT_FORMAT_ERROR,
        ex.getUserMessage(),
        request);
  }

  @ExceptionHandler(ExecutionFailureException.class)
  public ResponseEntity<ApiError> handleExecutionFailure(
      ExecutionFailureException ex, HttpServletRequest request) {

    incrementErrorCounter("execution_failure");
    String errorId = generateErrorId();
    log.error("Execution failure [{}]: {}", errorId, ex.getMessage(), ex);

    return build(
        HttpStatus.BAD_GATEWAY,
        errorId,
        ApiError.EXECUTION_FAILED,
        "The analysis program could not be run",
        request);
  }

  @ExceptionHandler(ExternalServiceException.class)
  public ResponseEntity<ApiError> handleExternalService(
      ExternalServiceException ex, HttpServletRequest request) {

    incrementErrorCounter("external_service");
    String errorId = generateErrorId();
    log.error(
        "External service error [{}] ({}): {}", errorId, ex.getServiceName(), ex.getMessage());

    return build(
        HttpStatus.BAD_GATEWAY,
        errorId,
        ApiError.EXTERNAL_SERVICE_ERROR,
        ex.getUserMessage(),
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
