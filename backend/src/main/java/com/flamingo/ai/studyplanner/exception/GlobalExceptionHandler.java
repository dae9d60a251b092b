package com.flamingo.ai.studyplanner.exception;

import io.micrometer.core.instrument.MeterRegistry;
import jakarta.servlet.http.HttpServletRequest;
import java.time.Instant;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.multipart.MaxUploadSizeExceededException;

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
    log.warn("Session not found [{}]: {}", errorId, ex.getSessionId());

    return build(
        HttpStatus.NOT_FOUND,
        errorId,
        ApiError.SESSION_NOT_FOUND,
        "Session not found",
        null,
        request);
  }

  @ExceptionHandler(UnsupportedFileException.class)
  public ResponseEntity<ApiError> handleUnsupportedFile(
      UnsupportedFileException ex, HttpServletRequest request) {

    incrementErrorCounter("unsupported_file");
    String errorId = generateErrorId();
    log.warn("Unsupported file [{}]: {} ({})", errorId, ex.getFileName(), ex.getMessage());

    return build(
        HttpStatus.UNSUPPORTED_MEDIA_TYPE,
        errorId,
        ApiError.UNSUPPORTED_FILE,
        ex.getUserMessage(),
        ex.getMessage(),
        request);
  }

  @ExceptionHandler(DocumentProcessingException.class)
  public ResponseEntity<ApiError> handleDocumentProcessing(
      DocumentProcessingException ex, HttpServletRequest request) {

    incrementErrorCounter("document_processing");
    String errorId = generateErrorId();
    log.error("Document processing error [{}]: {}", errorId, ex.getMessage(), ex);

    return build(
        HttpStatus.UNPROCESSABLE_ENTITY,
        errorId,
        ApiError.DOCUMENT_PROCESSING_ERROR,
        ex.getUserMessage(),
        null,
        request);
  }

  @ExceptionHandler(DocumentNotFoundException.class)
  public ResponseEntity<ApiError> handleDocumentNotFound(
      DocumentNotFoundException ex, HttpServletRequest request) {

    incrementErrorCounter("document_not_found");
    String errorId = generateErrorId();
    log.warn("Document not found [{}]: {}", errorId, ex.getFileName());

    return build(
        HttpStatus.NOT_FOUND,
        errorId,
        ApiError.DOCUMENT_NOT_FOUND,
        "Document not found. Upload it first.",
        null,
        request);
  }

  @ExceptionHandler(NoTopicsException.class)
  public ResponseEntity<ApiError> handleNoTopics(
      NoTopicsException ex, HttpServletRequest request) {

    incrementErrorCounter("no_topics");
    String errorId = generateErrorId();
    log.warn("Schedule requested without topics [{}]", errorId);

    return build(HttpStatus.CONFLICT, errorId, ApiError.NO_TOPICS, ex.getMessage(), null, request);
  }

  @ExceptionHandler(TooManyTopicsException.class)
  public ResponseEntity<ApiError> handleTooManyTopics(
      TooManyTopicsException ex, HttpServletRequest request) {

    incrementErrorCounter("too_many_topics");
    String errorId = generateErrorId();
    log.warn(
        "Topic cap exceeded [{}]: {} > {}", errorId, ex.getTopicCount(), ex.getMaxTopics());

    return build(
        HttpStatus.UNPROCESSABLE_ENTITY,
        errorId,
        ApiError.TOO_MANY_TOPICS,
        "Too many topics to schedule. Reset topics and process fewer documents.",
        ex.getMessage(),
        request);
  }

  @ExceptionHandler(InvalidDateException.class)
  public ResponseEntity<ApiError> handleInvalidDate(
      InvalidDateException ex, HttpServletRequest request) {

    incrementErrorCounter("invalid_date");
    String errorId = generateErrorId();
    log.warn("Invalid date [{}]: {}", errorId, ex.getMessage());

    return build(
        HttpStatus.BAD_REQUEST,
        errorId,
        ApiError.INVALID_DATE,
        "Use YYYY-MM-DD dates with the end date on or after the start date",
        ex.getMessage(),
        request);
  }

  @ExceptionHandler(NoScheduleException.class)
  public ResponseEntity<ApiError> handleNoSchedule(
      NoScheduleException ex, HttpServletRequest request) {

    incrementErrorCounter("no_schedule");
    String errorId = generateErrorId();
    log.warn("No schedule [{}]: session {}", errorId, ex.getSessionId());

    return build(
        HttpStatus.NOT_FOUND,
        errorId,
        ApiError.NO_SCHEDULE,
        "No schedule found. Generate a schedule first.",
        null,
        request);
  }

  @ExceptionHandler(UnsupportedExportFormatException.class)
  public ResponseEntity<ApiError> handleUnsupportedExportFormat(
      UnsupportedExportFormatException ex, HttpServletRequest request) {

    incrementErrorCounter("validation_error");
    String errorId = generateErrorId();
    log.warn("Unsupported export format [{}]: {}", errorId, ex.getFormat());

    return build(
        HttpStatus.BAD_REQUEST,
        errorId,
        ApiError.VALIDATION_ERROR,
        "Supported export formats: csv, markdown",
        ex.getMessage(),
        request);
  }

  @ExceptionHandler(UnsupportedAllocationPolicyException.class)
  public ResponseEntity<ApiError> handleUnsupportedAllocationPolicy(
      UnsupportedAllocationPolicyException ex, HttpServletRequest request) {

    incrementErrorCounter("validation_error");
    String errorId = generateErrorId();
    log.warn("Unsupported allocation policy [{}]: {}", errorId, ex.getPolicy());

    return build(
        HttpStatus.BAD_REQUEST,
        errorId,
        ApiError.VALIDATION_ERROR,
        "Supported allocation policies: proportional, round-robin",
        ex.getMessage(),
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

    return build(
        HttpStatus.BAD_REQUEST, errorId, ApiError.VALIDATION_ERROR, message, null, request);
  }

  @ExceptionHandler(MissingServletRequestParameterException.class)
  public ResponseEntity<ApiError> handleMissingParameter(
      MissingServletRequestParameterException ex, HttpServletRequest request) {

    incrementErrorCounter("validation_error");
    String errorId = generateErrorId();
    log.warn("Missing parameter [{}]: {}", errorId, ex.getParameterName());

    return build(
        HttpStatus.BAD_REQUEST,
        errorId,
        ApiError.VALIDATION_ERROR,
        ex.getParameterName() + " is required",
        null,
        request);
  }

  @ExceptionHandler(MaxUploadSizeExceededException.class)
  public ResponseEntity<ApiError> handleUploadTooLarge(
      MaxUploadSizeExceededException ex, HttpServletRequest request) {

    incrementErrorCounter("unsupported_file");
    String errorId = generateErrorId();
    log.warn("Upload too large [{}]: {}", errorId, ex.getMessage());

    return build(
        HttpStatus.PAYLOAD_TOO_LARGE,
        errorId,
        ApiError.UNSUPPORTED_FILE,
        "Maximum file size is 50MB",
        null,
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
        null,
        request);
  }

  private ResponseEntity<ApiError> build(
      HttpStatus status,
      String errorId,
      String code,
      String message,
      String details,
      HttpServletRequest request) {
    return ResponseEntity.status(status)
        .body(
            ApiError.builder()
                .errorId(errorId)
                .code(code)
                .message(message)
                .details(details)
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
