package com.flamingo.ai.photostore.exception;

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
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

/** Global exception handler for REST controllers. */
@RestControllerAdvice
@RequiredArgsConstructor
@Slf4j
public class GlobalExceptionHandler {

  private final MeterRegistry meterRegistry;

  @ExceptionHandler(PhotoNotFoundException.class)
  public ResponseEntity<ApiError> handlePhotoNotFound(
      PhotoNotFoundException ex, HttpServletRequest request) {

    incrementErrorCounter("photo_not_found");
    String errorId = generateErrorId();
    log.warn("Photo not found [{}]: {}", errorId, ex.getPhotoId());

    return build(HttpStatus.NOT_FOUND, errorId, ApiError.PHOTO_NOT_FOUND, ex.getMessage(), request);
  }

  @ExceptionHandler(KnownFaceNotFoundException.class)
  public ResponseEntity<ApiError> handleKnownFaceNotFound(
      KnownFaceNotFoundException ex, HttpServletRequest request) {

    incrementErrorCounter("known_face_not_found");
    String errorId = generateErrorId();
    log.warn("Known face not found [{}]: {}", errorId, ex.getKnownFaceId());

    return build(
        HttpStatus.NOT_FOUND, errorId, ApiError.KNOWN_FACE_NOT_FOUND, ex.getMessage(), request);
  }

  @ExceptionHandler(PhotoValidationException.class)
  public ResponseEntity<ApiError> handlePhotoValidation(
      PhotoValidationException ex, HttpServletRequest request) {

    incrementErrorCounter("validation_error");
    String errorId = generateErrorId();
    log.warn("Invalid photo input [{}]: {}", errorId, ex.getMessage());

    return build(
        HttpStatus.BAD_REQUEST, errorId, ApiError.VALIDATION_ERROR, ex.getMessage(), request);
  }

  @ExceptionHandler(StorageException.class)
  public ResponseEntity<ApiError> handleStorage(StorageException ex, HttpServletRequest request) {

    incrementErrorCounter(ex.isConflict() ? "storage_conflict" : "storage_error");
    String errorId = generateErrorId();
    log.error(
        "Storage error [{}] during {} for {}: {}",
        errorId,
        ex.getOperation(),
        ex.getFilePath(),
        ex.getMessage(),
        ex);

    HttpStatus status = ex.isConflict() ? HttpStatus.CONFLICT : HttpStatus.SERVICE_UNAVAILABLE;
    String code = ex.isConflict() ? ApiError.STORAGE_CONFLICT : ApiError.STORAGE_ERROR;
    return build(status, errorId, code, ex.getUserMessage(), request);
  }

  @ExceptionHandler(SchemaException.class)
  public ResponseEntity<ApiError> handleSchema(SchemaException ex, HttpServletRequest request) {

    incrementErrorCounter("schema_error");
    String errorId = generateErrorId();
    log.error("Schema error [{}] on table {}: {}", errorId, ex.getTableName(), ex.getMessage());

    return build(
        HttpStatus.INTERNAL_SERVER_ERROR,
        errorId,
        ApiError.SCHEMA_ERROR,
        "The photo store schema is not usable. Contact an administrator.",
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

  @ExceptionHandler({
    MissingServletRequestParameterException.class,
    MethodArgumentTypeMismatchException.class,
    HttpMessageNotReadableException.class
  })
  public ResponseEntity<ApiError> handleMalformedRequest(
      Exception ex, HttpServletRequest request) {

    incrementErrorCounter("validation_error");
    String errorId = generateErrorId();
    log.warn("Malformed request [{}]: {}", errorId, ex.getMessage());

    String message =
        ex instanceof HttpMessageNotReadableException
            ? "Request body is not valid JSON for this operation"
            : ex.getMessage();
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
