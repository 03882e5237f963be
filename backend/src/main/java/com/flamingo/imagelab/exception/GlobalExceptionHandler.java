package com.flamingo.imagelab.exception;

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
import org.springframework.web.multipart.MaxUploadSizeExceededException;
import org.springframework.web.multipart.support.MissingServletRequestPartException;

/** Global exception handler for REST controllers. */
@RestControllerAdvice
@RequiredArgsConstructor
@Slf4j
public class GlobalExceptionHandler {

  private final MeterRegistry meterRegistry;

  @ExceptionHandler(InvalidParameterException.class)
  public ResponseEntity<ApiError> handleInvalidParameter(
      InvalidParameterException ex, HttpServletRequest request) {

    incrementErrorCounter("invalid_parameter");
    String errorId = generateErrorId();
    log.warn("Invalid parameter [{}]: {} - {}", errorId, ex.getParameter(), ex.getMessage());

    return respond(
        HttpStatus.BAD_REQUEST,
        errorId,
        ApiError.INVALID_PARAMETER,
        ex.getMessage(),
        ex.getParameter(),
        request);
  }

  @ExceptionHandler(UnknownOperationException.class)
  public ResponseEntity<ApiError> handleUnknownOperation(
      UnknownOperationException ex, HttpServletRequest request) {

    incrementErrorCounter("unknown_operation");
    String errorId = generateErrorId();
    log.warn("Unknown operation [{}]: {}", errorId, ex.getOperation());

    return respond(
        HttpStatus.BAD_REQUEST,
        errorId,
        ApiError.UNKNOWN_OPERATION,
        "Unsupported operation",
        ex.getOperation(),
        request);
  }

  @ExceptionHandler(ImageNotFoundException.class)
  public ResponseEntity<ApiError> handleImageNotFound(
      ImageNotFoundException ex, HttpServletRequest request) {

    incrementErrorCounter("image_not_found");
    String errorId = generateErrorId();
    log.warn("Image not found [{}]: {}", errorId, ex.getImageId());

    return respond(
        HttpStatus.NOT_FOUND, errorId, ApiError.IMAGE_NOT_FOUND, "Image not found", null, request);
  }

  @ExceptionHandler(ImageAccessDeniedException.class)
  public ResponseEntity<ApiError> handleImageAccessDenied(
      ImageAccessDeniedException ex, HttpServletRequest request) {

    incrementErrorCounter("image_access_denied");
    String errorId = generateErrorId();
    log.warn(
        "Image access denied [{}]: image={}, owner={}", errorId, ex.getImageId(), ex.getOwnerId());

    return respond(
        HttpStatus.FORBIDDEN,
        errorId,
        ApiError.IMAGE_ACCESS_DENIED,
        "Access to this image is denied",
        null,
        request);
  }

  @ExceptionHandler(UnsupportedImageException.class)
  public ResponseEntity<ApiError> handleUnsupportedImage(
      UnsupportedImageException ex, HttpServletRequest request) {

    incrementErrorCounter("unsupported_image");
    String errorId = generateErrorId();
    log.warn("Unsupported image [{}]: {}", errorId, ex.getMessage());

    return respond(
        HttpStatus.UNSUPPORTED_MEDIA_TYPE,
        errorId,
        ApiError.UNSUPPORTED_IMAGE,
        ex.getUserMessage(),
        null,
        request);
  }

  @ExceptionHandler(HistoryEntryNotFoundException.class)
  public ResponseEntity<ApiError> handleHistoryNotFound(
      HistoryEntryNotFoundException ex, HttpServletRequest request) {

    incrementErrorCounter("history_not_found");
    String errorId = generateErrorId();
    log.warn("History entry not found [{}]: {}", errorId, ex.getEntryId());

    return respond(
        HttpStatus.NOT_FOUND,
        errorId,
        ApiError.HISTORY_NOT_FOUND,
        "History entry not found",
        null,
        request);
  }

  @ExceptionHandler(CorruptChainException.class)
  public ResponseEntity<ApiError> handleCorruptChain(
      CorruptChainException ex, HttpServletRequest request) {

    incrementErrorCounter("corrupt_chain");
    String errorId = generateErrorId();
    log.error(
        "Derivation chain corrupt [{}] for image {}: {}",
        errorId,
        ex.getImageId(),
        ex.getMessage(),
        ex);

    return respond(
        HttpStatus.INTERNAL_SERVER_ERROR,
        errorId,
        ApiError.CORRUPT_CHAIN,
        "The image's edit chain is inconsistent",
        null,
        request);
  }

  @ExceptionHandler(PersistenceFailureException.class)
  public ResponseEntity<ApiError> handlePersistenceFailure(
      PersistenceFailureException ex, HttpServletRequest request) {

    incrementErrorCounter("persistence_failure");
    String errorId = generateErrorId();
    log.error("Persistence failure [{}]: {}", errorId, ex.getMessage(), ex);

    return respond(
        HttpStatus.SERVICE_UNAVAILABLE,
        errorId,
        ApiError.PERSISTENCE_FAILURE,
        ex.getUserMessage(),
        null,
        request);
  }

  @ExceptionHandler(ProcessingTimeoutException.class)
  public ResponseEntity<ApiError> handleProcessingTimeout(
      ProcessingTimeoutException ex, HttpServletRequest request) {

    incrementErrorCounter("processing_timeout");
    String errorId = generateErrorId();
    log.warn("Processing timeout [{}]: {}", errorId, ex.getMessage());

    return respond(
        HttpStatus.GATEWAY_TIMEOUT,
        errorId,
        ApiError.PROCESSING_TIMEOUT,
        "Processing took too long. Try fewer operations or a smaller image.",
        null,
        request);
  }

  @ExceptionHandler(ProcessingRejectedException.class)
  public ResponseEntity<ApiError> handleProcessingRejected(
      ProcessingRejectedException ex, HttpServletRequest request) {

    incrementErrorCounter("processing_rejected");
    String errorId = generateErrorId();
    log.warn("Processing rejected [{}]: {}", errorId, ex.getMessage());

    return respond(
        HttpStatus.SERVICE_UNAVAILABLE,
        errorId,
        ApiError.PROCESSING_REJECTED,
        "The server is busy processing other images. Retry shortly.",
        null,
        request);
  }

  @ExceptionHandler(UnauthorizedException.class)
  public ResponseEntity<ApiError> handleUnauthorized(
      UnauthorizedException ex, HttpServletRequest request) {

    incrementErrorCounter("unauthorized");
    String errorId = generateErrorId();
    log.warn("Unauthorized request [{}]: {}", errorId, ex.getMessage());

    return respond(
        HttpStatus.UNAUTHORIZED,
        errorId,
        ApiError.UNAUTHORIZED,
        "Authentication required",
        null,
        request);
  }

  @ExceptionHandler(MaxUploadSizeExceededException.class)
  public ResponseEntity<ApiError> handleUploadTooLarge(
      MaxUploadSizeExceededException ex, HttpServletRequest request) {

    incrementErrorCounter("upload_too_large");
    String errorId = generateErrorId();
    log.warn("Upload too large [{}]: {}", errorId, ex.getMessage());

    return respond(
        HttpStatus.PAYLOAD_TOO_LARGE,
        errorId,
        ApiError.VALIDATION_ERROR,
        "File is too large",
        null,
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

    return respond(
        HttpStatus.BAD_REQUEST, errorId, ApiError.VALIDATION_ERROR, message, null, request);
  }

  @ExceptionHandler({
    HttpMessageNotReadableException.class,
    MethodArgumentTypeMismatchException.class,
    MissingServletRequestParameterException.class,
    MissingServletRequestPartException.class
  })
  public ResponseEntity<ApiError> handleMalformedRequest(
      Exception ex, HttpServletRequest request) {

    incrementErrorCounter("validation_error");
    String errorId = generateErrorId();
    log.warn("Malformed request [{}]: {}", errorId, ex.getMessage());

    return respond(
        HttpStatus.BAD_REQUEST,
        errorId,
        ApiError.VALIDATION_ERROR,
        "Malformed request",
        null,
        request);
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
        null,
        request);
  }

  private ResponseEntity<ApiError> respond(
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
