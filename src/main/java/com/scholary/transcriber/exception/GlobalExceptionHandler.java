package com.scholary.transcriber.exception;

import com.scholary.transcriber.objectstore.ObjectStoreException;
import com.scholary.transcriber.tts.SpeechSynthesisException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.ConstraintViolationException;
import java.time.Instant;
import java.util.UUID;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.multipart.MaxUploadSizeExceededException;
import org.springframework.web.multipart.support.MissingServletRequestPartException;

/** Maps exceptions raised by the controllers to {@link ApiError} responses. */
@RestControllerAdvice
public class GlobalExceptionHandler {

  private static final Logger LOGGER = LoggerFactory.getLogger(GlobalExceptionHandler.class);

  @ExceptionHandler(ValidationException.class)
  public ResponseEntity<ApiError> handleValidation(
      ValidationException ex, HttpServletRequest request) {
    String errorId = generateErrorId();
    LOGGER.warn("Validation failed [{}]: field={}, {}", errorId, ex.getField(), ex.getMessage());
    return respond(
        HttpStatus.BAD_REQUEST, errorId, ApiError.VALIDATION_ERROR, ex.getMessage(), request);
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ApiError> handleMethodArgumentNotValid(
      MethodArgumentNotValidException ex, HttpServletRequest request) {
    String message =
        ex.getBindingResult().getFieldErrors().stream()
            .map(FieldError::getField)
            .map(field -> field + " is invalid")
            .collect(Collectors.joining(", "));
    String errorId = generateErrorId();
    LOGGER.warn("Request body rejected [{}]: {}", errorId, message);
    return respond(HttpStatus.BAD_REQUEST, errorId, ApiError.VALIDATION_ERROR, message, request);
  }

  @ExceptionHandler({
    ConstraintViolationException.class,
    MissingServletRequestParameterException.class,
    MissingServletRequestPartException.class,
    MethodArgumentTypeMismatchException.class
  })
  public ResponseEntity<ApiError> handleBadRequest(Exception ex, HttpServletRequest request) {
    String errorId = generateErrorId();
    LOGGER.warn("Bad request [{}]: {}", errorId, ex.getMessage());
    return respond(
        HttpStatus.BAD_REQUEST, errorId, ApiError.VALIDATION_ERROR, ex.getMessage(), request);
  }

  @ExceptionHandler(MaxUploadSizeExceededException.class)
  public ResponseEntity<ApiError> handleUploadTooLarge(
      MaxUploadSizeExceededException ex, HttpServletRequest request) {
    String errorId = generateErrorId();
    LOGGER.warn("Upload too large [{}]: {}", errorId, ex.getMessage());
    return respond(
        HttpStatus.BAD_REQUEST, errorId, ApiError.VALIDATION_ERROR, "File too large", request);
  }

  @ExceptionHandler(NotFoundException.class)
  public ResponseEntity<ApiError> handleNotFound(NotFoundException ex, HttpServletRequest request) {
    String errorId = generateErrorId();
    LOGGER.warn("Not found [{}]: {}", errorId, ex.getMessage());
    return respond(HttpStatus.NOT_FOUND, errorId, ApiError.NOT_FOUND, ex.getMessage(), request);
  }

  @ExceptionHandler(ConflictException.class)
  public ResponseEntity<ApiError> handleConflict(ConflictException ex, HttpServletRequest request) {
    String errorId = generateErrorId();
    LOGGER.warn("Conflict [{}]: {}", errorId, ex.getMessage());
    return respond(HttpStatus.CONFLICT, errorId, ApiError.CONFLICT, ex.getMessage(), request);
  }

  @ExceptionHandler(AggregationUnavailableException.class)
  public ResponseEntity<ApiError> handleAggregationUnavailable(
      AggregationUnavailableException ex, HttpServletRequest request) {
    String errorId = generateErrorId();
    LOGGER.warn("Aggregation unavailable [{}]: {}", errorId, ex.getMessage());
    return respond(
        HttpStatus.UNPROCESSABLE_ENTITY,
        errorId,
        ApiError.AGGREGATION_UNAVAILABLE,
        ex.getMessage(),
        request);
  }

  @ExceptionHandler(SpeechSynthesisException.class)
  public ResponseEntity<ApiError> handleSpeechSynthesis(
      SpeechSynthesisException ex, HttpServletRequest request) {
    String errorId = generateErrorId();
    LOGGER.error("Speech synthesis failed [{}]: {}", errorId, ex.getMessage(), ex);
    return respond(
        HttpStatus.BAD_GATEWAY,
        errorId,
        ApiError.UPSTREAM_ERROR,
        "Speech synthesis provider failed",
        request);
  }

  @ExceptionHandler(ObjectStoreException.class)
  public ResponseEntity<ApiError> handleObjectStore(
      ObjectStoreException ex, HttpServletRequest request) {
    String errorId = generateErrorId();
    LOGGER.error("Storage error [{}]: {}", errorId, ex.getMessage(), ex);
    return respond(
        HttpStatus.INTERNAL_SERVER_ERROR,
        errorId,
        ApiError.STORAGE_ERROR,
        "Failed to access storage",
        request);
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ApiError> handleUnexpected(Exception ex, HttpServletRequest request) {
    String errorId = generateErrorId();
    LOGGER.error("Unexpected error [{}]: {}", errorId, ex.getMessage(), ex);
    return respond(
        HttpStatus.INTERNAL_SERVER_ERROR,
        errorId,
        ApiError.INTERNAL_ERROR,
        "An unexpected error occurred",
        request);
  }

  private ResponseEntity<ApiError> respond(
      HttpStatus status, String errorId, String code, String message, HttpServletRequest request) {
    return ResponseEntity.status(status)
        .body(new ApiError(errorId, code, message, request.getRequestURI(), Instant.now()));
  }

  private String generateErrorId() {
    return UUID.randomUUID().toString().substring(0, 8);
  }
}
