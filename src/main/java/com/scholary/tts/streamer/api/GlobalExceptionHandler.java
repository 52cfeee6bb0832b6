package com.scholary.tts.streamer.api;

import com.scholary.tts.streamer.engine.SynthesisException;
import java.io.IOException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Converts exceptions thrown before a response is committed into {@code {"error": ...}} bodies.
 *
 * <p>Streaming responses that fail after their header has gone out never reach this handler; they
 * end with an error marker instead.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

  private static final Logger LOGGER = LoggerFactory.getLogger(GlobalExceptionHandler.class);

  /** Client error - rejected request (HTTP 400). */
  @ExceptionHandler(InvalidSynthesisRequestException.class)
  ResponseEntity<ApiError> handleInvalidRequest(InvalidSynthesisRequestException ex) {
    LOGGER.warn("Rejected request: {}", ex.getMessage());
    return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(ApiError.of(ex.getMessage()));
  }

  /** Unknown or expired job id (HTTP 404). */
  @ExceptionHandler(AudioNotFoundException.class)
  ResponseEntity<ApiError> handleNotFound(AudioNotFoundException ex) {
    LOGGER.info("Audio not found: jobId={}", ex.getJobId());
    return ResponseEntity.status(HttpStatus.NOT_FOUND).body(ApiError.of(ex.getMessage()));
  }

  /** Client error - bean validation failed on the request body (HTTP 400). */
  @ExceptionHandler(MethodArgumentNotValidException.class)
  ResponseEntity<ApiError> handleInvalidBody(MethodArgumentNotValidException ex) {
    FieldError fieldError = ex.getBindingResult().getFieldError();
    String message =
        fieldError != null && fieldError.getDefaultMessage() != null
            ? fieldError.getDefaultMessage()
            : "Invalid request";
    LOGGER.warn("Rejected request body: {}", message);
    return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(ApiError.of(message));
  }

  /** Client error - body is missing or not JSON (HTTP 400). */
  @ExceptionHandler(HttpMessageNotReadableException.class)
  ResponseEntity<ApiError> handleUnreadable(HttpMessageNotReadableException ex) {
    LOGGER.warn("Unreadable request body: {}", ex.getMessage());
    return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(ApiError.of("Invalid JSON"));
  }

  /** Generation failed on the non-streaming route (HTTP 500). */
  @ExceptionHandler(SynthesisException.class)
  ResponseEntity<ApiError> handleSynthesisFailure(SynthesisException ex) {
    LOGGER.error("Generation failed: {}", ex.getMessage(), ex);
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
        .body(ApiError.of(ex.getMessage()));
  }

  /**
   * Client went away while a response was being written, usually mid-stream. The response is
   * already committed as audio, so there is nothing to send back.
   */
  @ExceptionHandler(IOException.class)
  ResponseEntity<ApiError> handleClientDisconnect(IOException ex) {
    LOGGER.debug("Client disconnected: {}", ex.getMessage());
    return null;
  }

  /** Catch-all for unexpected errors (HTTP 500). */
  @ExceptionHandler(Exception.class)
  ResponseEntity<ApiError> handleUnexpected(Exception ex) {
    LOGGER.error("Unexpected error", ex);
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
        .body(ApiError.of("An unexpected error occurred"));
  }
}
