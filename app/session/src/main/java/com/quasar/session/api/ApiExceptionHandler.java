package com.quasar.session.api;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class ApiExceptionHandler {

  private static final Logger logger = LoggerFactory.getLogger(ApiExceptionHandler.class);

  @ExceptionHandler(SessionRequestException.class)
  public ResponseEntity<ApiErrorResponse> handleSessionError(SessionRequestException ex) {
    return ResponseEntity.status(statusOf(ex))
        .body(new ApiErrorResponse(ex.code(), ex.getMessage()));
  }

  @ExceptionHandler(InvalidSessionRequestException.class)
  public ResponseEntity<ApiErrorResponse> handleInvalidRequest(InvalidSessionRequestException ex) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(new ApiErrorResponse("SESSION_BAD_REQUEST", ex.getMessage()));
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ApiErrorResponse> handleValidation(MethodArgumentNotValidException ex) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(new ApiErrorResponse("SESSION_VALIDATION_ERROR", "request validation failed"));
  }

  @ExceptionHandler(RuntimeException.class)
  public ResponseEntity<ApiErrorResponse> handleRuntime(RuntimeException ex) {
    logger.error("unhandled session api error", ex);
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
        .body(new ApiErrorResponse("SESSION_INTERNAL_ERROR", ex.getMessage()));
  }

  private static HttpStatus statusOf(SessionRequestException ex) {
    return switch (ex.kind().category()) {
      case CAPACITY -> HttpStatus.SERVICE_UNAVAILABLE;
      case LOOKUP -> HttpStatus.NOT_FOUND;
      case CONFLICT, STATE -> HttpStatus.CONFLICT;
      case VALIDATION -> HttpStatus.BAD_REQUEST;
    };
  }
}
