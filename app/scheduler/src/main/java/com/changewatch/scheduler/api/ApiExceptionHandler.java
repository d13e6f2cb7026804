package com.changewatch.scheduler.api;

import com.changewatch.scheduler.repository.NotificationQueueStorageException;
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

  @ExceptionHandler(InvalidAdminRequestException.class)
  public ResponseEntity<ApiErrorResponse> handleInvalidRequest(InvalidAdminRequestException ex) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(new ApiErrorResponse("ADMIN_BAD_REQUEST", ex.getMessage()));
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ApiErrorResponse> handleValidation(MethodArgumentNotValidException ex) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(new ApiErrorResponse("ADMIN_VALIDATION_ERROR", "request validation failed"));
  }

  @ExceptionHandler(WatchNotFoundException.class)
  public ResponseEntity<ApiErrorResponse> handleWatchNotFound(WatchNotFoundException ex) {
    return ResponseEntity.status(HttpStatus.NOT_FOUND)
        .body(new ApiErrorResponse("WATCH_NOT_FOUND", ex.getMessage()));
  }

  @ExceptionHandler(DeadLetterNotFoundException.class)
  public ResponseEntity<ApiErrorResponse> handleDeadLetterNotFound(DeadLetterNotFoundException ex) {
    return ResponseEntity.status(HttpStatus.NOT_FOUND)
        .body(new ApiErrorResponse("DEAD_LETTER_NOT_FOUND", ex.getMessage()));
  }

  @ExceptionHandler(NotificationQueueStorageException.class)
  public ResponseEntity<ApiErrorResponse> handleQueueStorage(NotificationQueueStorageException ex) {
    logger.error("notification queue storage failed during admin request", ex);
    return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
        .body(new ApiErrorResponse("NOTIFICATION_QUEUE_UNAVAILABLE", ex.getMessage()));
  }

  @ExceptionHandler(RuntimeException.class)
  public ResponseEntity<ApiErrorResponse> handleRuntime(RuntimeException ex) {
    logger.error("admin request failed", ex);
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
        .body(new ApiErrorResponse("ADMIN_INTERNAL_ERROR", ex.getMessage()));
  }
}
