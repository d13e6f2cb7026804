package com.changewatch.scheduler.api;

import static org.assertj.core.api.Assertions.assertThat;

import com.changewatch.scheduler.repository.NotificationQueueStorageException;
import java.io.IOException;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.MethodArgumentNotValidException;

class ApiExceptionHandlerTest {

  private final ApiExceptionHandler handler = new ApiExceptionHandler();

  @Test
  void handleInvalidRequestReturns400() {
    final var response = handler.handleInvalidRequest(new InvalidAdminRequestException("bad"));

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
    assertThat(response.getBody()).isEqualTo(new ApiErrorResponse("ADMIN_BAD_REQUEST", "bad"));
  }

  @Test
  void handleValidationReturns400() {
    final var response = handler.handleValidation((MethodArgumentNotValidException) null);

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
    assertThat(response.getBody().code()).isEqualTo("ADMIN_VALIDATION_ERROR");
  }

  @Test
  void handleWatchNotFoundReturns404() {
    final var response = handler.handleWatchNotFound(new WatchNotFoundException("w1"));

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
    assertThat(response.getBody().message()).isEqualTo("watch not found: w1");
  }

  @Test
  void handleDeadLetterNotFoundReturns404() {
    final var response = handler.handleDeadLetterNotFound(new DeadLetterNotFoundException("t1"));

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
    assertThat(response.getBody().code()).isEqualTo("DEAD_LETTER_NOT_FOUND");
  }

  @Test
  void handleQueueStorageReturns503() {
    final var response =
        handler.handleQueueStorage(
            new NotificationQueueStorageException("disk full", new IOException("disk full")));

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
    assertThat(response.getBody().code()).isEqualTo("NOTIFICATION_QUEUE_UNAVAILABLE");
  }

  @Test
  void handleRuntimeReturns500() {
    final var response = handler.handleRuntime(new RuntimeException("oops"));

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
    assertThat(response.getBody().code()).isEqualTo("ADMIN_INTERNAL_ERROR");
  }
}
