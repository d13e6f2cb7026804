package com.changewatch.scheduler.api.response;

import com.changewatch.scheduler.model.RetryAttemptRecord;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record RetryAttemptResponse(
    String taskId,
    int attemptNumber,
    Instant timestamp,
    String error,
    boolean willRetry,
    Instant nextAttemptAt) {

  public static RetryAttemptResponse from(RetryAttemptRecord record) {
    return new RetryAttemptResponse(
        record.taskId(),
        record.attemptNumber(),
        record.timestamp(),
        record.error(),
        record.willRetry(),
        record.nextAttemptAt());
  }
}
