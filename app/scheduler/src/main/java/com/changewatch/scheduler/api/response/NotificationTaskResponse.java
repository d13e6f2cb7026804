package com.changewatch.scheduler.api.response;

import com.changewatch.scheduler.model.DeadLetterEntry;
import com.changewatch.scheduler.model.NotificationTask;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;

/** 未配信タスクまたは dead letter の 1 件。dead letter 固有の項目は未配信タスクでは null。 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record NotificationTaskResponse(
    String taskId,
    String watchId,
    String watchUrl,
    String title,
    int attemptCount,
    Instant nextAttemptAt,
    Instant createdAt,
    String lastError,
    Instant failedAt,
    Instant replayedAt) {

  public static NotificationTaskResponse fromPending(NotificationTask task) {
    return new NotificationTaskResponse(
        task.taskId(),
        task.watchId(),
        task.watchUrl(),
        task.title(),
        task.attemptCount(),
        task.nextAttemptAt(),
        task.createdAt(),
        task.lastError(),
        null,
        null);
  }

  public static NotificationTaskResponse fromDeadLetter(DeadLetterEntry entry) {
    final NotificationTask task = entry.task();
    return new NotificationTaskResponse(
        task.taskId(),
        task.watchId(),
        task.watchUrl(),
        task.title(),
        entry.attempts(),
        null,
        task.createdAt(),
        entry.lastError(),
        entry.failedAt(),
        entry.replayedAt());
  }
}
