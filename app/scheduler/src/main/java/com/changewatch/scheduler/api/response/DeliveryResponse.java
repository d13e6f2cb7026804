package com.changewatch.scheduler.api.response;

import com.changewatch.scheduler.model.DeliveryRecord;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record DeliveryResponse(
    String taskId,
    String watchId,
    String watchUrl,
    String title,
    Instant deliveredAt,
    int attemptNumber,
    int targetCount) {

  public static DeliveryResponse from(DeliveryRecord record) {
    return new DeliveryResponse(
        record.taskId(),
        record.watchId(),
        record.watchUrl(),
        record.title(),
        record.deliveredAt(),
        record.attemptNumber(),
        record.targets().size());
  }
}
