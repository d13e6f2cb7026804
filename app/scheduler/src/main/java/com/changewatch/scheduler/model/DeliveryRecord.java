package com.changewatch.scheduler.model;

import java.time.Instant;
import java.util.List;

/** 配信成功の記録。 */
public record DeliveryRecord(
    String taskId,
    String watchId,
    String watchUrl,
    String title,
    Instant deliveredAt,
    int attemptNumber,
    List<String> targets) {

  public DeliveryRecord {
    targets = targets == null ? List.of() : List.copyOf(targets);
  }
}
