package com.changewatch.scheduler.worker;

import java.util.List;

public record HealthReport(
    HealthStatus status, int expected, int alive, List<Integer> restartedWorkerIds) {

  public HealthReport {
    restartedWorkerIds = restartedWorkerIds == null ? List.of() : List.copyOf(restartedWorkerIds);
  }
}
