package com.changewatch.scheduler.api.response;

import com.changewatch.scheduler.worker.HealthReport;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record HealthReportResponse(
    String status, int expected, int alive, List<Integer> restartedWorkerIds) {

  public static HealthReportResponse from(HealthReport report) {
    return new HealthReportResponse(
        report.status().name(), report.expected(), report.alive(), report.restartedWorkerIds());
  }
}
