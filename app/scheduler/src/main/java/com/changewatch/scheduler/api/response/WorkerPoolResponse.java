package com.changewatch.scheduler.api.response;

import com.changewatch.scheduler.model.WorkerStatus;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record WorkerPoolResponse(int targetCount, int workerCount, List<Worker> workers) {

  public static WorkerPoolResponse of(int targetCount, List<WorkerStatus> statuses) {
    return new WorkerPoolResponse(
        targetCount,
        statuses.size(),
        statuses.stream()
            .map(
                status ->
                    new Worker(
                        status.workerId(),
                        status.alive(),
                        status.currentWatchId(),
                        status.jobsProcessed(),
                        status.uptime().toSeconds()))
            .toList());
  }

  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  public record Worker(
      int workerId, boolean alive, String currentWatchId, int jobsProcessed, long uptimeSeconds) {}
}
