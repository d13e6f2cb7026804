package com.changewatch.scheduler.api.response;

import com.changewatch.scheduler.model.RetryConfig;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record RetryConfigResponse(
    int retryCount,
    long retryDelaySeconds,
    List<Long> retryDelays,
    int totalAttempts,
    long totalTimeSeconds) {

  public static RetryConfigResponse from(RetryConfig config) {
    return new RetryConfigResponse(
        config.retryCount(),
        config.retryDelaySeconds(),
        config.retryDelays(),
        config.totalAttempts(),
        config.totalTimeSeconds());
  }
}
