/*
 * どこで: Scheduler 設定バインド
 * 何を: チェックワーカーのプール規模・再起動閾値・ジョブキュー設定を保持する
 * なぜ: ワーカー数や再起動間隔を環境変数で調整し、起動時に妥当性を検証するため
 */
package com.changewatch.scheduler.config;

import jakarta.validation.constraints.AssertTrue;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "watch.worker")
@Validated
public record WatchWorkerProperties(
    Integer count,
    Integer maxJobs,
    Duration maxRuntime,
    Duration dequeueTimeout,
    Duration enqueueTimeout,
    Integer queueCapacity,
    Duration deferDelay,
    Integer deferPriorityMultiplier,
    Integer deferPriorityFloor,
    Duration crashRestartDelay,
    Duration healthCheckInterval) {

  public WatchWorkerProperties {
    count = count == null ? 10 : count;
    maxJobs = maxJobs == null ? 10 : maxJobs;
    maxRuntime = maxRuntime == null ? Duration.ofHours(1) : maxRuntime;
    dequeueTimeout = dequeueTimeout == null ? Duration.ofSeconds(1) : dequeueTimeout;
    enqueueTimeout = enqueueTimeout == null ? Duration.ofSeconds(5) : enqueueTimeout;
    queueCapacity = queueCapacity == null ? 0 : queueCapacity;
    deferDelay = deferDelay == null ? Duration.ofSeconds(10) : deferDelay;
    deferPriorityMultiplier = deferPriorityMultiplier == null ? 10 : deferPriorityMultiplier;
    deferPriorityFloor = deferPriorityFloor == null ? 1000 : deferPriorityFloor;
    crashRestartDelay = crashRestartDelay == null ? Duration.ofSeconds(5) : crashRestartDelay;
    healthCheckInterval =
        healthCheckInterval == null ? Duration.ofSeconds(60) : healthCheckInterval;
  }

  @AssertTrue(message = "watch.worker.count must be between 1 and 50")
  public boolean isCountInRange() {
    return count >= 1 && count <= 50;
  }

  @AssertTrue(message = "watch.worker.max-jobs must be positive")
  public boolean isMaxJobsPositive() {
    return maxJobs > 0;
  }

  @AssertTrue(message = "watch.worker.queue-capacity must not be negative")
  public boolean isQueueCapacityValid() {
    // 0 は上限なし
    return queueCapacity >= 0;
  }

  @AssertTrue(message = "watch.worker durations must be positive")
  public boolean isDurationsPositive() {
    return isPositiveDuration(maxRuntime)
        && isPositiveDuration(dequeueTimeout)
        && isPositiveDuration(enqueueTimeout)
        && isPositiveDuration(healthCheckInterval);
  }

  private boolean isPositiveDuration(Duration duration) {
    return duration != null && !duration.isZero() && !duration.isNegative();
  }
}
