/*
 * どこで: Notification 設定バインド
 * 何を: 再送回数・基準遅延・配信ポーリング設定を保持する
 * なぜ: 運用パラメータを外部化するため (範囲外の値は RetryPolicy で丸める)
 */
package com.changewatch.scheduler.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "notification.retry")
public record NotificationRetryProperties(
    Integer retryCount,
    Duration retryDelay,
    Duration pollInterval,
    Integer batchSize,
    Duration lease,
    Integer errorMessageMaxLength) {

  public NotificationRetryProperties {
    retryCount = retryCount == null ? 3 : retryCount;
    retryDelay = retryDelay == null ? Duration.ofSeconds(60) : retryDelay;
    pollInterval = pollInterval == null ? Duration.ofSeconds(1) : pollInterval;
    batchSize = batchSize == null ? 20 : batchSize;
    lease = lease == null ? Duration.ofMinutes(5) : lease;
    errorMessageMaxLength = errorMessageMaxLength == null ? 1000 : errorMessageMaxLength;
  }
}
