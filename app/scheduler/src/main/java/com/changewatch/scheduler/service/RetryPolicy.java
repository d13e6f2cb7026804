/*
 * どこで: Notification サービス層
 * 何を: 再送回数と基準遅延を許容範囲に丸め、指数バックオフの待ち時間を計算する
 * なぜ: 設定ミスで無限再送や極端な間隔にならないようにし、待ち時間を一箇所で決めるため
 */
package com.changewatch.scheduler.service;

import com.changewatch.scheduler.config.NotificationRetryProperties;
import com.changewatch.scheduler.model.RetryConfig;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class RetryPolicy {

  static final int MIN_RETRY_COUNT = 0;
  static final int MAX_RETRY_COUNT = 10;
  static final Duration MIN_RETRY_DELAY = Duration.ofSeconds(10);
  static final Duration MAX_RETRY_DELAY = Duration.ofSeconds(3600);

  private static final Logger logger = LoggerFactory.getLogger(RetryPolicy.class);

  private final int retryCount;
  private final Duration baseDelay;

  public RetryPolicy(NotificationRetryProperties properties) {
    this.retryCount = clampCount(properties.retryCount());
    this.baseDelay = clampDelay(properties.retryDelay());
  }

  public int retryCount() {
    return retryCount;
  }

  public Duration baseDelay() {
    return baseDelay;
  }

  /** 初回を含む試行回数。 */
  public int totalAttempts() {
    return retryCount + 1;
  }

  /**
   * n 回目の再送 (1 始まり) までの待ち時間。base * 2^(n-1)。
   */
  public Duration delayForRetry(int retryNumber) {
    if (retryNumber < 1) {
      throw new IllegalArgumentException("retryNumber must be >= 1");
    }
    return baseDelay.multipliedBy(1L << (retryNumber - 1));
  }

  /** 失敗した試行 (1 始まり) の後にまだ再送するなら true。 */
  public boolean shouldRetryAfter(int failedAttemptNumber) {
    return failedAttemptNumber <= retryCount;
  }

  public List<Duration> delays() {
    final List<Duration> delays = new ArrayList<>(retryCount);
    for (int retry = 1; retry <= retryCount; retry++) {
      delays.add(delayForRetry(retry));
    }
    return delays;
  }

  public Duration totalTime() {
    return delays().stream().reduce(Duration.ZERO, Duration::plus);
  }

  public RetryConfig toRetryConfig() {
    return new RetryConfig(
        retryCount,
        baseDelay.toSeconds(),
        delays().stream().map(Duration::toSeconds).toList(),
        totalAttempts(),
        totalTime().toSeconds());
  }

  private static int clampCount(int configured) {
    final int clamped = Math.max(MIN_RETRY_COUNT, Math.min(MAX_RETRY_COUNT, configured));
    if (clamped != configured) {
      logger.warn("notification retry count out of range, clamped configured={} applied={}",
          configured, clamped);
    }
    return clamped;
  }

  private static Duration clampDelay(Duration configured) {
    Duration clamped = configured;
    if (configured.compareTo(MIN_RETRY_DELAY) < 0) {
      clamped = MIN_RETRY_DELAY;
    } else if (configured.compareTo(MAX_RETRY_DELAY) > 0) {
      clamped = MAX_RETRY_DELAY;
    }
    if (!clamped.equals(configured)) {
      logger.warn("notification retry delay out of range, clamped configured={} applied={}",
          configured, clamped);
    }
    return clamped;
  }
}
