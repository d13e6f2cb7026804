package com.changewatch.scheduler.model;

import java.util.List;

/**
 * 丸め後の実効再送設定。
 *
 * @param retryCount 初回を除く再送回数
 * @param retryDelaySeconds 基準遅延 (秒)
 * @param retryDelays 各再送までの待ち時間 (秒)
 * @param totalAttempts 初回を含む試行回数
 * @param totalTimeSeconds dead letter になるまでの最悪待ち時間 (秒)
 */
public record RetryConfig(
    int retryCount,
    long retryDelaySeconds,
    List<Long> retryDelays,
    int totalAttempts,
    long totalTimeSeconds) {

  public RetryConfig {
    retryDelays = retryDelays == null ? List.of() : List.copyOf(retryDelays);
  }
}
