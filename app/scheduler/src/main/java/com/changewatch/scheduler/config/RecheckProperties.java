/*
 * どこで: Scheduler 設定バインド
 * 何を: 再チェック投入 (ticker) の間隔と既定チェック間隔を保持する
 * なぜ: watch ごとの上書きが無い場合の再チェック周期を外部化するため
 */
package com.changewatch.scheduler.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "watch.recheck")
public record RecheckProperties(
    Boolean enabled, Duration interval, Duration defaultCheckInterval, Integer priority) {

  public RecheckProperties {
    enabled = enabled == null || enabled;
    interval = interval == null ? Duration.ofSeconds(1) : interval;
    defaultCheckInterval =
        defaultCheckInterval == null ? Duration.ofHours(3) : defaultCheckInterval;
    priority = priority == null ? 5 : priority;
  }
}
