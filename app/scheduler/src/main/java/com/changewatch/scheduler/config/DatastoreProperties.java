/*
 * どこで: Scheduler 設定バインド
 * 何を: データストア (watch 定義・スナップショット・監査記録) の保存先を保持する
 * なぜ: 永続化先ディレクトリとフィルタ失敗通知の閾値を外部化するため
 */
package com.changewatch.scheduler.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "watch.datastore")
public record DatastoreProperties(
    String path, Integer filterFailureThreshold, Duration flushInterval) {

  public DatastoreProperties {
    path = path == null || path.isBlank() ? "./datastore" : path;
    filterFailureThreshold = filterFailureThreshold == null ? 6 : filterFailureThreshold;
    flushInterval = flushInterval == null ? Duration.ofSeconds(30) : flushInterval;
  }
}
