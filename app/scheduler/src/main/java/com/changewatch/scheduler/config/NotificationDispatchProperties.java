/*
 * どこで: Notification 設定バインド
 * 何を: 配信バックエンドとタイムアウトを保持する
 * なぜ: ローカルではログ出力、本番では webhook 送信と切り替えるため
 */
package com.changewatch.scheduler.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "notification.dispatch")
public record NotificationDispatchProperties(
    String backend, Duration timeout, String failurePrefix) {

  public NotificationDispatchProperties {
    backend = backend == null || backend.isBlank() ? "log" : backend;
    timeout = timeout == null ? Duration.ofSeconds(10) : timeout;
    failurePrefix = failurePrefix == null || failurePrefix.isBlank() ? "fail" : failurePrefix;
  }
}
