/*
 * どこで: Scheduler 設定バインド
 * 何を: 取得バックエンドの既定値・タイムアウト・ブラウザサービスの URL を保持する
 * なぜ: watch が取得方式を指定しない場合の既定と接続先を環境ごとに変えるため
 */
package com.changewatch.scheduler.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "watch.fetch")
public record FetchProperties(
    String defaultBackend, Duration timeout, String browserBaseUrl, String userAgent) {

  public FetchProperties {
    defaultBackend = defaultBackend == null || defaultBackend.isBlank() ? "http" : defaultBackend;
    timeout = timeout == null ? Duration.ofSeconds(45) : timeout;
    browserBaseUrl =
        browserBaseUrl == null || browserBaseUrl.isBlank()
            ? "http://browserless:3000"
            : browserBaseUrl;
    userAgent = userAgent == null || userAgent.isBlank() ? "change-watch/0.1" : userAgent;
  }
}
