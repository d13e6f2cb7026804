/*
 * どこで: Scheduler 管理 API レスポンス DTO
 * 何を: watch の設定とチェック状態を返す
 * なぜ: 運用者が最後のエラーや通知失敗を API から確認できるようにするため
 */
package com.changewatch.scheduler.api.response;

import com.changewatch.scheduler.model.Watch;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record WatchResponse(
    String uuid,
    String url,
    String fetchBackend,
    String processor,
    Long checkIntervalSeconds,
    boolean paused,
    boolean notificationMuted,
    List<String> notificationUrls,
    String notificationFormat,
    Instant lastChecked,
    Instant lastChanged,
    String lastError,
    int historyCount,
    long checkCount,
    int consecutiveFilterFailures,
    int notificationAlertCount,
    String lastNotificationError) {

  public static WatchResponse from(Watch watch) {
    return new WatchResponse(
        watch.uuid(),
        watch.url(),
        watch.fetchBackend(),
        watch.processor(),
        watch.checkInterval() == null ? null : watch.checkInterval().toSeconds(),
        watch.paused(),
        watch.notificationMuted(),
        watch.notificationUrls(),
        watch.notificationFormat(),
        watch.lastChecked(),
        watch.lastChanged(),
        watch.lastError(),
        watch.history().size(),
        watch.checkCount(),
        watch.consecutiveFilterFailures(),
        watch.notificationAlertCount(),
        watch.lastNotificationError());
  }
}
