/*
 * どこで: Scheduler ドメインモデル
 * 何を: 全体設定側の通知先と書式
 * なぜ: watch 側に通知先が無い場合のフォールバックとして毎回再解決するため
 */
package com.changewatch.scheduler.model;

import java.util.List;

public record NotificationSettings(List<String> notificationUrls, String notificationFormat) {

  public NotificationSettings {
    notificationUrls = notificationUrls == null ? List.of() : List.copyOf(notificationUrls);
    notificationFormat =
        notificationFormat == null || notificationFormat.isBlank() ? "text" : notificationFormat;
  }

  public static NotificationSettings empty() {
    return new NotificationSettings(List.of(), "text");
  }
}
