/*
 * どこで: Notification 設定バインド
 * 何を: 通知キューの保存バックエンド選択と保存先を保持する
 * なぜ: 起動時に 1 度だけバックエンドを決め、以降は実装を意識させないため
 */
package com.changewatch.scheduler.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "notification.queue")
public record NotificationQueueProperties(String storage, String path, String redisKeyPrefix) {

  public NotificationQueueProperties {
    storage = storage == null || storage.isBlank() ? "file" : storage;
    path = path == null || path.isBlank() ? "./datastore/notification-queue" : path;
    redisKeyPrefix = redisKeyPrefix == null || redisKeyPrefix.isBlank() ? "cw:nq:" : redisKeyPrefix;
  }
}
