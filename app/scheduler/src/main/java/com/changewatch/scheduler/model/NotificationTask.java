/*
 * どこで: Notification ドメインモデル
 * 何を: 再送キューに載る通知タスク
 * なぜ: タイトル/本文は投入時に固定し、配信先と書式は試行ごとに再解決するため
 */
package com.changewatch.scheduler.model;

import java.time.Instant;

public record NotificationTask(
    String taskId,
    String watchId,
    String title,
    String body,
    String watchUrl,
    String oldSnapshot,
    String newSnapshot,
    int attemptCount,
    Instant nextAttemptAt,
    Instant createdAt,
    Instant leaseUntil,
    String lastError,
    boolean replayRequested) {

  public static NotificationTask create(
      String taskId,
      String watchId,
      String title,
      String body,
      String watchUrl,
      String oldSnapshot,
      String newSnapshot,
      Instant now) {
    return new NotificationTask(
        taskId, watchId, title, body, watchUrl, oldSnapshot, newSnapshot, 0, now, now, null, null,
        false);
  }

  public NotificationTask leased(Instant until) {
    return new NotificationTask(
        taskId, watchId, title, body, watchUrl, oldSnapshot, newSnapshot, attemptCount,
        nextAttemptAt, createdAt, until, lastError, replayRequested);
  }

  public NotificationTask retryAt(int attempts, Instant nextAttempt, String error) {
    return new NotificationTask(
        taskId, watchId, title, body, watchUrl, oldSnapshot, newSnapshot, attempts, nextAttempt,
        createdAt, null, error, replayRequested);
  }

  /** dead letter から再投入する際の状態。試行回数は 0 から数え直す。 */
  public NotificationTask replay(Instant now) {
    return new NotificationTask(
        taskId, watchId, title, body, watchUrl, oldSnapshot, newSnapshot, 0, now, createdAt,
        null, lastError, true);
  }
}
