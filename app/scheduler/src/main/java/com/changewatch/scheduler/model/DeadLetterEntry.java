/*
 * どこで: Notification ドメインモデル
 * 何を: 再送を使い切った通知タスク
 * なぜ: 運用者が内容を確認し、個別/一括で再投入できるようにするため
 */
package com.changewatch.scheduler.model;

import java.time.Instant;

public record DeadLetterEntry(
    NotificationTask task, Instant failedAt, String lastError, int attempts, Instant replayedAt) {

  public String taskId() {
    return task.taskId();
  }

  public DeadLetterEntry markReplayed(Instant now) {
    return new DeadLetterEntry(task, failedAt, lastError, attempts, now);
  }
}
