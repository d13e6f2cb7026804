/*
 * どこで: Scheduler 管理 API
 * 何を: dead letter 未検出を表現する
 * なぜ: 再投入 API の 404 応答へ変換するため
 */
package com.changewatch.scheduler.api;

public class DeadLetterNotFoundException extends RuntimeException {
  public DeadLetterNotFoundException(String taskId) {
    super("dead letter not found: " + taskId);
  }
}
