/*
 * どこで: Scheduler 管理 API
 * 何を: watch 未検出を表現する
 * なぜ: 参照/再チェック API の 404 応答へ変換するため
 */
package com.changewatch.scheduler.api;

public class WatchNotFoundException extends RuntimeException {
  public WatchNotFoundException(String uuid) {
    super("watch not found: " + uuid);
  }
}
