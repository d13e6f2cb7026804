/*
 * どこで: Scheduler データストア
 * 何を: watch/スナップショットの永続化失敗を表現する
 * なぜ: ワーカーがジョブを放棄すべき致命的失敗として他の失敗と区別するため
 */
package com.changewatch.scheduler.repository;

public class WatchPersistenceException extends RuntimeException {

  public WatchPersistenceException(String message, Throwable cause) {
    super(message, cause);
  }
}
