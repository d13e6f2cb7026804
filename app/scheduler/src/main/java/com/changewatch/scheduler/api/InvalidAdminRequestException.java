/*
 * どこで: Scheduler 管理 API
 * 何を: 管理操作の入力不正を表現する
 * なぜ: ワーカー数の範囲外指定などを 400 応答へ変換するため
 */
package com.changewatch.scheduler.api;

public class InvalidAdminRequestException extends RuntimeException {
  public InvalidAdminRequestException(String message) {
    super(message);
  }
}
