package com.changewatch.scheduler.repository;

/** 通知キューの保存バックエンドで発生した I/O 失敗。 */
public class NotificationQueueStorageException extends RuntimeException {

  public NotificationQueueStorageException(String message, Throwable cause) {
    super(message, cause);
  }
}
