/*
 * どこで: Notification キュー保存
 * 何を: 保存バックエンドの種別と設定文字列の対応を定義する
 * なぜ: 起動時に 1 度だけ明示的に選び、実行時の型判定に頼らないため
 */
package com.changewatch.scheduler.repository;

import java.util.Locale;

public enum QueueStorageKind {
  FILE,
  EMBEDDED,
  REMOTE;

  /** {@code file}/{@code embedded}/{@code remote} と別名 {@code sqlite}/{@code redis} を受け付ける。 */
  public static QueueStorageKind fromValue(String value) {
    if (value == null || value.isBlank()) {
      return FILE;
    }
    return switch (value.trim().toLowerCase(Locale.ROOT)) {
      case "file" -> FILE;
      case "embedded", "sqlite" -> EMBEDDED;
      case "remote", "redis" -> REMOTE;
      default -> throw new IllegalArgumentException("unknown notification queue storage: " + value);
    };
  }
}
