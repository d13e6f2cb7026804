/*
 * どこで: 共通ユーティリティ
 * 何を: Instant とエポックミリ秒を相互変換する
 * なぜ: SQLite の INTEGER 列と Redis の sorted set スコアで同じ時刻表現を使うため
 */
package com.changewatch.common;

import java.time.Instant;

public final class EpochMillis {
  private EpochMillis() {}

  // 前提: null は「未設定」を表すのでそのまま null を返す
  public static Long toEpochMillis(Instant instant) {
    return instant == null ? null : instant.toEpochMilli();
  }

  public static Instant toInstant(Long epochMillis) {
    return epochMillis == null ? null : Instant.ofEpochMilli(epochMillis);
  }

  public static double toScore(Instant instant) {
    return instant.toEpochMilli();
  }
}
