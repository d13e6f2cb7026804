package com.changewatch.scheduler.fetch;

/** 差分判定の結果種別。チェックサム一致などの「何もしない」結果も例外ではなく値で返す。 */
public enum DetectionStatus {
  /** 前回とチェックサムが同じ。差分・保存・通知を省略する。 */
  CHECKSUM_UNCHANGED,
  UNCHANGED,
  CHANGED,
  /** 期待する文言が見つからない。ソフトエラーとして記録する。 */
  FILTER_NOT_FOUND,
  /** 応答はあったがテキストを抽出できなかった。 */
  NO_TEXT_CONTENT
}
