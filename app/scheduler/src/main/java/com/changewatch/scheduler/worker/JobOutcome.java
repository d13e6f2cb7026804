package com.changewatch.scheduler.worker;

/** 1 件のジョブの結末。メトリクスとイベントのタグにそのまま使う。 */
public enum JobOutcome {
  /** 別ワーカーが claim 中だったため優先度を下げて積み直した。 */
  DEFERRED,
  /** 削除済みまたは一時停止中で取得しなかった。 */
  SKIPPED,
  UNCHANGED,
  CHANGED,
  /** 初回チェック。基準スナップショットだけ保存した。 */
  BASELINE,
  FILTER_NOT_FOUND,
  FETCH_FAILED,
  NO_TEXT_CONTENT,
  /** 保存に失敗して結果を捨てた。 */
  ABANDONED,
  CRASHED
}
