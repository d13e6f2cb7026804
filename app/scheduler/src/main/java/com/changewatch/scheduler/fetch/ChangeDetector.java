package com.changewatch.scheduler.fetch;

import com.changewatch.scheduler.model.Watch;

/**
 * 取得結果と前回スナップショットから変化を判定する processor。
 *
 * <p>初回チェック (履歴なし) で変化ありとするかは呼び出し側が決める。実装は純粋な比較だけを
 * 行い、データストアへは書き込まない。
 */
public interface ChangeDetector {

  /** watch の processor 設定値。 */
  String processor();

  DetectionResult detectChange(String previousSnapshot, FetchedContent current, Watch watch);
}
