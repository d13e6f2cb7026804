package com.changewatch.scheduler.fetch;

/**
 * 差分判定の結果。
 *
 * @param status 判定種別
 * @param checksum 抽出テキストの MD5 (判定できなかった場合は null)
 * @param text 抽出テキスト。スナップショットとして保存する成果物
 */
public record DetectionResult(DetectionStatus status, String checksum, String text) {

  public static DetectionResult of(DetectionStatus status, String checksum, String text) {
    return new DetectionResult(status, checksum, text);
  }

  public static DetectionResult failed(DetectionStatus status) {
    return new DetectionResult(status, null, null);
  }

  public boolean changed() {
    return status == DetectionStatus.CHANGED;
  }
}
