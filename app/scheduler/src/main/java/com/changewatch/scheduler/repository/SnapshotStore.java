package com.changewatch.scheduler.repository;

import java.util.Optional;

/** スナップショット本文とスクリーンショットの保存先。 */
public interface SnapshotStore {

  /**
   * 本文を保存し、履歴に記録する参照を返す。
   *
   * @throws WatchPersistenceException 書き込めなかった場合
   */
  String save(String watchId, long timestamp, String content);

  Optional<String> load(String snapshotRef);

  void saveScreenshot(String watchId, byte[] image);

  void deleteAll(String watchId);
}
