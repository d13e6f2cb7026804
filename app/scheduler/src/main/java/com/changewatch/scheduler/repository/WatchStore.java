package com.changewatch.scheduler.repository;

import com.changewatch.scheduler.model.NotificationSettings;
import com.changewatch.scheduler.model.Watch;
import java.util.List;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * watch 定義と全体通知設定のストア。
 *
 * <p>書き込みはレコード単位のロックで read-modify-write を直列化する。このロックは
 * {@link com.changewatch.scheduler.queue.ClaimRegistry} とは独立しており、両者を入れ子にしない。
 */
public interface WatchStore {

  Optional<Watch> find(String uuid);

  List<Watch> findAll();

  /** 新規作成または置き換え。 */
  Watch save(Watch watch);

  boolean delete(String uuid);

  /**
   * レコードロック下で更新する。
   *
   * @param uuid 対象 watch
   * @param mutation 現在値から新しい値を作る関数
   * @return 更新後の値。watch が存在しなければ empty
   */
  Optional<Watch> update(String uuid, UnaryOperator<Watch> mutation);

  NotificationSettings notificationSettings();

  void updateNotificationSettings(NotificationSettings settings);
}
