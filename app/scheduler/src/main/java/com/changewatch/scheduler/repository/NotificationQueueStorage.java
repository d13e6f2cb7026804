package com.changewatch.scheduler.repository;

import com.changewatch.scheduler.model.DeadLetterEntry;
import com.changewatch.scheduler.model.NotificationTask;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * 通知再送キューの保存先。
 *
 * <p>実装は {@link QueueStorageKind} ごとに 1 つで、起動時に選ばれる。プロセスが落ちても
 * 未配信タスクと dead letter が残ることを保証する。配信中のタスクは lease を持ち、lease が
 * 切れたものは再び {@link #claimDue} の対象になる。
 *
 * <p>失敗は {@link NotificationQueueStorageException} で通知する。
 */
public interface NotificationQueueStorage {

  QueueStorageKind kind();

  /** 未配信タスクとして保存する。同じ taskId があれば置き換える。 */
  void save(NotificationTask task);

  /**
   * 配信予定時刻を過ぎ、lease を持たない (または lease 切れの) タスクを取り出して lease を付ける。
   *
   * @param now 現在時刻
   * @param leaseUntil 付与する lease の期限
   * @param limit 最大件数
   * @return 予定時刻の早い順
   */
  List<NotificationTask> claimDue(Instant now, Instant leaseUntil, int limit);

  /** 次回予定時刻を更新し lease を外す。 */
  void reschedule(NotificationTask task);

  /** 配信済みとして未配信一覧から外す。 */
  void complete(String taskId);

  /** 未配信一覧から外し dead letter として保存する。 */
  void moveToDeadLetter(DeadLetterEntry entry);

  /** dead letter を置き換える (再投入済みの印を付けるときなど)。 */
  void saveDeadLetter(DeadLetterEntry entry);

  /** 失敗時刻の新しい順。 */
  List<DeadLetterEntry> listDeadLetters();

  Optional<DeadLetterEntry> findDeadLetter(String taskId);

  boolean deleteDeadLetter(String taskId);

  int purgeDeadLettersOlderThan(Instant threshold);

  /** 予定時刻の早い順。 */
  List<NotificationTask> findPending();

  int countPending();

  /** 未配信と dead letter を全て消す。消した件数を返す。 */
  int clearAll();
}
