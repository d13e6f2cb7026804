/*
 * どこで: Scheduler ドメインモデル
 * 何を: 再チェック要求 1 件 (watch ID + 優先度 + 採番順 + 運用者による強制指定)
 * なぜ: 優先度昇順・同値は FIFO で取り出す順序をデータ自身に持たせるため
 */
package com.changewatch.scheduler.model;

import java.util.Comparator;

public record QueueItem(String watchId, int priority, long sequence, boolean forced)
    implements Comparable<QueueItem> {

  public QueueItem(String watchId, int priority, long sequence) {
    this(watchId, priority, sequence, false);
  }

  private static final Comparator<QueueItem> ORDER =
      Comparator.comparingInt(QueueItem::priority).thenComparingLong(QueueItem::sequence);

  @Override
  public int compareTo(QueueItem other) {
    return ORDER.compare(this, other);
  }
}
