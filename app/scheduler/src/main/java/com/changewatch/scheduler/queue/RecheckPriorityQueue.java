/*
 * どこで: Scheduler ジョブキュー
 * 何を: 再チェック要求を優先度昇順・同値 FIFO で保持するスレッドセーフなキュー
 * なぜ: ticker とワーカー (衝突時の再投入) の双方から同時に投入されるため
 */
package com.changewatch.scheduler.queue;

import com.changewatch.scheduler.config.WatchWorkerProperties;
import com.changewatch.scheduler.model.QueueItem;
import com.google.common.annotations.VisibleForTesting;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.PriorityQueue;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

@Component
public class RecheckPriorityQueue {

  private static final Logger logger = LoggerFactory.getLogger(RecheckPriorityQueue.class);

  private final ReentrantLock lock = new ReentrantLock();
  private final Condition notEmpty = lock.newCondition();
  private final Condition notFull = lock.newCondition();
  private final PriorityQueue<QueueItem> items = new PriorityQueue<>();
  // contains() を O(1) にするための watch ID ごとの件数
  private final Map<String, Integer> queuedCounts = new HashMap<>();
  private final int capacity;
  private final Duration enqueueTimeout;
  private long nextSequence;

  @Autowired
  public RecheckPriorityQueue(WatchWorkerProperties properties) {
    this(properties.queueCapacity(), properties.enqueueTimeout());
  }

  @VisibleForTesting
  RecheckPriorityQueue(int capacity, Duration enqueueTimeout) {
    this.capacity = capacity;
    this.enqueueTimeout = enqueueTimeout;
  }

  /**
   * 再チェック要求を投入する。
   *
   * <p>容量上限がある場合は {@code enqueue-timeout} まで空きを待つ。待ち切れなかった場合は
   * error ログを残して false を返す (呼び出し側へ例外は投げない)。
   *
   * @param watchId 対象 watch
   * @param priority 小さいほど優先
   * @return 投入できたら true
   */
  public boolean enqueue(String watchId, int priority) {
    return enqueue(watchId, priority, false);
  }

  /**
   * {@code forced} の要求は一時停止中の watch でも取得し、チェックサム一致による省略もしない。
   */
  public boolean enqueue(String watchId, int priority, boolean forced) {
    if (watchId == null || watchId.isBlank()) {
      throw new IllegalArgumentException("watchId is required");
    }
    long remainingNanos = enqueueTimeout.toNanos();
    lock.lock();
    try {
      while (isFull()) {
        if (remainingNanos <= 0) {
          logger.error(
              "recheck queue full, enqueue gave up watchId={} priority={} size={}",
              watchId,
              priority,
              items.size());
          return false;
        }
        remainingNanos = notFull.awaitNanos(remainingNanos);
      }
      final QueueItem item = new QueueItem(watchId, priority, nextSequence++, forced);
      items.add(item);
      queuedCounts.merge(watchId, 1, Integer::sum);
      notEmpty.signal();
      return true;
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      logger.error("recheck enqueue interrupted watchId={} priority={}", watchId, priority, ex);
      return false;
    } finally {
      lock.unlock();
    }
  }

  /**
   * 最も優先度の高い要求を取り出す。空なら {@code timeout} まで待って empty を返す。
   */
  public Optional<QueueItem> dequeue(Duration timeout) throws InterruptedException {
    long remainingNanos = timeout.toNanos();
    lock.lockInterruptibly();
    try {
      while (items.isEmpty()) {
        if (remainingNanos <= 0) {
          return Optional.empty();
        }
        remainingNanos = notEmpty.awaitNanos(remainingNanos);
      }
      final QueueItem item = items.poll();
      queuedCounts.computeIfPresent(item.watchId(), (key, count) -> count > 1 ? count - 1 : null);
      notFull.signal();
      return Optional.of(item);
    } finally {
      lock.unlock();
    }
  }

  public int size() {
    lock.lock();
    try {
      return items.size();
    } finally {
      lock.unlock();
    }
  }

  public boolean contains(String watchId) {
    lock.lock();
    try {
      return queuedCounts.containsKey(watchId);
    } finally {
      lock.unlock();
    }
  }

  /** 強制指定の要求が既に積まれているか。 */
  public boolean containsForced(String watchId) {
    lock.lock();
    try {
      return items.stream().anyMatch(item -> item.forced() && item.watchId().equals(watchId));
    } finally {
      lock.unlock();
    }
  }


  /** 取り出し順に並べたコピー。管理 API 用。 */
  public List<QueueItem> snapshot() {
    lock.lock();
    try {
      final List<QueueItem> copy = new ArrayList<>(items);
      Collections.sort(copy);
      return copy;
    } finally {
      lock.unlock();
    }
  }

  public int clear() {
    lock.lock();
    try {
      final int removed = items.size();
      items.clear();
      queuedCounts.clear();
      notFull.signalAll();
      return removed;
    } finally {
      lock.unlock();
    }
  }

  private boolean isFull() {
    return capacity > 0 && items.size() >= capacity;
  }
}
