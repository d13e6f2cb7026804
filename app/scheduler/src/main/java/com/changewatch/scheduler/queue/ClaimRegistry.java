/*
 * どこで: Scheduler 排他制御
 * 何を: watch ID から処理中ワーカーへの対応を 1 つのロックで管理する
 * なぜ: 同じ watch を 2 つのワーカーが同時にチェックしないことを保証するため
 */
package com.changewatch.scheduler.queue;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class ClaimRegistry {

  private static final Logger logger = LoggerFactory.getLogger(ClaimRegistry.class);

  // 臨界区間はマップ操作のみ。ロック保持中に I/O やデータストア呼び出しをしない
  private final ReentrantLock lock = new ReentrantLock();
  private final Map<String, Integer> owners = new HashMap<>();

  /** 未取得なら取得して true。既に誰かが保持していれば false。 */
  public boolean tryClaim(String watchId, int workerId) {
    lock.lock();
    try {
      final Integer owner = owners.get(watchId);
      if (owner != null) {
        logger.debug(
            "claim conflict watchId={} owner={} requester={}", watchId, owner, workerId);
        return false;
      }
      owners.put(watchId, workerId);
      return true;
    } finally {
      lock.unlock();
    }
  }

  /**
   * 保持者本人のときだけ解放する。保持していない呼び出しは警告ログのみで何もしない。
   */
  public void release(String watchId, int workerId) {
    final Integer owner;
    lock.lock();
    try {
      owner = owners.get(watchId);
      if (owner != null && owner == workerId) {
        owners.remove(watchId);
        return;
      }
    } finally {
      lock.unlock();
    }
    logger.warn(
        "claim release ignored because caller is not the owner watchId={} owner={} caller={}",
        watchId,
        owner,
        workerId);
  }

  /** ワーカー消滅時の後始末。そのワーカーが保持していた claim を全て外す。 */
  public List<String> releaseAll(int workerId) {
    lock.lock();
    try {
      final List<String> released =
          owners.entrySet().stream()
              .filter(entry -> entry.getValue() == workerId)
              .map(Map.Entry::getKey)
              .collect(Collectors.toList());
      released.forEach(owners::remove);
      return released;
    } finally {
      lock.unlock();
    }
  }

  public boolean isClaimed(String watchId) {
    lock.lock();
    try {
      return owners.containsKey(watchId);
    } finally {
      lock.unlock();
    }
  }

  public Optional<Integer> ownerOf(String watchId) {
    lock.lock();
    try {
      return Optional.ofNullable(owners.get(watchId));
    } finally {
      lock.unlock();
    }
  }

  public Set<String> claimedWatchIds() {
    lock.lock();
    try {
      return Set.copyOf(owners.keySet());
    } finally {
      lock.unlock();
    }
  }
}
