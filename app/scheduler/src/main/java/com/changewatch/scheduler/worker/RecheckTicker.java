/*
 * どこで: Scheduler ワーカー層
 * 何を: チェック間隔を過ぎた watch をジョブキューへ積む
 * なぜ: 各 watch を設定間隔どおりに再チェックし、同じ watch を二重に積まないため
 */
package com.changewatch.scheduler.worker;

import com.changewatch.scheduler.config.RecheckProperties;
import com.changewatch.scheduler.model.Watch;
import com.changewatch.scheduler.queue.ClaimRegistry;
import com.changewatch.scheduler.queue.RecheckPriorityQueue;
import com.changewatch.scheduler.repository.WatchStore;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class RecheckTicker {

  private static final Logger logger = LoggerFactory.getLogger(RecheckTicker.class);
  static final int RECHECK_NOW_PRIORITY = 1;

  private final WatchStore watchStore;
  private final RecheckPriorityQueue queue;
  private final ClaimRegistry claimRegistry;
  private final RecheckProperties properties;
  private final Clock clock;

  /**
   * 期限切れの watch を積む。
   *
   * @return 積んだ件数
   */
  public int tick() {
    final Instant now = Instant.now(clock);
    int enqueued = 0;
    for (Watch watch : watchStore.findAll()) {
      if (watch.paused() || !isDue(watch, now)) {
        continue;
      }
      if (queue.contains(watch.uuid()) || claimRegistry.isClaimed(watch.uuid())) {
        continue;
      }
      if (queue.enqueue(watch.uuid(), properties.priority())) {
        enqueued++;
      }
    }
    if (enqueued > 0) {
      logger.debug("recheck tick enqueued count={} queueSize={}", enqueued, queue.size());
    }
    return enqueued;
  }

  /**
   * 運用者の「今すぐ再チェック」。強制指定で積むので、一時停止中でも取得しチェックサム一致でも
   * 差分判定まで進む。
   *
   * @return 積めたら true。強制指定の要求が既に積まれている場合も true
   */
  public boolean recheckNow(String watchId) {
    if (queue.containsForced(watchId)) {
      return true;
    }
    final boolean enqueued = queue.enqueue(watchId, RECHECK_NOW_PRIORITY, true);
    logger.info("recheck requested watchId={} enqueued={}", watchId, enqueued);
    return enqueued;
  }

  private boolean isDue(Watch watch, Instant now) {
    if (watch.lastChecked() == null) {
      return true;
    }
    final Duration interval =
        watch.checkInterval() == null || watch.checkInterval().isZero()
            ? properties.defaultCheckInterval()
            : watch.checkInterval();
    return !watch.lastChecked().plus(interval).isAfter(now);
  }
}
