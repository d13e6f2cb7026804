/*
 * どこで: Scheduler ワーカー層
 * 何を: 一定間隔でワーカープールの健全性を確認する
 * なぜ: スレッドごと死んだワーカーを運用者の介入なしに補充するため
 */
package com.changewatch.scheduler.worker;

import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class WorkerHealthMonitor {

  private static final Logger logger = LoggerFactory.getLogger(WorkerHealthMonitor.class);

  private final WorkerPoolManager poolManager;

  @Scheduled(
      initialDelayString = "${watch.worker.health-check-interval:60s}",
      fixedDelayString = "${watch.worker.health-check-interval:60s}")
  public void run() {
    if (!poolManager.isRunning()) {
      return;
    }
    try {
      poolManager.checkHealth(poolManager.targetCount());
    } catch (RuntimeException ex) {
      logger.warn("worker health check failed", ex);
    }
  }
}
