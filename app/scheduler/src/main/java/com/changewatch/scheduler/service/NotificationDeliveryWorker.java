/*
 * どこで: Notification 配信ワーカー
 * 何を: スケジュールで再送キューの配信処理を起動する
 * なぜ: 期限の来た通知タスクを一定間隔で処理するため
 */
package com.changewatch.scheduler.service;

import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@ConditionalOnProperty(
    name = "notification.retry.enabled",
    havingValue = "true",
    matchIfMissing = true)
public class NotificationDeliveryWorker {

  private static final Logger logger = LoggerFactory.getLogger(NotificationDeliveryWorker.class);

  private final NotificationDeliveryService deliveryService;

  @Scheduled(fixedDelayString = "${notification.retry.poll-interval:1s}")
  public void run() {
    try {
      deliveryService.processDueBatch();
    } catch (RuntimeException ex) {
      // 保存先の一時障害でスケジューラを止めない。次の周期でやり直す
      logger.error("notification delivery batch failed", ex);
    }
  }
}
