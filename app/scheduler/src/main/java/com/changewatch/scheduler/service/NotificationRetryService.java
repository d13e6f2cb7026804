/*
 * どこで: Notification サービス層
 * 何を: 再送設定の参照、dead letter の一覧/再投入、未配信タスクの即時再送を提供する
 * なぜ: 配信先を直した運用者が、失敗した通知を手動で送り直せるようにするため
 */
package com.changewatch.scheduler.service;

import com.changewatch.scheduler.api.DeadLetterNotFoundException;
import com.changewatch.scheduler.model.DeadLetterEntry;
import com.changewatch.scheduler.model.DeliveryRecord;
import com.changewatch.scheduler.model.NotificationTask;
import com.changewatch.scheduler.model.ReplaySummary;
import com.changewatch.scheduler.model.RetryAttemptRecord;
import com.changewatch.scheduler.model.RetryConfig;
import com.changewatch.scheduler.repository.NotificationAuditRepository;
import com.changewatch.scheduler.repository.NotificationQueueStorage;
import com.changewatch.scheduler.repository.NotificationQueueStorageException;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.function.UnaryOperator;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class NotificationRetryService {

  private static final Logger logger = LoggerFactory.getLogger(NotificationRetryService.class);

  private final NotificationQueueStorage storage;
  private final NotificationAuditRepository auditRepository;
  private final RetryPolicy retryPolicy;
  private final NotificationDeliveryService deliveryService;
  private final Clock clock;

  public RetryConfig retryConfig() {
    return retryPolicy.toRetryConfig();
  }

  public List<DeadLetterEntry> listDeadLetters() {
    return storage.listDeadLetters();
  }

  public List<NotificationTask> pending() {
    return storage.findPending();
  }

  public List<RetryAttemptRecord> attemptsFor(String watchId) {
    return auditRepository.attemptsFor(watchId);
  }

  /** 新しい順。 */
  public List<DeliveryRecord> recentDeliveries(int limit) {
    return auditRepository.deliveries(limit);
  }

  /**
   * dead letter を未配信キューへ戻す。エントリ自体は配信成功まで残す。
   *
   * @throws DeadLetterNotFoundException taskId に対応する dead letter が無い場合
   */
  public NotificationTask replayDeadLetter(String taskId) {
    return replay(taskId, UnaryOperator.identity());
  }

  private NotificationTask replay(String taskId, UnaryOperator<NotificationTask> beforeSave) {
    final DeadLetterEntry entry =
        storage.findDeadLetter(taskId).orElseThrow(() -> new DeadLetterNotFoundException(taskId));
    final Instant now = Instant.now(clock);
    final NotificationTask replayed = beforeSave.apply(entry.task().replay(now));
    storage.save(replayed);
    storage.saveDeadLetter(entry.markReplayed(now));
    logger.info("dead letter replayed taskId={} previousAttempts={}", taskId, entry.attempts());
    return replayed;
  }

  /** 1 件の失敗で全体を止めず、成功/失敗件数を返す。 */
  public ReplaySummary replayAll() {
    final List<DeadLetterEntry> entries = storage.listDeadLetters();
    int success = 0;
    int failed = 0;
    for (DeadLetterEntry entry : entries) {
      try {
        replayDeadLetter(entry.taskId());
        success++;
      } catch (DeadLetterNotFoundException | NotificationQueueStorageException ex) {
        failed++;
        logger.warn("dead letter replay failed taskId={}", entry.taskId(), ex);
      }
    }
    logger.info("dead letter replay all success={} failed={}", success, failed);
    return new ReplaySummary(success, failed, entries.size());
  }

  /**
   * dead letter をその場で 1 回配信する。失敗した場合は通常の再送スケジュールに載る。
   *
   * @return 配信に成功したら true
   * @throws DeadLetterNotFoundException taskId に対応する dead letter が無い場合
   */
  public boolean retryNow(String taskId) {
    // 配信ワーカーが先に拾わないよう、lease 付きの状態で未配信キューへ戻す
    final NotificationTask replayed =
        replay(taskId, deliveryService::leaseForImmediateDelivery);
    final boolean delivered = deliveryService.deliverNow(replayed);
    logger.info("dead letter retried synchronously taskId={} delivered={}", taskId, delivered);
    return delivered;
  }

  public int clearAll() {
    final int cleared = storage.clearAll();
    logger.warn("notification queue cleared count={}", cleared);
    return cleared;
  }
}
