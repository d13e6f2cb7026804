/*
 * どこで: Notification サービス層
 * 何を: 期限の来た通知タスクを配信し、失敗時は再送予約または dead letter へ移す
 * なぜ: 配信先の一時的な障害で通知を失わず、恒久的な失敗は運用者の判断に回すため
 */
package com.changewatch.scheduler.service;

import com.changewatch.scheduler.config.NotificationRetryProperties;
import com.changewatch.scheduler.model.DeadLetterEntry;
import com.changewatch.scheduler.model.DeliveryRecord;
import com.changewatch.scheduler.model.NotificationTask;
import com.changewatch.scheduler.model.RetryAttemptRecord;
import com.changewatch.scheduler.repository.NotificationAuditRepository;
import com.changewatch.scheduler.repository.NotificationQueueStorage;
import com.changewatch.scheduler.repository.WatchStore;
import com.google.common.annotations.VisibleForTesting;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class NotificationDeliveryService {

  private static final Logger logger = LoggerFactory.getLogger(NotificationDeliveryService.class);
  private static final String MDC_TASK_ID = "task_id";
  private static final String MDC_WATCH_ID = "watch_id";

  private final NotificationQueueStorage storage;
  private final NotificationAuditRepository auditRepository;
  private final NotificationTargetResolver targetResolver;
  private final NotificationDispatcher dispatcher;
  private final WatchStore watchStore;
  private final RetryPolicy retryPolicy;
  private final NotificationRetryProperties properties;
  private final NotificationMetrics metrics;
  private final Clock clock;

  /**
   * 配信予定時刻を過ぎたタスクをまとめて処理する。
   *
   * @return 処理したタスク数
   */
  public int processDueBatch() {
    final Instant now = Instant.now(clock);
    // claim で lease を付けるので、配信中にプロセスが落ちても lease 切れで再び拾われる
    final List<NotificationTask> due =
        storage.claimDue(now, now.plus(properties.lease()), properties.batchSize());
    for (NotificationTask task : due) {
      deliver(task, now);
    }
    metrics.updateBacklogCurrent(storage.countPending());
    return due.size();
  }

  /** その場で配信するために lease を付けた状態を返す。保存は呼び出し側で行う。 */
  public NotificationTask leaseForImmediateDelivery(NotificationTask task) {
    return task.leased(Instant.now(clock).plus(properties.lease()));
  }

  /**
   * lease 付きで保存済みのタスクを 1 件その場で配信する。lease が切れるまでは配信ワーカーに
   * 拾われない。配信が lease より長引いた場合は配信ワーカーも拾うので、配信は at-least-once。
   *
   * @return 配信に成功したら true
   */
  public boolean deliverNow(NotificationTask leased) {
    return deliver(leased, Instant.now(clock));
  }

  @VisibleForTesting
  boolean deliver(NotificationTask task, Instant now) {
    MDC.put(MDC_TASK_ID, task.taskId());
    if (task.watchId() != null) {
      MDC.put(MDC_WATCH_ID, task.watchId());
    }
    try {
      final int attemptNumber = task.attemptCount() + 1;
      // 配信先と書式は毎回その時点の設定から解決する
      final ResolvedTargets targets = targetResolver.resolve(task);
      if (targets.isEmpty()) {
        logger.warn(
            "notification dropped because no target is configured taskId={} watchId={}",
            task.taskId(),
            task.watchId());
        storage.complete(task.taskId());
        metrics.recordDeliveryResult("no_target");
        return false;
      }
      final DispatchResult result = dispatch(task, targets);
      if (result.success()) {
        handleSuccess(task, targets, attemptNumber, now);
      } else {
        handleFailure(task, attemptNumber, truncateError(result.error()), now);
      }
      return result.success();
    } finally {
      MDC.remove(MDC_TASK_ID);
      MDC.remove(MDC_WATCH_ID);
    }
  }

  private DispatchResult dispatch(NotificationTask task, ResolvedTargets targets) {
    try {
      return dispatcher.dispatch(
          new NotificationDispatch(
              task.taskId(),
              targets.urls(),
              targets.format(),
              task.title(),
              task.body(),
              task.watchUrl()));
    } catch (RuntimeException ex) {
      logger.warn("notification dispatcher threw taskId={}", task.taskId(), ex);
      return DispatchResult.failed(ex.getClass().getSimpleName() + ": " + ex.getMessage());
    }
  }

  private void handleSuccess(
      NotificationTask task, ResolvedTargets targets, int attemptNumber, Instant now) {
    final String key = NotificationAuditRepository.auditKey(task.watchId(), task.taskId());
    // 成功したら失敗履歴は不要なので消す
    auditRepository.clearAttempts(key);
    auditRepository.recordDelivery(
        new DeliveryRecord(
            task.taskId(),
            task.watchId(),
            task.watchUrl(),
            task.title(),
            now,
            attemptNumber,
            targets.urls()));
    if (task.watchId() != null) {
      watchStore.update(
          task.watchId(),
          watch ->
              watch.toBuilder()
                  .lastNotificationError(null)
                  .notificationAlertCount(watch.notificationAlertCount() + 1)
                  .build());
    }
    if (task.replayRequested()) {
      storage.deleteDeadLetter(task.taskId());
    }
    storage.complete(task.taskId());
    metrics.recordDeliveryResult("success");
    metrics.recordDeliveryDelay(task.createdAt(), now);
    logger.info(
        "notification delivered taskId={} attempt={} targets={} source={}",
        task.taskId(),
        attemptNumber,
        targets.urls().size(),
        targets.source());
  }

  @VisibleForTesting
  void handleFailure(NotificationTask task, int attemptNumber, String error, Instant now) {
    final boolean willRetry = retryPolicy.shouldRetryAfter(attemptNumber);
    final Instant nextAttemptAt = willRetry ? now.plus(retryPolicy.delayForRetry(attemptNumber)) : null;
    auditRepository.recordAttempt(
        new RetryAttemptRecord(
            task.watchId(),
            task.taskId(),
            attemptNumber,
            now,
            task.watchUrl(),
            error,
            willRetry,
            nextAttemptAt));
    if (task.watchId() != null) {
      watchStore.update(
          task.watchId(), watch -> watch.toBuilder().lastNotificationError(error).build());
    }
    if (willRetry) {
      storage.reschedule(task.retryAt(attemptNumber, nextAttemptAt, error));
      metrics.recordDeliveryResult("retry");
      logger.warn(
          "notification retry scheduled taskId={} attempt={} nextAttemptAt={} error={}",
          task.taskId(),
          attemptNumber,
          nextAttemptAt,
          error);
      return;
    }
    // 再投入したタスクが再び失敗した場合も同じ taskId の dead letter を上書きする
    storage.moveToDeadLetter(
        new DeadLetterEntry(task.retryAt(attemptNumber, now, error), now, error, attemptNumber, null));
    metrics.recordDeliveryResult("dead_letter");
    metrics.recordDeadLettered();
    logger.error(
        "notification moved to dead letter taskId={} attempts={} error={}",
        task.taskId(),
        attemptNumber,
        error);
  }

  @VisibleForTesting
  String truncateError(String message) {
    if (message == null) {
      return "unknown error";
    }
    final int maxLength = properties.errorMessageMaxLength();
    if (message.length() <= maxLength) {
      return message;
    }
    return message.substring(0, maxLength);
  }
}
