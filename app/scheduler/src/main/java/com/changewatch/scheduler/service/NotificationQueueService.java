/*
 * どこで: Notification サービス層
 * 何を: 通知タスクを採番して再送キューへ投入する
 * なぜ: ワーカーや管理 API が保存バックエンドを意識せずに通知を積めるようにするため
 */
package com.changewatch.scheduler.service;

import com.changewatch.scheduler.model.NotificationTask;
import com.changewatch.scheduler.model.Watch;
import com.changewatch.scheduler.repository.NotificationQueueStorage;
import java.time.Clock;
import java.time.Instant;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class NotificationQueueService {

  private static final Logger logger = LoggerFactory.getLogger(NotificationQueueService.class);

  private final NotificationQueueStorage storage;
  private final Clock clock;

  /**
   * watch の変化通知を投入する。
   *
   * @return 採番したタスク ID
   */
  public String enqueueForWatch(
      Watch watch, NotificationMessage message, String oldSnapshot, String newSnapshot) {
    final NotificationTask task =
        NotificationTask.create(
            UUID.randomUUID().toString(),
            watch.uuid(),
            message.title(),
            message.body(),
            watch.url(),
            oldSnapshot,
            newSnapshot,
            Instant.now(clock));
    return enqueue(task);
  }

  /** watch に紐づかない単発メッセージ (疎通確認など)。配信先は全体設定から解決される。 */
  public String enqueueStandalone(NotificationMessage message) {
    final NotificationTask task =
        NotificationTask.create(
            UUID.randomUUID().toString(),
            null,
            message.title(),
            message.body(),
            null,
            null,
            null,
            Instant.now(clock));
    return enqueue(task);
  }

  public String enqueue(NotificationTask task) {
    storage.save(task);
    logger.info(
        "notification enqueued taskId={} watchId={} storage={}",
        task.taskId(),
        task.watchId(),
        storage.kind());
    return task.taskId();
  }
}
