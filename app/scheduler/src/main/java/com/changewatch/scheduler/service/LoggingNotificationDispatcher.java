/*
 * どこで: Notification サービス層
 * 何を: 通知配信を模擬する実装
 * なぜ: 外部送信を伴わずに再送キューの状態遷移を確認するため
 */
package com.changewatch.scheduler.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(
    name = "notification.dispatch.backend",
    havingValue = "log",
    matchIfMissing = true)
public class LoggingNotificationDispatcher implements NotificationDispatcher {

  private static final Logger logger = LoggerFactory.getLogger(LoggingNotificationDispatcher.class);

  @Override
  public DispatchResult dispatch(NotificationDispatch dispatch) {
    // 実送信は行わず、ログに残すだけとする
    logger.info(
        "notification simulated dispatch taskId={} targets={} format={} title={}",
        dispatch.taskId(),
        dispatch.targets().size(),
        dispatch.format(),
        dispatch.title());
    return DispatchResult.ok();
  }
}
