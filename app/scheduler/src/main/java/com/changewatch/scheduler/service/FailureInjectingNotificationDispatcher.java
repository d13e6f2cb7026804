/*
 * どこで: Notification サービス層
 * 何を: CI/Test 専用で配信失敗を注入する Dispatcher
 * なぜ: 実コード経路を汚さずに E2E で retry -> dead letter を再現するため
 */
package com.changewatch.scheduler.service;

import com.changewatch.scheduler.config.NotificationDispatchProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Primary;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

@Component
@Primary
@RequiredArgsConstructor
@Profile({"ci", "test"})
@ConditionalOnProperty(
    prefix = "notification.dispatch.failure-injection",
    name = "enabled",
    havingValue = "true")
public class FailureInjectingNotificationDispatcher implements NotificationDispatcher {

  private final LoggingNotificationDispatcher delegate;
  private final NotificationDispatchProperties properties;

  @Override
  public DispatchResult dispatch(NotificationDispatch dispatch) {
    if (shouldInjectFailure(dispatch.watchUrl())) {
      return DispatchResult.failed(
          "notification dispatch failure injection matched watchUrl=" + dispatch.watchUrl());
    }
    return delegate.dispatch(dispatch);
  }

  private boolean shouldInjectFailure(String watchUrl) {
    final String prefix = properties.failurePrefix();
    if (watchUrl == null || prefix == null || prefix.isBlank()) {
      return false;
    }
    return watchUrl.startsWith(prefix);
  }
}
