/*
 * どこで: Notification サービス層
 * 何を: 配信先 URL ごとに JSON を POST する webhook 配信
 * なぜ: 外部チャットや自前の受け口へ変化通知を届けるため
 */
package com.changewatch.scheduler.service;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.net.SocketTimeoutException;
import java.net.URI;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

@Component
@ConditionalOnProperty(name = "notification.dispatch.backend", havingValue = "webhook")
public class WebhookNotificationDispatcher implements NotificationDispatcher {

  private static final Logger logger = LoggerFactory.getLogger(WebhookNotificationDispatcher.class);

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "RestClient は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
  private final RestClient webhookRestClient;

  public WebhookNotificationDispatcher(@Qualifier("webhookRestClient") RestClient webhookRestClient) {
    this.webhookRestClient = webhookRestClient;
  }

  @Override
  public DispatchResult dispatch(NotificationDispatch dispatch) {
    final List<String> errors = new ArrayList<>();
    for (String target : dispatch.targets()) {
      final String error = post(target, dispatch);
      if (error != null) {
        errors.add(error);
      }
    }
    // 1 件でも失敗したら再送対象。成功済みの宛先へも再送される (at-least-once)
    return errors.isEmpty() ? DispatchResult.ok() : DispatchResult.failed(String.join("; ", errors));
  }

  private String post(String target, NotificationDispatch dispatch) {
    final String lower = target.toLowerCase(Locale.ROOT);
    if (!lower.startsWith("http://") && !lower.startsWith("https://")) {
      return "unsupported notification url " + redact(target);
    }
    try {
      webhookRestClient
          .post()
          .uri(URI.create(target))
          .contentType(MediaType.APPLICATION_JSON)
          .body(payload(dispatch))
          .retrieve()
          .toBodilessEntity();
      return null;
    } catch (RestClientResponseException ex) {
      logger.warn(
          "webhook dispatch failed with http status={} taskId={} target={}",
          ex.getStatusCode().value(),
          dispatch.taskId(),
          redact(target));
      return "HTTP " + ex.getStatusCode().value() + " from " + redact(target);
    } catch (ResourceAccessException ex) {
      final String reason = isTimeout(ex) ? "timeout" : "connection failed";
      logger.warn(
          "webhook dispatch {} taskId={} target={}", reason, dispatch.taskId(), redact(target));
      return reason + " for " + redact(target);
    } catch (RestClientException | IllegalArgumentException ex) {
      logger.warn("webhook dispatch failed taskId={} target={}", dispatch.taskId(), redact(target), ex);
      return ex.getClass().getSimpleName() + " for " + redact(target);
    }
  }

  private Map<String, Object> payload(NotificationDispatch dispatch) {
    final Map<String, Object> payload = new LinkedHashMap<>();
    payload.put("task_id", dispatch.taskId());
    payload.put("title", dispatch.title());
    payload.put("body", dispatch.body());
    payload.put("format", dispatch.format());
    payload.put("watch_url", dispatch.watchUrl());
    return payload;
  }

  // URL にトークンが埋まっていることが多いのでクエリ以降はログに出さない
  static String redact(String target) {
    final int query = target.indexOf('?');
    return query < 0 ? target : target.substring(0, query) + "?***";
  }

  private boolean isTimeout(ResourceAccessException ex) {
    Throwable current = ex;
    while (current != null) {
      if (current instanceof SocketTimeoutException) {
        return true;
      }
      current = current.getCause();
    }
    return false;
  }
}
