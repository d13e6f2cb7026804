/*
 * どこで: Scheduler サービス層
 * 何を: 管理 API からの watch 登録・参照・削除・再チェック要求と全体通知設定の更新を扱う
 * なぜ: 入力検証とストア/キュー操作を API 層から切り離すため
 */
package com.changewatch.scheduler.service;

import com.changewatch.scheduler.api.InvalidAdminRequestException;
import com.changewatch.scheduler.api.WatchNotFoundException;
import com.changewatch.scheduler.api.request.NotificationSettingsRequest;
import com.changewatch.scheduler.api.request.WatchCreateRequest;
import com.changewatch.scheduler.fetch.ContentFetcherRegistry;
import com.changewatch.scheduler.fetch.TextChangeDetector;
import com.changewatch.scheduler.model.NotificationSettings;
import com.changewatch.scheduler.model.Watch;
import com.changewatch.scheduler.repository.SnapshotStore;
import com.changewatch.scheduler.repository.WatchStore;
import com.changewatch.scheduler.worker.RecheckTicker;
import java.time.Duration;
import java.util.Locale;
import java.util.Set;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class WatchAdminService {

  private static final Logger logger = LoggerFactory.getLogger(WatchAdminService.class);
  private static final Set<String> METHODS = Set.of("GET", "POST", "PUT", "DELETE", "PATCH", "HEAD");

  private final WatchStore watchStore;
  private final SnapshotStore snapshotStore;
  private final ContentFetcherRegistry fetcherRegistry;
  private final RecheckTicker recheckTicker;

  public Watch create(WatchCreateRequest request) {
    final String url = request.url().trim();
    final String lower = url.toLowerCase(Locale.ROOT);
    if (!lower.startsWith("http://") && !lower.startsWith("https://")) {
      throw new InvalidAdminRequestException("url must start with http:// or https://");
    }
    final String method =
        request.method() == null ? "GET" : request.method().trim().toUpperCase(Locale.ROOT);
    if (!METHODS.contains(method)) {
      throw new InvalidAdminRequestException("unsupported method " + request.method());
    }
    if (request.fetchBackend() != null
        && !request.fetchBackend().isBlank()
        && !"system".equals(request.fetchBackend())
        && !fetcherRegistry.names().contains(request.fetchBackend())) {
      throw new InvalidAdminRequestException("unknown fetch backend " + request.fetchBackend());
    }
    final Watch watch =
        Watch.builder()
            .uuid(UUID.randomUUID().toString())
            .url(url)
            .headers(request.headers())
            .method(method)
            .body(request.body())
            .fetchBackend(request.fetchBackend())
            .processor(
                request.processor() == null ? TextChangeDetector.PROCESSOR : request.processor())
            .checkInterval(
                request.checkIntervalSeconds() == null
                    ? null
                    : Duration.ofSeconds(request.checkIntervalSeconds()))
            .paused(Boolean.TRUE.equals(request.paused()))
            .notificationMuted(Boolean.TRUE.equals(request.notificationMuted()))
            .notificationUrls(request.notificationUrls())
            .notificationFormat(request.notificationFormat())
            .requiredText(request.requiredText())
            .filterFailureNotificationEnabled(
                !Boolean.FALSE.equals(request.filterFailureNotificationEnabled()))
            .includeScreenshot(Boolean.TRUE.equals(request.includeScreenshot()))
            .build();
    watchStore.save(watch);
    logger.info("watch created watchId={} url={}", watch.uuid(), watch.url());
    return watch;
  }

  public Watch get(String uuid) {
    return watchStore.find(uuid).orElseThrow(() -> new WatchNotFoundException(uuid));
  }

  public void delete(String uuid) {
    if (!watchStore.delete(uuid)) {
      throw new WatchNotFoundException(uuid);
    }
    snapshotStore.deleteAll(uuid);
    logger.info("watch deleted watchId={}", uuid);
  }

  /**
   * 優先度 1 でジョブキューへ積む。
   *
   * @return 積めた (または既に積まれている) 場合 true
   */
  public boolean recheck(String uuid) {
    get(uuid);
    return recheckTicker.recheckNow(uuid);
  }

  public NotificationSettings updateNotificationSettings(NotificationSettingsRequest request) {
    final NotificationSettings settings =
        new NotificationSettings(request.notificationUrls(), request.notificationFormat());
    watchStore.updateNotificationSettings(settings);
    logger.info("global notification settings updated targets={}", settings.notificationUrls().size());
    return settings;
  }
}
