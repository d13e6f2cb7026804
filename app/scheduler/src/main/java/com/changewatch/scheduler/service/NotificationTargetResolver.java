/*
 * どこで: Notification サービス層
 * 何を: 配信先 URL と書式を現在の watch 設定 (無ければ全体設定) から解決する
 * なぜ: 運用者が壊れた配信先を直せば、次の再送から直した値が使われるようにするため
 */
package com.changewatch.scheduler.service;

import com.changewatch.scheduler.model.NotificationSettings;
import com.changewatch.scheduler.model.NotificationTask;
import com.changewatch.scheduler.model.Watch;
import com.changewatch.scheduler.repository.WatchStore;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class NotificationTargetResolver {

  static final String SOURCE_WATCH = "watch";
  static final String SOURCE_GLOBAL = "global";
  static final String SOURCE_NONE = "none";

  private final WatchStore watchStore;

  public ResolvedTargets resolve(NotificationTask task) {
    final NotificationSettings global = watchStore.notificationSettings();
    final Optional<Watch> watch =
        task.watchId() == null ? Optional.empty() : watchStore.find(task.watchId());
    if (watch.isPresent() && !watch.get().notificationUrls().isEmpty()) {
      final String format =
          isBlank(watch.get().notificationFormat())
              ? global.notificationFormat()
              : watch.get().notificationFormat();
      return new ResolvedTargets(watch.get().notificationUrls(), format, SOURCE_WATCH);
    }
    if (!global.notificationUrls().isEmpty()) {
      return new ResolvedTargets(
          global.notificationUrls(), global.notificationFormat(), SOURCE_GLOBAL);
    }
    return new ResolvedTargets(List.of(), global.notificationFormat(), SOURCE_NONE);
  }

  private static boolean isBlank(String value) {
    return value == null || value.isBlank();
  }
}
