/*
 * どこで: Scheduler ドメインモデル
 * 何を: 監視対象 (watch) のスナップショット
 * なぜ: ワーカーがジョブ単位で読み取り、生成したフィールドだけを書き戻すため
 */
package com.changewatch.scheduler.model;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import lombok.Builder;

@Builder(toBuilder = true)
public record Watch(
    String uuid,
    String url,
    Map<String, String> headers,
    String method,
    String body,
    String fetchBackend,
    String processor,
    Duration checkInterval,
    boolean paused,
    boolean notificationMuted,
    List<String> notificationUrls,
    String notificationFormat,
    String requiredText,
    boolean filterFailureNotificationEnabled,
    boolean includeScreenshot,
    Instant lastChecked,
    Instant lastChanged,
    String lastError,
    String previousMd5,
    List<HistoryEntry> history,
    long checkCount,
    Duration lastFetchDuration,
    int consecutiveFilterFailures,
    int notificationAlertCount,
    String lastNotificationError) {

  public Watch {
    headers = headers == null ? Map.of() : Map.copyOf(headers);
    method = method == null || method.isBlank() ? "GET" : method;
    notificationUrls = notificationUrls == null ? List.of() : List.copyOf(notificationUrls);
    history = history == null ? List.of() : List.copyOf(history);
  }

  public boolean hasHistory() {
    return !history.isEmpty();
  }

  public HistoryEntry latestHistory() {
    return history.isEmpty() ? null : history.get(history.size() - 1);
  }

  /** 最新の 1 つ前。差分通知の比較元。 */
  public HistoryEntry previousHistory() {
    return history.size() < 2 ? null : history.get(history.size() - 2);
  }
}
