/*
 * どこで: Scheduler ワーカー層
 * 何を: 1 件の watch について claim -> 取得 -> 差分判定 -> 保存 -> 通知投入 -> 解放を実行する
 * なぜ: 同じ watch を同時に 2 つのワーカーが処理しないことと、どの経路でも claim を解放することを
 *       1 か所で保証するため
 */
package com.changewatch.scheduler.worker;

import com.changewatch.scheduler.config.DatastoreProperties;
import com.changewatch.scheduler.config.FetchProperties;
import com.changewatch.scheduler.config.WatchWorkerProperties;
import com.changewatch.scheduler.fetch.ChangeDetectorRegistry;
import com.changewatch.scheduler.fetch.ContentFetcher;
import com.changewatch.scheduler.fetch.ContentFetcherRegistry;
import com.changewatch.scheduler.fetch.DetectionResult;
import com.changewatch.scheduler.fetch.FetchException;
import com.changewatch.scheduler.fetch.FetchRequest;
import com.changewatch.scheduler.fetch.FetchedContent;
import com.changewatch.scheduler.model.HistoryEntry;
import com.changewatch.scheduler.model.QueueItem;
import com.changewatch.scheduler.model.Watch;
import com.changewatch.scheduler.queue.ClaimRegistry;
import com.changewatch.scheduler.queue.RecheckPriorityQueue;
import com.changewatch.scheduler.repository.NotificationQueueStorageException;
import com.changewatch.scheduler.repository.SnapshotStore;
import com.changewatch.scheduler.repository.WatchPersistenceException;
import com.changewatch.scheduler.repository.WatchStore;
import com.changewatch.scheduler.service.NotificationComposer;
import com.changewatch.scheduler.service.NotificationMessage;
import com.changewatch.scheduler.service.NotificationQueueService;
import com.google.common.annotations.VisibleForTesting;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class CheckJobExecutor {

  private static final Logger logger = LoggerFactory.getLogger(CheckJobExecutor.class);
  private static final String MDC_WATCH_ID = "watch_id";
  static final String FILTER_NOT_FOUND_ERROR =
      "The required text was not found on the page, the page layout may have changed";

  private final ClaimRegistry claimRegistry;
  private final RecheckPriorityQueue queue;
  private final WatchStore watchStore;
  private final SnapshotStore snapshotStore;
  private final ContentFetcherRegistry fetcherRegistry;
  private final ChangeDetectorRegistry detectorRegistry;
  private final NotificationComposer composer;
  private final NotificationQueueService notificationQueueService;
  private final WatchWorkerProperties workerProperties;
  private final FetchProperties fetchProperties;
  private final DatastoreProperties datastoreProperties;
  private final CheckMetrics metrics;
  private final ApplicationEventPublisher eventPublisher;
  private final Clock clock;

  /**
   * 1 件処理する。想定外の RuntimeException は呼び出し元へ伝播するが、claim は必ず解放される。
   */
  public JobOutcome execute(int workerId, QueueItem item) {
    final String watchId = item.watchId();
    if (!claimRegistry.tryClaim(watchId, workerId)) {
      defer(workerId, item);
      return JobOutcome.DEFERRED;
    }
    final Instant startedAt = Instant.now(clock);
    JobOutcome outcome = JobOutcome.CRASHED;
    MDC.put(MDC_WATCH_ID, watchId);
    try {
      outcome = runClaimed(item);
      return outcome;
    } catch (WatchPersistenceException ex) {
      logger.error("check abandoned because datastore write failed watchId={}", watchId, ex);
      outcome = JobOutcome.ABANDONED;
      return outcome;
    } finally {
      claimRegistry.release(watchId, workerId);
      MDC.remove(MDC_WATCH_ID);
      final Instant completedAt = Instant.now(clock);
      eventPublisher.publishEvent(
          new WatchCheckCompletedEvent(
              watchId, workerId, outcome, completedAt, Duration.between(startedAt, completedAt)));
    }
  }

  private void defer(int workerId, QueueItem item) {
    metrics.recordClaimConflict();
    // 繰り返し後回しにされても int を溢れさせない
    final long multiplied = (long) item.priority() * workerProperties.deferPriorityMultiplier();
    final int deferredPriority =
        (int)
            Math.max(
                workerProperties.deferPriorityFloor(), Math.min(Integer.MAX_VALUE, multiplied));
    logger.debug(
        "watch already claimed, deferring watchId={} owner={} workerId={} priority={}",
        item.watchId(),
        claimRegistry.ownerOf(item.watchId()).orElse(null),
        workerId,
        deferredPriority);
    // 持ち主が処理を終えるまで待ってから積み直し、即時の再取得ループを避ける
    try {
      Thread.sleep(workerProperties.deferDelay().toMillis());
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
    }
    if (!queue.enqueue(item.watchId(), deferredPriority, item.forced())) {
      logger.error("deferred watch could not be re-enqueued watchId={}", item.watchId());
    }
  }

  private JobOutcome runClaimed(QueueItem item) {
    final String watchId = item.watchId();
    final Optional<Watch> found = watchStore.find(watchId);
    if (found.isEmpty()) {
      logger.info("watch was deleted before check, skipping watchId={}", watchId);
      return JobOutcome.SKIPPED;
    }
    final Watch watch = found.get();
    if (watch.paused() && !item.forced()) {
      logger.debug("watch is paused, skipping watchId={}", watchId);
      return JobOutcome.SKIPPED;
    }

    final ContentFetcher fetcher = fetcherRegistry.resolve(watch.fetchBackend());
    final Instant fetchStartedAt = Instant.now(clock);
    final FetchedContent content;
    try {
      content =
          fetcher.fetch(
              new FetchRequest(
                  watch.url(),
                  watch.headers(),
                  fetchProperties.timeout(),
                  watch.method(),
                  watch.body(),
                  watch.includeScreenshot() && fetcher.supportsScreenshot()));
    } catch (FetchException ex) {
      return recordFetchError(watch, ex);
    }
    final Instant now = Instant.now(clock);
    final Duration fetchTime = Duration.between(fetchStartedAt, now);
    storeScreenshot(watch, content);

    final String previousText = latestSnapshotText(watch);
    // 強制再チェックではチェックサム一致でも本文比較まで進める
    final Watch detectionInput =
        item.forced() ? watch.toBuilder().previousMd5(null).build() : watch;
    final DetectionResult result =
        detectorRegistry
            .resolve(watch.processor())
            .detectChange(previousText, content, detectionInput);
    return switch (result.status()) {
      case CHECKSUM_UNCHANGED -> markChecked(watch, result, now, fetchTime);
      case FILTER_NOT_FOUND -> recordFilterFailure(watch, now, fetchTime);
      case NO_TEXT_CONTENT -> recordNoText(watch, content, now, fetchTime);
      case UNCHANGED, CHANGED -> persist(watch, result, previousText, now, fetchTime);
    };
  }

  private JobOutcome recordFetchError(Watch watch, FetchException ex) {
    logger.warn(
        "fetch failed watchId={} kind={} transient={} status={}",
        watch.uuid(),
        ex.kind(),
        ex.kind().isTransient(),
        ex.statusCode());
    final Instant now = Instant.now(clock);
    watchStore.update(
        watch.uuid(),
        current ->
            current.toBuilder()
                .lastChecked(now)
                .lastError(ex.lastErrorText())
                .checkCount(current.checkCount() + 1)
                .build());
    return JobOutcome.FETCH_FAILED;
  }

  private void storeScreenshot(Watch watch, FetchedContent content) {
    if (content.hasScreenshot()) {
      snapshotStore.saveScreenshot(watch.uuid(), content.screenshot());
    } else if (watch.includeScreenshot()) {
      // スクリーンショットは任意機能。無くてもチェックは続ける
      logger.warn("screenshot requested but not available watchId={}", watch.uuid());
    }
  }

  private String latestSnapshotText(Watch watch) {
    final HistoryEntry latest = watch.latestHistory();
    if (latest == null) {
      return null;
    }
    return snapshotStore.load(latest.snapshotRef()).orElse(null);
  }

  private JobOutcome markChecked(
      Watch watch, DetectionResult result, Instant now, Duration fetchTime) {
    watchStore.update(
        watch.uuid(),
        current ->
            current.toBuilder()
                .lastChecked(now)
                .lastError(null)
                .previousMd5(result.checksum())
                .consecutiveFilterFailures(0)
                .checkCount(current.checkCount() + 1)
                .lastFetchDuration(fetchTime)
                .build());
    return JobOutcome.UNCHANGED;
  }

  private JobOutcome recordFilterFailure(Watch watch, Instant now, Duration fetchTime) {
    final int failures = watch.consecutiveFilterFailures() + 1;
    final boolean alert =
        watch.filterFailureNotificationEnabled()
            && failures >= datastoreProperties.filterFailureThreshold();
    final Optional<Watch> updated =
        watchStore.update(
            watch.uuid(),
            current ->
                current.toBuilder()
                    .lastChecked(now)
                    .lastError(FILTER_NOT_FOUND_ERROR)
                    .consecutiveFilterFailures(alert ? 0 : failures)
                    .checkCount(current.checkCount() + 1)
                    .lastFetchDuration(fetchTime)
                    .build());
    logger.info(
        "required text not found watchId={} consecutiveFailures={} alert={}",
        watch.uuid(),
        failures,
        alert);
    if (alert && updated.isPresent() && !updated.get().notificationMuted()) {
      enqueueNotification(
          updated.get(), composer.composeFilterFailure(updated.get(), failures), null, null);
    }
    return JobOutcome.FILTER_NOT_FOUND;
  }

  private JobOutcome recordNoText(
      Watch watch, FetchedContent content, Instant now, Duration fetchTime) {
    final String error =
        "Got HTML content but no text found (With " + content.statusCode() + " reply code)";
    watchStore.update(
        watch.uuid(),
        current ->
            current.toBuilder()
                .lastChecked(now)
                .lastError(error)
                .checkCount(current.checkCount() + 1)
                .lastFetchDuration(fetchTime)
                .build());
    return JobOutcome.NO_TEXT_CONTENT;
  }

  private JobOutcome persist(
      Watch watch, DetectionResult result, String previousText, Instant now, Duration fetchTime) {
    // 初回は比較対象が無いので変化なし扱いにし、基準スナップショットだけ残す
    final boolean firstCheck = !watch.hasHistory();
    final boolean changed = result.changed() && !firstCheck;
    final String snapshotRef =
        changed || firstCheck
            ? snapshotStore.save(watch.uuid(), historyTimestamp(watch, now), result.text())
            : null;
    final Optional<Watch> updated =
        watchStore.update(
            watch.uuid(),
            current -> {
              final Watch.WatchBuilder builder =
                  current.toBuilder()
                      .lastChecked(now)
                      .lastError(null)
                      .previousMd5(result.checksum())
                      .consecutiveFilterFailures(0)
                      .checkCount(current.checkCount() + 1)
                      .lastFetchDuration(fetchTime);
              if (snapshotRef != null) {
                final List<HistoryEntry> history = new ArrayList<>(current.history());
                history.add(new HistoryEntry(historyTimestamp(current, now), snapshotRef));
                builder.history(history);
              }
              if (changed) {
                builder.lastChanged(now);
              }
              return builder.build();
            });
    if (updated.isEmpty()) {
      logger.info("watch was deleted during check watchId={}", watch.uuid());
      return JobOutcome.SKIPPED;
    }
    if (firstCheck) {
      logger.info("baseline snapshot stored watchId={}", watch.uuid());
      return JobOutcome.BASELINE;
    }
    if (!changed) {
      return JobOutcome.UNCHANGED;
    }
    logger.info("change detected watchId={} url={}", watch.uuid(), watch.url());
    final Watch current = updated.get();
    if (current.history().size() >= 2 && !current.notificationMuted()) {
      enqueueNotification(
          current,
          composer.composeChange(current, previousText, result.text(), now),
          current.previousHistory().snapshotRef(),
          current.latestHistory().snapshotRef());
    }
    return JobOutcome.CHANGED;
  }

  private void enqueueNotification(
      Watch watch, NotificationMessage message, String oldSnapshot, String newSnapshot) {
    try {
      notificationQueueService.enqueueForWatch(watch, message, oldSnapshot, newSnapshot);
    } catch (NotificationQueueStorageException ex) {
      // 通知系の障害でチェック自体は失敗させない
      logger.error("notification enqueue failed watchId={}", watch.uuid(), ex);
      watchStore.update(
          watch.uuid(),
          current -> current.toBuilder().lastNotificationError(ex.getMessage()).build());
    }
  }

  /** 履歴のキーは秒単位。同じ秒に 2 回保存しても重複しないよう前回より後ろにずらす。 */
  @VisibleForTesting
  static long historyTimestamp(Watch watch, Instant now) {
    final long candidate = now.getEpochSecond();
    final HistoryEntry latest = watch.latestHistory();
    if (latest != null && latest.timestamp() >= candidate) {
      return latest.timestamp() + 1;
    }
    return candidate;
  }
}
