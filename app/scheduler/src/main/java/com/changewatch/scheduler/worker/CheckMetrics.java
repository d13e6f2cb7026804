/*
 * どこで: Scheduler ワーカー層
 * 何を: チェック結果・claim 競合・ジョブキュー深さ・稼働ワーカー数のメトリクスを記録する
 * なぜ: チェックの滞留や取得失敗の増加をダッシュボードから把握するため
 */
package com.changewatch.scheduler.worker;

import com.changewatch.scheduler.queue.RecheckPriorityQueue;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import java.util.Locale;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicInteger;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

@Component
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "MeterRegistry は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
public class CheckMetrics {

  private static final String METRIC_CHECK_TOTAL = "watch.check.total";
  private static final String METRIC_CHECK_DURATION = "watch.check.duration";
  private static final String METRIC_CLAIM_CONFLICT_TOTAL = "watch.claim.conflict.total";
  private static final String METRIC_QUEUE_DEPTH = "watch.queue.depth";
  private static final String METRIC_WORKERS_ALIVE = "watch.workers.alive";

  private final MeterRegistry meterRegistry;
  private final ConcurrentMap<JobOutcome, Counter> checkCounters = new ConcurrentHashMap<>();
  private final Counter claimConflictCounter;
  private final Timer checkDurationTimer;
  private final AtomicInteger workersAlive = new AtomicInteger(0);

  public CheckMetrics(MeterRegistry meterRegistry, RecheckPriorityQueue queue) {
    this.meterRegistry = meterRegistry;
    Gauge.builder(METRIC_QUEUE_DEPTH, queue, RecheckPriorityQueue::size)
        .description("Number of watches waiting in the recheck queue")
        .register(meterRegistry);
    Gauge.builder(METRIC_WORKERS_ALIVE, workersAlive, AtomicInteger::get)
        .description("Number of live check workers")
        .register(meterRegistry);
    this.claimConflictCounter =
        Counter.builder(METRIC_CLAIM_CONFLICT_TOTAL)
            .description("Jobs deferred because another worker held the claim")
            .register(meterRegistry);
    this.checkDurationTimer =
        Timer.builder(METRIC_CHECK_DURATION)
            .description("Wall time of one check job while the claim was held")
            .register(meterRegistry);
  }

  @EventListener
  public void onCheckCompleted(WatchCheckCompletedEvent event) {
    checkCounters
        .computeIfAbsent(
            event.outcome(),
            outcome ->
                Counter.builder(METRIC_CHECK_TOTAL)
                    .description("Check job outcomes")
                    .tags(Tags.of("outcome", outcome.name().toLowerCase(Locale.ROOT)))
                    .register(meterRegistry))
        .increment();
    if (event.elapsed() != null) {
      checkDurationTimer.record(event.elapsed());
    }
  }

  public void recordClaimConflict() {
    claimConflictCounter.increment();
  }

  public void updateWorkersAlive(int alive) {
    workersAlive.set(Math.max(alive, 0));
  }
}
