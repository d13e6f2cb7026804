/*
 * どこで: Notification サービス層
 * 何を: 配信結果・投入から配信までの遅延・未配信件数・dead letter 移送のメトリクスを記録する
 * なぜ: 再送キューの詰まりや配信先の故障を Prometheus から直接観測できるようにするため
 */
package com.changewatch.scheduler.service;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicInteger;
import org.springframework.stereotype.Component;

@Component
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "MeterRegistry は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
public class NotificationMetrics {

  private static final String METRIC_DELIVERY_TOTAL = "notification.delivery.total";
  private static final String METRIC_DELIVERY_DELAY = "notification.delivery.delay";
  private static final String METRIC_BACKLOG_CURRENT = "notification.backlog.current";
  private static final String METRIC_DEAD_LETTER_TOTAL = "notification.dead_letter.total";

  private final MeterRegistry meterRegistry;
  private final AtomicInteger backlogCurrent = new AtomicInteger(0);
  private final ConcurrentMap<String, Counter> deliveryCounters = new ConcurrentHashMap<>();
  private final Counter deadLetterCounter;
  private final Timer deliveryDelayTimer;

  public NotificationMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
    Gauge.builder(METRIC_BACKLOG_CURRENT, backlogCurrent, AtomicInteger::get)
        .description("Current number of undelivered notification tasks")
        .register(meterRegistry);
    this.deadLetterCounter =
        Counter.builder(METRIC_DEAD_LETTER_TOTAL)
            .description("Total number of notification tasks moved to the dead letter list")
            .register(meterRegistry);
    this.deliveryDelayTimer =
        Timer.builder(METRIC_DELIVERY_DELAY)
            .description("Delay from enqueue to successful delivery")
            .register(meterRegistry);
  }

  /** result: success / retry / dead_letter / no_target */
  public void recordDeliveryResult(String result) {
    deliveryCounters
        .computeIfAbsent(
            result,
            ignored ->
                Counter.builder(METRIC_DELIVERY_TOTAL)
                    .description("Notification delivery outcomes")
                    .tags(Tags.of("result", result))
                    .register(meterRegistry))
        .increment();
  }

  public void recordDeliveryDelay(Instant enqueuedAt, Instant deliveredAt) {
    if (enqueuedAt == null || deliveredAt == null || deliveredAt.isBefore(enqueuedAt)) {
      return;
    }
    deliveryDelayTimer.record(Duration.between(enqueuedAt, deliveredAt));
  }

  public void recordDeadLettered() {
    deadLetterCounter.increment();
  }

  public void updateBacklogCurrent(int backlogCount) {
    backlogCurrent.set(Math.max(backlogCount, 0));
  }
}
