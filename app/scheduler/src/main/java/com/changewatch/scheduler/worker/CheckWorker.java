/*
 * どこで: Scheduler ワーカー層
 * 何を: キューから取り出して 1 件ずつ処理するワーカー本体
 * なぜ: 一定件数/一定時間ごとにジョブの合間で抜け、長時間稼働による資源の溜め込みを防ぐため
 */
package com.changewatch.scheduler.worker;

import com.changewatch.scheduler.config.WatchWorkerProperties;
import com.changewatch.scheduler.model.QueueItem;
import com.changewatch.scheduler.queue.RecheckPriorityQueue;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

public class CheckWorker {

  private static final Logger logger = LoggerFactory.getLogger(CheckWorker.class);
  private static final String MDC_WORKER_ID = "worker_id";

  private final int workerId;
  private final CheckJobExecutor executor;
  private final RecheckPriorityQueue queue;
  private final WatchWorkerProperties properties;
  private final Clock clock;
  private final Instant startedAt;
  private final AtomicInteger jobsProcessed = new AtomicInteger(0);
  private volatile boolean stopRequested;
  private volatile String currentWatchId;

  public CheckWorker(
      int workerId,
      CheckJobExecutor executor,
      RecheckPriorityQueue queue,
      WatchWorkerProperties properties,
      Clock clock) {
    this.workerId = workerId;
    this.executor = executor;
    this.queue = queue;
    this.properties = properties;
    this.clock = clock;
    this.startedAt = Instant.now(clock);
  }

  /**
   * 停止要求か再起動条件に達するまで処理を続ける。処理中のジョブは必ず最後まで終えてから返る。
   */
  public WorkerOutcome run() {
    MDC.put(MDC_WORKER_ID, Integer.toString(workerId));
    try {
      logger.info("worker started workerId={}", workerId);
      while (!stopRequested) {
        if (shouldRestart()) {
          logger.info(
              "worker restart threshold reached workerId={} jobs={} uptime={}",
              workerId,
              jobsProcessed.get(),
              uptime());
          return WorkerOutcome.RESTART;
        }
        final Optional<QueueItem> item;
        try {
          item = queue.dequeue(properties.dequeueTimeout());
        } catch (InterruptedException ex) {
          Thread.currentThread().interrupt();
          return WorkerOutcome.SHUTDOWN;
        }
        if (item.isEmpty()) {
          continue;
        }
        currentWatchId = item.get().watchId();
        try {
          final JobOutcome outcome = executor.execute(workerId, item.get());
          if (outcome != JobOutcome.DEFERRED) {
            jobsProcessed.incrementAndGet();
          }
        } finally {
          currentWatchId = null;
        }
      }
      logger.info("worker stopped workerId={} jobs={}", workerId, jobsProcessed.get());
      return WorkerOutcome.SHUTDOWN;
    } finally {
      MDC.remove(MDC_WORKER_ID);
    }
  }

  boolean shouldRestart() {
    return jobsProcessed.get() >= properties.maxJobs()
        || uptime().compareTo(properties.maxRuntime()) >= 0;
  }

  /** 現在のジョブを終えた後でループを抜けさせる。処理中のジョブは中断しない。 */
  public void requestStop() {
    stopRequested = true;
  }

  public int workerId() {
    return workerId;
  }

  public String currentWatchId() {
    return currentWatchId;
  }

  public int jobsProcessed() {
    return jobsProcessed.get();
  }

  public Duration uptime() {
    return Duration.between(startedAt, Instant.now(clock));
  }
}
