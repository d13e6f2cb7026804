/*
 * どこで: Scheduler ワーカー層のテスト
 * 何を: ワーカー数の増減・範囲外の拒否・停止後の拒否・死んだワーカーの補充を検証する
 * なぜ: 実スレッドで動かし、id の割り当てと claim の後始末が崩れないことを担保するため
 */
package com.changewatch.scheduler.worker;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.changewatch.scheduler.config.WatchWorkerProperties;
import com.changewatch.scheduler.model.QueueItem;
import com.changewatch.scheduler.model.WorkerStatus;
import com.changewatch.scheduler.queue.ClaimRegistry;
import com.changewatch.scheduler.queue.RecheckPriorityQueue;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.BooleanSupplier;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class WorkerPoolManagerTest {

  private final CheckJobExecutor executor = mock(CheckJobExecutor.class);
  private final CheckWorkerFactory factory = mock(CheckWorkerFactory.class);
  private final ClaimRegistry claimRegistry = new ClaimRegistry();
  private WatchWorkerProperties properties;
  private RecheckPriorityQueue queue;
  private WorkerPoolManager manager;
  private final CountDownLatch jobGate = new CountDownLatch(1);

  @BeforeEach
  void setUp() {
    properties =
        new WatchWorkerProperties(
            3, 10, null, Duration.ofMillis(20), null, null, null, null, null,
            Duration.ofMillis(10), null);
    queue = new RecheckPriorityQueue(properties);
    when(factory.create(anyInt()))
        .thenAnswer(
            invocation ->
                new CheckWorker(
                    invocation.getArgument(0), executor, queue, properties, Clock.systemUTC()));
    manager =
        new WorkerPoolManager(
            factory,
            claimRegistry,
            properties,
            new CheckMetrics(new SimpleMeterRegistry(), queue));
  }

  @AfterEach
  void tearDown() {
    jobGate.countDown();
    manager.shutdown();
  }

  @Test
  void startUsesConfiguredCountWithSequentialIds() {
    manager.start();

    assertThat(manager.isRunning()).isTrue();
    assertThat(manager.workerCount()).isEqualTo(3);
    assertThat(manager.targetCount()).isEqualTo(3);
    assertThat(manager.status()).extracting(WorkerStatus::workerId).containsExactly(0, 1, 2);
  }

  @Test
  void scaleUpFillsLowestFreeIdsAndScaleDownRetiresHighest() {
    manager.start(2);

    assertThat(manager.scaleTo(2)).isEqualTo(ScaleResult.NO_CHANGE);
    assertThat(manager.scaleTo(4)).isEqualTo(ScaleResult.SUCCESS);
    assertThat(manager.status()).extracting(WorkerStatus::workerId).containsExactly(0, 1, 2, 3);

    assertThat(manager.scaleTo(1)).isEqualTo(ScaleResult.SUCCESS);
    assertThat(manager.status()).extracting(WorkerStatus::workerId).containsExactly(0);
    assertThat(manager.targetCount()).isEqualTo(1);
  }

  @Test
  void scaleOutsideRangeIsRejected() {
    manager.start(2);

    assertThat(manager.scaleTo(0)).isEqualTo(ScaleResult.ERROR);
    assertThat(manager.scaleTo(WorkerPoolManager.MAX_WORKERS + 1)).isEqualTo(ScaleResult.ERROR);
    assertThat(manager.workerCount()).isEqualTo(2);
  }

  @Test
  void shutdownReturnsImmediatelyAndRejectsFurtherScaling() {
    manager.start(2);

    manager.shutdown();

    assertThat(manager.isRunning()).isFalse();
    assertThat(manager.scaleTo(3)).isEqualTo(ScaleResult.ERROR);
    awaitTrue(() -> manager.status().stream().noneMatch(WorkerStatus::alive));
  }

  @Test
  void healthyPoolReportsNoRestarts() {
    manager.start(2);

    final HealthReport report = manager.checkHealth(2);

    assertThat(report.status()).isEqualTo(HealthStatus.HEALTHY);
    assertThat(report.alive()).isEqualTo(2);
    assertThat(report.restartedWorkerIds()).isEmpty();
  }

  @Test
  void deadWorkerIsReplacedAndItsClaimsReleased() {
    final AtomicBoolean crashed = new AtomicBoolean();
    final CheckWorker dying = mock(CheckWorker.class);
    // Error は再起動ループでも捕まえないのでスレッドごと終わる
    when(dying.run()).thenThrow(new Error("worker thread died"));
    when(factory.create(anyInt()))
        .thenAnswer(
            invocation -> {
              final int id = invocation.getArgument(0);
              if (id == 1 && crashed.compareAndSet(false, true)) {
                return dying;
              }
              return new CheckWorker(id, executor, queue, properties, Clock.systemUTC());
            });
    claimRegistry.tryClaim("watch-1", 1);
    manager.start(2);
    awaitTrue(
        () ->
            manager.status().stream()
                .anyMatch(status -> status.workerId() == 1 && !status.alive()));

    final HealthReport report = manager.checkHealth(2);

    assertThat(report.status()).isEqualTo(HealthStatus.REPAIRED);
    assertThat(report.restartedWorkerIds()).containsExactly(1);
    assertThat(report.alive()).isEqualTo(2);
    assertThat(claimRegistry.isClaimed("watch-1")).isFalse();
  }

  @Test
  void retiredWorkerKeepsItsIdAndClaimUntilInFlightJobFinishes() throws Exception {
    final AtomicBoolean crashed = new AtomicBoolean();
    final CheckWorker dying = mock(CheckWorker.class);
    when(dying.run()).thenThrow(new Error("worker thread died"));
    when(factory.create(anyInt()))
        .thenAnswer(
            invocation -> {
              final int id = invocation.getArgument(0);
              if (id == 2 && crashed.compareAndSet(false, true)) {
                return dying;
              }
              return new CheckWorker(id, executor, queue, properties, Clock.systemUTC());
            });
    // 各ワーカーは claim を握ったままゲートが開くまでジョブの途中で止まる
    when(executor.execute(anyInt(), any(QueueItem.class)))
        .thenAnswer(
            invocation -> {
              final int workerId = invocation.getArgument(0);
              final QueueItem item = invocation.getArgument(1);
              claimRegistry.tryClaim(item.watchId(), workerId);
              try {
                jobGate.await();
              } finally {
                claimRegistry.release(item.watchId(), workerId);
              }
              return JobOutcome.UNCHANGED;
            });
    manager.start(2);
    queue.enqueue("watch-x", 5);
    queue.enqueue("watch-y", 5);
    awaitTrue(() -> claimRegistry.claimedWatchIds().size() == 2);
    final String retiredWatch =
        claimRegistry.ownerOf("watch-x").orElseThrow() == 1 ? "watch-x" : "watch-y";

    assertThat(manager.scaleTo(1)).isEqualTo(ScaleResult.SUCCESS);
    assertThat(manager.scaleTo(2)).isEqualTo(ScaleResult.SUCCESS);

    assertThat(manager.status()).extracting(WorkerStatus::workerId).containsExactly(0, 2);
    assertThat(manager.drainingCount()).isEqualTo(1);
    awaitTrue(
        () ->
            manager.status().stream()
                .anyMatch(status -> status.workerId() == 2 && !status.alive()));

    final HealthReport report = manager.checkHealth(2);

    assertThat(report.status()).isEqualTo(HealthStatus.REPAIRED);
    assertThat(report.restartedWorkerIds()).doesNotContain(1);
    assertThat(claimRegistry.ownerOf(retiredWatch)).contains(1);
    assertThat(claimRegistry.tryClaim(retiredWatch, 99)).isFalse();

    jobGate.countDown();

    awaitTrue(() -> manager.drainingCount() == 0);
    assertThat(claimRegistry.isClaimed(retiredWatch)).isFalse();
  }

  @Test
  void poolThatCannotReachExpectedCountIsDegraded() {
    manager.start(2);
    manager.shutdown();
    awaitTrue(() -> manager.status().stream().noneMatch(WorkerStatus::alive));

    final HealthReport report = manager.checkHealth(2);

    assertThat(report.status()).isEqualTo(HealthStatus.DEGRADED);
    assertThat(report.alive()).isZero();
  }

  private static void awaitTrue(BooleanSupplier condition) {
    final long deadline = System.nanoTime() + Duration.ofSeconds(5).toNanos();
    while (!condition.getAsBoolean()) {
      if (System.nanoTime() > deadline) {
        throw new AssertionError("condition not met within 5s");
      }
      try {
        Thread.sleep(10);
      } catch (InterruptedException ex) {
        Thread.currentThread().interrupt();
        throw new AssertionError("interrupted while waiting", ex);
      }
    }
  }
}
