package com.changewatch.scheduler.worker;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.changewatch.scheduler.MutableClock;
import com.changewatch.scheduler.config.WatchWorkerProperties;
import com.changewatch.scheduler.model.QueueItem;
import com.changewatch.scheduler.queue.RecheckPriorityQueue;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class CheckWorkerTest {

  private final CheckJobExecutor executor = mock(CheckJobExecutor.class);
  private MutableClock clock;
  private WatchWorkerProperties properties;
  private RecheckPriorityQueue queue;

  @BeforeEach
  void setUp() {
    clock = new MutableClock(Instant.parse("2026-03-01T00:00:00Z"));
    properties =
        new WatchWorkerProperties(
            1, 2, Duration.ofMinutes(10), Duration.ofMillis(20), null, null, null, null, null,
            null, null);
    queue = new RecheckPriorityQueue(properties);
  }

  @Test
  void returnsRestartAfterMaxJobs() {
    when(executor.execute(anyInt(), any())).thenReturn(JobOutcome.UNCHANGED);
    queue.enqueue("a", 1);
    queue.enqueue("b", 2);
    queue.enqueue("c", 3);
    final CheckWorker worker = new CheckWorker(7, executor, queue, properties, clock);

    final WorkerOutcome outcome = worker.run();

    assertThat(outcome).isEqualTo(WorkerOutcome.RESTART);
    assertThat(worker.jobsProcessed()).isEqualTo(2);
    assertThat(queue.snapshot()).extracting(QueueItem::watchId).containsExactly("c");
  }

  @Test
  void deferredJobsDoNotCountTowardsRestart() {
    when(executor.execute(anyInt(), any()))
        .thenReturn(JobOutcome.DEFERRED)
        .thenReturn(JobOutcome.CHANGED)
        .thenReturn(JobOutcome.UNCHANGED);
    queue.enqueue("a", 1);
    queue.enqueue("b", 2);
    queue.enqueue("c", 3);
    final CheckWorker worker = new CheckWorker(7, executor, queue, properties, clock);

    assertThat(worker.run()).isEqualTo(WorkerOutcome.RESTART);
    verify(executor, times(3)).execute(anyInt(), any());
    assertThat(queue.size()).isZero();
  }

  @Test
  void returnsRestartOnceMaxRuntimeElapsed() {
    final CheckWorker worker = new CheckWorker(7, executor, queue, properties, clock);
    clock.advance(Duration.ofMinutes(10));

    assertThat(worker.shouldRestart()).isTrue();
    assertThat(worker.run()).isEqualTo(WorkerOutcome.RESTART);
    assertThat(worker.jobsProcessed()).isZero();
  }

  @Test
  void stopRequestEndsLoopWithShutdown() throws Exception {
    final CheckWorker worker = new CheckWorker(7, executor, queue, properties, clock);
    final CompletableFuture<WorkerOutcome> result = CompletableFuture.supplyAsync(worker::run);

    worker.requestStop();

    assertThat(result.get(5, TimeUnit.SECONDS)).isEqualTo(WorkerOutcome.SHUTDOWN);
  }

  @Test
  void interruptWhileWaitingEndsWithShutdown() throws Exception {
    final CheckWorker worker = new CheckWorker(7, executor, queue, properties, clock);
    final WorkerOutcome[] outcome = new WorkerOutcome[1];
    final Thread thread = new Thread(() -> outcome[0] = worker.run());
    thread.start();

    thread.interrupt();
    thread.join(5000);

    assertThat(thread.isAlive()).isFalse();
    assertThat(outcome[0]).isEqualTo(WorkerOutcome.SHUTDOWN);
  }

  @Test
  void currentWatchIdIsClearedAfterJob() {
    when(executor.execute(anyInt(), any())).thenReturn(JobOutcome.UNCHANGED);
    queue.enqueue("a", 1);
    queue.enqueue("b", 1);
    final CheckWorker worker = new CheckWorker(7, executor, queue, properties, clock);

    worker.run();

    assertThat(worker.currentWatchId()).isNull();
  }
}
