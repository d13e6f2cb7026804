/*
 * どこで: Scheduler ワーカー層
 * 何を: チェックワーカーのスレッドを起動・増減・健全性確認・停止する
 * なぜ: 実行中の claim に触れずにワーカー数を変え、死んだワーカーを自動で補充するため
 */
package com.changewatch.scheduler.worker;

import com.changewatch.scheduler.config.WatchWorkerProperties;
import com.changewatch.scheduler.model.WorkerStatus;
import com.changewatch.scheduler.queue.ClaimRegistry;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

@Component
public class WorkerPoolManager implements SmartLifecycle {

  private static final Logger logger = LoggerFactory.getLogger(WorkerPoolManager.class);
  static final int MAX_WORKERS = 50;

  private final CheckWorkerFactory workerFactory;
  private final ClaimRegistry claimRegistry;
  private final WatchWorkerProperties properties;
  private final CheckMetrics metrics;
  private final ThreadFactory threadFactory =
      new ThreadFactoryBuilder().setNameFormat("check-worker-thread-%d").setDaemon(true).build();
  // 全ての変更はこのロックの下で行う
  private final ReentrantLock lock = new ReentrantLock();
  private final TreeMap<Integer, WorkerSlot> slots = new TreeMap<>();
  // 停止要求済みで処理中ジョブを終えていないワーカー。スレッドが抜けるまで id を再利用しない
  private final Map<Integer, WorkerSlot> draining = new HashMap<>();
  private volatile boolean running;
  private volatile boolean shuttingDown;
  private volatile int targetCount;

  public WorkerPoolManager(
      CheckWorkerFactory workerFactory,
      ClaimRegistry claimRegistry,
      WatchWorkerProperties properties,
      CheckMetrics metrics) {
    this.workerFactory = workerFactory;
    this.claimRegistry = claimRegistry;
    this.properties = properties;
    this.metrics = metrics;
  }

  @Override
  public void start() {
    start(properties.count());
  }

  public void start(int count) {
    lock.lock();
    try {
      shuttingDown = false;
      running = true;
      targetCount = count;
      // shutdown 後の再開では停止要求済みのスロットを draining へ移してから補充する
      slots.values().removeIf(
          slot -> {
            if (slot.retired) {
              draining.put(slot.id, slot);
              return true;
            }
            return false;
          });
      while (slots.size() < count) {
        startSlot(lowestFreeId());
      }
      logger.info("worker pool started count={}", slots.size());
    } finally {
      lock.unlock();
    }
    metrics.updateWorkersAlive(aliveCount());
  }

  /**
   * ワーカー数を n に合わせる。増やすときは空いている最小の id を使い、減らすときは大きい id
   * から停止要求を出す。停止要求を受けたワーカーは処理中のジョブを終えてから抜ける。
   */
  public ScaleResult scaleTo(int count) {
    if (count < 1 || count > MAX_WORKERS) {
      logger.warn("worker scale rejected count={} max={}", count, MAX_WORKERS);
      return ScaleResult.ERROR;
    }
    final ScaleResult result;
    lock.lock();
    try {
      if (shuttingDown) {
        logger.warn("worker scale rejected because pool is shutting down count={}", count);
        return ScaleResult.ERROR;
      }
      targetCount = count;
      final int current = slots.size();
      if (count == current) {
        return ScaleResult.NO_CHANGE;
      }
      while (slots.size() < count) {
        startSlot(lowestFreeId());
      }
      while (slots.size() > count) {
        final WorkerSlot slot = slots.remove(slots.lastKey());
        retire(slot);
        draining.put(slot.id, slot);
      }
      logger.info("worker pool scaled from={} to={}", current, count);
      result = ScaleResult.SUCCESS;
    } finally {
      lock.unlock();
    }
    metrics.updateWorkersAlive(aliveCount());
    return result;
  }

  /** 実行スレッドが死んだワーカーを取り除き、期待数まで補充する。 */
  public HealthReport checkHealth(int expected) {
    final List<Integer> restarted = new ArrayList<>();
    final List<Integer> dead = new ArrayList<>();
    final int alive;
    lock.lock();
    try {
      for (Map.Entry<Integer, WorkerSlot> entry : slots.entrySet()) {
        if (!entry.getValue().thread.isAlive()) {
          dead.add(entry.getKey());
        }
      }
      for (Integer id : dead) {
        slots.remove(id);
        // claim は処理の finally で解放済みのはずだが、スレッドごと死んだ場合に備える
        final List<String> released = claimRegistry.releaseAll(id);
        logger.warn("dead worker removed workerId={} releasedClaims={}", id, released);
      }
      if (!shuttingDown) {
        while (slots.size() < expected) {
          final int id = lowestFreeId();
          startSlot(id);
          restarted.add(id);
        }
      }
      alive = (int) slots.values().stream().filter(slot -> slot.thread.isAlive()).count();
    } finally {
      lock.unlock();
    }
    metrics.updateWorkersAlive(alive);
    final HealthStatus status;
    if (alive < expected) {
      status = HealthStatus.DEGRADED;
    } else if (dead.isEmpty() && restarted.isEmpty()) {
      status = HealthStatus.HEALTHY;
    } else {
      status = HealthStatus.REPAIRED;
    }
    if (status != HealthStatus.HEALTHY) {
      logger.warn(
          "worker health check status={} expected={} alive={} restarted={}",
          status,
          expected,
          alive,
          restarted);
    }
    return new HealthReport(status, expected, alive, restarted);
  }

  /** 全ワーカーに停止要求を出して即座に戻る。スレッドは daemon なので待たない。 */
  public void shutdown() {
    lock.lock();
    try {
      shuttingDown = true;
      running = false;
      slots.values().forEach(this::retire);
      logger.info("worker pool shutdown requested workers={}", slots.size());
    } finally {
      lock.unlock();
    }
  }

  @Override
  public void stop() {
    shutdown();
  }

  @Override
  public boolean isRunning() {
    return running;
  }

  public List<WorkerStatus> status() {
    lock.lock();
    try {
      final List<WorkerStatus> result = new ArrayList<>();
      for (WorkerSlot slot : slots.values()) {
        final CheckWorker worker = slot.worker;
        result.add(
            new WorkerStatus(
                slot.id,
                slot.thread.isAlive(),
                worker == null ? null : worker.currentWatchId(),
                worker == null ? 0 : worker.jobsProcessed(),
                worker == null ? Duration.ZERO : worker.uptime()));
      }
      return result;
    } finally {
      lock.unlock();
    }
  }

  public int workerCount() {
    lock.lock();
    try {
      return slots.size();
    } finally {
      lock.unlock();
    }
  }

  public int targetCount() {
    return targetCount;
  }

  private int aliveCount() {
    lock.lock();
    try {
      return (int) slots.values().stream().filter(slot -> slot.thread.isAlive()).count();
    } finally {
      lock.unlock();
    }
  }

  /** 現役のワーカーにも、処理中ジョブを終えていない停止済みワーカーにも使われていない最小の id。 */
  private int lowestFreeId() {
    draining.values().removeIf(slot -> !slot.thread.isAlive());
    int id = 0;
    while (slots.containsKey(id) || draining.containsKey(id)) {
      id++;
    }
    return id;
  }

  private void startSlot(int id) {
    final WorkerSlot slot = new WorkerSlot(id);
    final Thread thread = threadFactory.newThread(() -> drive(slot));
    thread.setName("check-worker-" + id);
    slot.thread = thread;
    slots.put(id, slot);
    thread.start();
  }

  private void retire(WorkerSlot slot) {
    slot.retired = true;
    final CheckWorker worker = slot.worker;
    if (worker != null) {
      worker.requestStop();
    }
  }

  /** 1 つの id を担当するドライバループ。RESTART なら同じ id で作り直す。 */
  private void drive(WorkerSlot slot) {
    try {
      runSlot(slot);
    } finally {
      leaveDraining(slot);
    }
  }

  private void runSlot(WorkerSlot slot) {
    while (!slot.retired && !shuttingDown) {
      final CheckWorker worker = workerFactory.create(slot.id);
      slot.worker = worker;
      if (slot.retired) {
        // create と retire が交差した場合の停止要求の取りこぼしを防ぐ
        worker.requestStop();
      }
      try {
        final WorkerOutcome outcome = worker.run();
        if (outcome == WorkerOutcome.SHUTDOWN) {
          return;
        }
        logger.info("worker restarting workerId={} jobs={}", slot.id, worker.jobsProcessed());
      } catch (RuntimeException ex) {
        logger.error("worker crashed workerId={}", slot.id, ex);
        if (!sleepBeforeRestart()) {
          return;
        }
      }
    }
  }

  // 停止済みワーカーが抜けた時点で、その id の claim は他の誰のものでもない
  private void leaveDraining(WorkerSlot slot) {
    lock.lock();
    try {
      if (draining.remove(slot.id, slot)) {
        final List<String> released = claimRegistry.releaseAll(slot.id);
        if (!released.isEmpty()) {
          logger.warn(
              "retired worker left claims behind workerId={} releasedClaims={}",
              slot.id,
              released);
        }
      }
    } finally {
      lock.unlock();
    }
  }

  @VisibleForTesting
  int drainingCount() {
    lock.lock();
    try {
      return draining.size();
    } finally {
      lock.unlock();
    }
  }

  private boolean sleepBeforeRestart() {
    try {
      Thread.sleep(properties.crashRestartDelay().toMillis());
      return true;
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      return false;
    }
  }

  private static final class WorkerSlot {
    private final int id;
    private volatile Thread thread;
    private volatile CheckWorker worker;
    private volatile boolean retired;

    WorkerSlot(int id) {
      this.id = id;
    }
  }
}
