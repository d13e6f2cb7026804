package com.changewatch.scheduler.worker;

import com.changewatch.scheduler.config.WatchWorkerProperties;
import com.changewatch.scheduler.queue.RecheckPriorityQueue;
import java.time.Clock;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/** 再起動のたびに新しい {@link CheckWorker} を作る。 */
@Component
@RequiredArgsConstructor
public class CheckWorkerFactory {

  private final CheckJobExecutor executor;
  private final RecheckPriorityQueue queue;
  private final WatchWorkerProperties properties;
  private final Clock clock;

  public CheckWorker create(int workerId) {
    return new CheckWorker(workerId, executor, queue, properties, clock);
  }
}
