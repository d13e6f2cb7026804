/*
 * どこで: Scheduler 管理 API
 * 何を: ワーカープールの状態参照・増減・健全性確認とジョブキュー参照を公開する
 * なぜ: 負荷に応じて運用者がワーカー数を調整できるようにするため
 */
package com.changewatch.scheduler.api;

import com.changewatch.scheduler.api.request.WorkerScaleRequest;
import com.changewatch.scheduler.api.response.HealthReportResponse;
import com.changewatch.scheduler.api.response.QueueResponse;
import com.changewatch.scheduler.api.response.ScaleResponse;
import com.changewatch.scheduler.api.response.WorkerPoolResponse;
import com.changewatch.scheduler.queue.ClaimRegistry;
import com.changewatch.scheduler.queue.RecheckPriorityQueue;
import com.changewatch.scheduler.worker.ScaleResult;
import com.changewatch.scheduler.worker.WorkerPoolManager;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/admin")
@RequiredArgsConstructor
public class WorkerAdminController {

  private final WorkerPoolManager poolManager;
  private final RecheckPriorityQueue queue;
  private final ClaimRegistry claimRegistry;

  @GetMapping("/workers")
  public ResponseEntity<WorkerPoolResponse> workers() {
    return ResponseEntity.ok(WorkerPoolResponse.of(poolManager.targetCount(), poolManager.status()));
  }

  @PutMapping("/workers")
  public ResponseEntity<ScaleResponse> scale(@Valid @RequestBody WorkerScaleRequest request) {
    final ScaleResult result = poolManager.scaleTo(request.count());
    if (result == ScaleResult.ERROR) {
      throw new InvalidAdminRequestException(
          "worker count must be between 1 and 50 and the pool must be running");
    }
    return ResponseEntity.ok(new ScaleResponse(result.name(), poolManager.workerCount()));
  }

  @PostMapping("/workers/health")
  public ResponseEntity<HealthReportResponse> health() {
    return ResponseEntity.ok(
        HealthReportResponse.from(poolManager.checkHealth(poolManager.targetCount())));
  }

  @GetMapping("/queue")
  public ResponseEntity<QueueResponse> queue() {
    return ResponseEntity.ok(QueueResponse.of(queue.snapshot(), claimRegistry.claimedWatchIds()));
  }
}
