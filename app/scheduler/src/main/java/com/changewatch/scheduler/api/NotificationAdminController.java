/*
 * どこで: Scheduler 管理 API
 * 何を: 通知再送キューの設定参照・dead letter の一覧/再投入・未配信一覧・全消去・テスト送信を公開する
 * なぜ: 配信先を直した運用者が失敗した通知を送り直せるようにするため
 */
package com.changewatch.scheduler.api;

import com.changewatch.scheduler.api.request.TestNotificationRequest;
import com.changewatch.scheduler.api.response.ClearNotificationsResponse;
import com.changewatch.scheduler.api.response.DeliveryResponse;
import com.changewatch.scheduler.api.response.EnqueueNotificationResponse;
import com.changewatch.scheduler.api.response.NotificationTaskResponse;
import com.changewatch.scheduler.api.response.ReplayResponse;
import com.changewatch.scheduler.api.response.RetryConfigResponse;
import com.changewatch.scheduler.api.response.RetryNowResponse;
import com.changewatch.scheduler.model.ReplaySummary;
import com.changewatch.scheduler.service.NotificationMessage;
import com.changewatch.scheduler.service.NotificationQueueService;
import com.changewatch.scheduler.service.NotificationRetryService;
import com.changewatch.scheduler.service.WatchAdminService;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/admin/notifications")
@RequiredArgsConstructor
public class NotificationAdminController {

  private static final String DEFAULT_TEST_TITLE = "change-watch test notification";
  private static final String DEFAULT_TEST_BODY = "This is a test notification.";

  private final NotificationRetryService retryService;
  private final NotificationQueueService queueService;
  private final WatchAdminService watchAdminService;

  @GetMapping("/retry-config")
  public ResponseEntity<RetryConfigResponse> retryConfig() {
    return ResponseEntity.ok(RetryConfigResponse.from(retryService.retryConfig()));
  }

  @GetMapping("/dead-letters")
  public ResponseEntity<List<NotificationTaskResponse>> deadLetters() {
    return ResponseEntity.ok(
        retryService.listDeadLetters().stream()
            .map(NotificationTaskResponse::fromDeadLetter)
            .toList());
  }

  @PostMapping("/dead-letters/{taskId}/replay")
  public ResponseEntity<NotificationTaskResponse> replay(@PathVariable("taskId") String taskId) {
    return ResponseEntity.status(HttpStatus.ACCEPTED)
        .body(NotificationTaskResponse.fromPending(retryService.replayDeadLetter(taskId)));
  }

  @PostMapping("/dead-letters/{taskId}/retry-now")
  public ResponseEntity<RetryNowResponse> retryNow(@PathVariable("taskId") String taskId) {
    return ResponseEntity.ok(new RetryNowResponse(taskId, retryService.retryNow(taskId)));
  }

  @PostMapping("/dead-letters/replay")
  public ResponseEntity<ReplayResponse> replayAll() {
    final ReplaySummary summary = retryService.replayAll();
    return ResponseEntity.ok(
        new ReplayResponse(summary.success(), summary.failed(), summary.total()));
  }

  @GetMapping("/pending")
  public ResponseEntity<List<NotificationTaskResponse>> pending() {
    return ResponseEntity.ok(
        retryService.pending().stream().map(NotificationTaskResponse::fromPending).toList());
  }

  @GetMapping("/deliveries")
  public ResponseEntity<List<DeliveryResponse>> deliveries(
      @RequestParam(value = "limit", defaultValue = "20") int limit) {
    if (limit < 1 || limit > 100) {
      throw new InvalidAdminRequestException("limit must be between 1 and 100");
    }
    return ResponseEntity.ok(
        retryService.recentDeliveries(limit).stream().map(DeliveryResponse::from).toList());
  }

  @DeleteMapping
  public ResponseEntity<ClearNotificationsResponse> clearAll() {
    return ResponseEntity.ok(new ClearNotificationsResponse(retryService.clearAll()));
  }

  @PostMapping("/test")
  public ResponseEntity<EnqueueNotificationResponse> test(
      @RequestBody(required = false) TestNotificationRequest request) {
    final String title =
        request == null || isBlank(request.title()) ? DEFAULT_TEST_TITLE : request.title();
    final String body =
        request == null || isBlank(request.body()) ? DEFAULT_TEST_BODY : request.body();
    final NotificationMessage message = new NotificationMessage(title, body);
    final String taskId =
        request == null || isBlank(request.watchId())
            ? queueService.enqueueStandalone(message)
            : queueService.enqueueForWatch(
                watchAdminService.get(request.watchId()), message, null, null);
    return ResponseEntity.status(HttpStatus.ACCEPTED).body(new EnqueueNotificationResponse(taskId));
  }

  private static boolean isBlank(String value) {
    return value == null || value.isBlank();
  }
}
