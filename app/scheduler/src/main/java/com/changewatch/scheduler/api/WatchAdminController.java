/*
 * どこで: Scheduler 管理 API
 * 何を: watch の登録・参照・削除・即時再チェックと全体通知設定を公開する
 * なぜ: 画面を持たない環境でも監視対象と通知先を操作できるようにするため
 */
package com.changewatch.scheduler.api;

import com.changewatch.scheduler.api.request.NotificationSettingsRequest;
import com.changewatch.scheduler.api.request.WatchCreateRequest;
import com.changewatch.scheduler.api.response.RecheckResponse;
import com.changewatch.scheduler.api.response.RetryAttemptResponse;
import com.changewatch.scheduler.api.response.WatchResponse;
import com.changewatch.scheduler.model.NotificationSettings;
import com.changewatch.scheduler.service.NotificationRetryService;
import com.changewatch.scheduler.service.WatchAdminService;
import jakarta.validation.Valid;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/admin")
@RequiredArgsConstructor
public class WatchAdminController {

  private final WatchAdminService watchAdminService;
  private final NotificationRetryService retryService;

  @PostMapping("/watches")
  public ResponseEntity<WatchResponse> create(@Valid @RequestBody WatchCreateRequest request) {
    return ResponseEntity.status(HttpStatus.CREATED)
        .body(WatchResponse.from(watchAdminService.create(request)));
  }

  @GetMapping("/watches/{uuid}")
  public ResponseEntity<WatchResponse> get(@PathVariable("uuid") String uuid) {
    return ResponseEntity.ok(WatchResponse.from(watchAdminService.get(uuid)));
  }

  @DeleteMapping("/watches/{uuid}")
  public ResponseEntity<Void> delete(@PathVariable("uuid") String uuid) {
    watchAdminService.delete(uuid);
    return ResponseEntity.noContent().build();
  }

  @PostMapping("/watches/{uuid}/recheck")
  public ResponseEntity<RecheckResponse> recheck(@PathVariable("uuid") String uuid) {
    final boolean queued = watchAdminService.recheck(uuid);
    return ResponseEntity.status(queued ? HttpStatus.ACCEPTED : HttpStatus.SERVICE_UNAVAILABLE)
        .body(new RecheckResponse(uuid, queued));
  }

  @GetMapping("/watches/{uuid}/notification-attempts")
  public ResponseEntity<List<RetryAttemptResponse>> attempts(@PathVariable("uuid") String uuid) {
    watchAdminService.get(uuid);
    return ResponseEntity.ok(
        retryService.attemptsFor(uuid).stream().map(RetryAttemptResponse::from).toList());
  }

  @PutMapping("/notification-settings")
  public ResponseEntity<NotificationSettings> updateNotificationSettings(
      @RequestBody NotificationSettingsRequest request) {
    return ResponseEntity.ok(watchAdminService.updateNotificationSettings(request));
  }
}
