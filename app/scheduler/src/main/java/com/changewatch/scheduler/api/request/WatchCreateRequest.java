/*
 * どこで: Scheduler 管理 API リクエスト DTO
 * 何を: watch 登録 API の入力を定義する
 * なぜ: 画面を持たない運用環境でも監視対象を登録できるようにするため
 */
package com.changewatch.scheduler.api.request;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import java.util.List;
import java.util.Map;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP",
    justification = "API DTO record はリクエスト受け取り専用であり、防御的コピーを行わないため")
public record WatchCreateRequest(
    @NotBlank String url,
    Map<String, String> headers,
    String method,
    String body,
    String fetchBackend,
    String processor,
    @Positive Long checkIntervalSeconds,
    Boolean paused,
    Boolean notificationMuted,
    List<String> notificationUrls,
    String notificationFormat,
    String requiredText,
    Boolean filterFailureNotificationEnabled,
    Boolean includeScreenshot) {}
