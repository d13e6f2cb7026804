/*
 * どこで: Notification 監査モデル
 * 何を: 配信失敗 1 回分の記録
 * なぜ: キューのバックエンドを替えても試行履歴を追えるようにするため
 */
package com.changewatch.scheduler.model;

import java.time.Instant;

public record RetryAttemptRecord(
    String watchId,
    String taskId,
    int attemptNumber,
    Instant timestamp,
    String watchUrl,
    String error,
    boolean willRetry,
    Instant nextAttemptAt) {}
