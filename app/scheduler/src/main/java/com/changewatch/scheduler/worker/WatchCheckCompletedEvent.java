package com.changewatch.scheduler.worker;

import java.time.Duration;
import java.time.Instant;

/** 1 件のジョブが終わった (claim を解放した) ことを知らせるアプリケーションイベント。 */
public record WatchCheckCompletedEvent(
    String watchId, int workerId, JobOutcome outcome, Instant completedAt, Duration elapsed) {}
