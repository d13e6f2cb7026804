package com.changewatch.scheduler.model;

import java.time.Duration;

/** 管理 API 向けのワーカー状態。 */
public record WorkerStatus(
    int workerId, boolean alive, String currentWatchId, int jobsProcessed, Duration uptime) {}
