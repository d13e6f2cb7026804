package com.changewatch.scheduler.model;

/** dead letter 一括再投入の結果。 */
public record ReplaySummary(int success, int failed, int total) {}
