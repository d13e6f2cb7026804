package com.changewatch.scheduler.model;

/**
 * スナップショット履歴の 1 件。
 *
 * @param timestamp エポック秒。watch 内で一意
 * @param snapshotRef スナップショット保存先の参照
 */
public record HistoryEntry(long timestamp, String snapshotRef) {}
