package com.changewatch.scheduler.service;

import java.util.List;

/** 配信バックエンドへ渡す 1 回分の配信内容。 */
public record NotificationDispatch(
    String taskId, List<String> targets, String format, String title, String body, String watchUrl) {

  public NotificationDispatch {
    targets = targets == null ? List.of() : List.copyOf(targets);
  }
}
