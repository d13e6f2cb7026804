package com.changewatch.scheduler.fetch;

import java.time.Duration;
import java.util.Map;

/** 取得 1 回分の入力。バックエンドに依存しない。 */
public record FetchRequest(
    String url,
    Map<String, String> headers,
    Duration timeout,
    String method,
    String body,
    boolean includeScreenshot) {

  public FetchRequest {
    headers = headers == null ? Map.of() : Map.copyOf(headers);
    method = method == null || method.isBlank() ? "GET" : method;
  }
}
