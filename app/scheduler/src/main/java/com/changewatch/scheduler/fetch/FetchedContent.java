package com.changewatch.scheduler.fetch;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;

/**
 * 取得結果。スクリーンショットは対応バックエンドのみが返す任意項目。
 *
 * @param content 取得した本文
 * @param statusCode HTTP ステータス (不明なら 0)
 * @param contentType レスポンスの Content-Type (不明なら null)
 * @param screenshot スクリーンショット画像 (無ければ null)
 */
@SuppressFBWarnings(
    value = {"EI_EXPOSE_REP", "EI_EXPOSE_REP2"},
    justification = "スクリーンショットは一度書き出すだけで共有しないため")
public record FetchedContent(
    String content, int statusCode, String contentType, byte[] screenshot) {

  public static FetchedContent of(String content, int statusCode, String contentType) {
    return new FetchedContent(content, statusCode, contentType, null);
  }

  public boolean hasScreenshot() {
    return screenshot != null && screenshot.length > 0;
  }

  public FetchedContent withScreenshot(byte[] image) {
    return new FetchedContent(content, statusCode, contentType, image);
  }
}
