/*
 * どこで: Fetch 契約
 * 何を: 取得失敗を種別付きで表現する
 * なぜ: バックエンドごとの例外をワーカーが一律に分類できるようにするため
 */
package com.changewatch.scheduler.fetch;

public class FetchException extends RuntimeException {

  private final FetchErrorKind kind;
  private final int statusCode;

  public FetchException(FetchErrorKind kind, int statusCode, String message) {
    super(message);
    this.kind = kind;
    this.statusCode = statusCode;
  }

  public FetchException(FetchErrorKind kind, int statusCode, String message, Throwable cause) {
    super(message, cause);
    this.kind = kind;
    this.statusCode = statusCode;
  }

  public FetchErrorKind kind() {
    return kind;
  }

  public int statusCode() {
    return statusCode;
  }

  /** watch の last_error として保存する文言。 */
  public String lastErrorText() {
    return kind.describe(statusCode, getMessage());
  }
}
