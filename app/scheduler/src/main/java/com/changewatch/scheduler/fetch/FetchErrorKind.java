/*
 * どこで: Fetch 契約
 * 何を: 取得失敗の種別と、watch の last_error に出す文言を定義する
 * なぜ: ワーカーが種別ごとに扱いを分け (一時的/致命的)、利用者へ一貫した文言を見せるため
 */
package com.changewatch.scheduler.fetch;

public enum FetchErrorKind {
  EMPTY_REPLY(true),
  HTTP_ERROR(true),
  TIMEOUT(true),
  CONNECTION(true),
  PAGE_UNLOADABLE(true),
  BROWSER_CONNECT(true),
  BROWSER_TIMEOUT(true),
  UNSUPPORTED(false);

  private final boolean transientFailure;

  FetchErrorKind(boolean transientFailure) {
    this.transientFailure = transientFailure;
  }

  /** 次回の定期チェックで回復しうる失敗なら true。 */
  public boolean isTransient() {
    return transientFailure;
  }

  public String describe(int statusCode, String detail) {
    return switch (this) {
      case EMPTY_REPLY -> "Empty reply from server";
      case HTTP_ERROR -> describeHttpStatus(statusCode);
      case TIMEOUT -> "Timeout while fetching the page";
      case CONNECTION -> "Connection failed" + suffix(detail);
      case PAGE_UNLOADABLE -> "Page could not be loaded" + suffix(detail);
      case BROWSER_CONNECT -> "Could not connect to the browser service" + suffix(detail);
      case BROWSER_TIMEOUT -> "Browser service timed out while loading the page";
      case UNSUPPORTED -> "Unsupported fetch request" + suffix(detail);
    };
  }

  private static String describeHttpStatus(int statusCode) {
    return switch (statusCode) {
      case 403 -> "Error - 403 (Access denied) received";
      case 404 -> "Error - 404 (Page not found) received";
      case 407 -> "Error - 407 (Proxy authentication required) received, did you need a username and password for the proxy?";
      case 500 -> "Error - 500 (Internal server error) received from the web site";
      default ->
          "Error - Request returned a HTTP error code " + statusCode + " (Access denied or blocked)";
    };
  }

  private static String suffix(String detail) {
    return detail == null || detail.isBlank() ? "" : ": " + detail;
  }
}
