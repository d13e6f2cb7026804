package com.changewatch.scheduler.service;

/** 配信バックエンドの結果。失敗時は error に理由を入れる。 */
public record DispatchResult(boolean success, String error) {

  public static DispatchResult ok() {
    return new DispatchResult(true, null);
  }

  public static DispatchResult failed(String error) {
    return new DispatchResult(false, error == null || error.isBlank() ? "unknown error" : error);
  }
}
