package com.changewatch.scheduler.fetch;

/**
 * 監視対象の取得バックエンド。
 *
 * <p>実装は {@link #name()} で識別され、watch ごとの設定文字列から {@link ContentFetcherRegistry}
 * がジョブ単位で 1 回だけ解決する。
 */
public interface ContentFetcher {

  /** 設定で指定する識別名 (例: {@code http}, {@code browser})。 */
  String name();

  /**
   * 対象を取得する。
   *
   * @throws FetchException 取得に失敗した場合。種別はワーカー側の扱いを決める
   */
  FetchedContent fetch(FetchRequest request);

  /** スクリーンショット取得に対応していれば true。 */
  default boolean supportsScreenshot() {
    return false;
  }
}
