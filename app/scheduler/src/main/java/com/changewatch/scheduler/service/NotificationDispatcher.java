/*
 * どこで: Notification サービス層
 * 何を: 通知配信バックエンドの抽象化インターフェース
 * なぜ: 実送信/ログ出力/テスト用失敗注入を差し替えられるようにするため
 */
package com.changewatch.scheduler.service;

public interface NotificationDispatcher {

  /** 送信できなかった場合は例外ではなく失敗結果を返す。 */
  DispatchResult dispatch(NotificationDispatch dispatch);
}
