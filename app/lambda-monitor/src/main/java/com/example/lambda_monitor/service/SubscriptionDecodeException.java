/*
 * どこで: Lambda Monitor サービス層
 * 何を: 購読エンベロープの展開失敗を表す
 * なぜ: 再送しても回復しない入力不正として API 層で 400 に変換するため
 */
package com.example.lambda_monitor.service;

public class SubscriptionDecodeException extends RuntimeException {

  public SubscriptionDecodeException(String message) {
    super(message);
  }

  public SubscriptionDecodeException(String message, Throwable cause) {
    super(message, cause);
  }
}
