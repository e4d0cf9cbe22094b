/*
 * どこで: Lambda Monitor サービス層
 * 何を: 購読元の設定不備(ロググループ名不正など)を表す
 * なぜ: 処理開始前にバッチ全体を打ち切るため
 */
package com.example.lambda_monitor.service;

public class MonitorConfigurationException extends RuntimeException {

  public MonitorConfigurationException(String message) {
    super(message);
  }
}
