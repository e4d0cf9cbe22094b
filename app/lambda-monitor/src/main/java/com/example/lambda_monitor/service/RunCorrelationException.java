/*
 * どこで: Lambda Monitor サービス層
 * 何を: 購読バッチから処理対象 run を特定できない失敗を表す
 * なぜ: バッチ全体を中断すべき失敗を API 層で一貫変換するため
 */
package com.example.lambda_monitor.service;

public class RunCorrelationException extends RuntimeException {

  public enum Reason {
    NO_END_EVENTS,
    DUPLICATE_REQUEST_ID
  }

  private final Reason reason;

  public RunCorrelationException(Reason reason, String message) {
    super(message);
    this.reason = reason;
  }

  public Reason reason() {
    return reason;
  }
}
