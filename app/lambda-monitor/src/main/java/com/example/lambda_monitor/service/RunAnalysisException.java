/*
 * どこで: Lambda Monitor サービス層
 * 何を: 取得した run のイベント集合が不完全であることを表す
 * なぜ: 該当 run だけを失敗扱いにし、原因を区別して報告するため
 */
package com.example.lambda_monitor.service;

public class RunAnalysisException extends RuntimeException {

  public enum Reason {
    NO_EVENTS,
    MISSING_START,
    MISSING_END,
    DUPLICATE_START,
    DUPLICATE_END,
    END_BEFORE_START
  }

  private final Reason reason;
  private final String requestId;

  public RunAnalysisException(Reason reason, String requestId, String message) {
    super(message);
    this.reason = reason;
    this.requestId = requestId;
  }

  public Reason reason() {
    return reason;
  }

  public String requestId() {
    return requestId;
  }
}
