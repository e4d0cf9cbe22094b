/*
 * どこで: Lambda Monitor ドメインモデル
 * 何を: run の結果ステータスを定義する
 * なぜ: SNS のフィルタポリシーで使う値を固定するため
 */
package com.example.lambda_monitor.model;

public enum RunStatus {
  SUCCESS("success"),
  WARNING("warning"),
  ERROR("error");

  private final String value;

  RunStatus(String value) {
    this.value = value;
  }

  public String value() {
    return value;
  }

  /**
   * 役割: エラー数/警告数から run のステータスを決める。
   * 動作: エラーが 1 件でもあれば error、次に警告があれば warning、それ以外は success。
   */
  public static RunStatus of(int errorCount, int warningCount) {
    if (errorCount > 0) {
      return ERROR;
    }
    if (warningCount > 0) {
      return WARNING;
    }
    return SUCCESS;
  }
}
