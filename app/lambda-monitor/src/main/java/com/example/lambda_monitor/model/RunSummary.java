/*
 * どこで: Lambda Monitor ドメインモデル
 * 何を: 1 回の実行(run)の集計結果
 * なぜ: 解析結果を整形/通知に不変のまま受け渡すため
 */
package com.example.lambda_monitor.model;

import java.util.List;

public record RunSummary(
    String requestId,
    long startTimestamp,
    long endTimestamp,
    int errorCount,
    int warningCount,
    List<LogEvent> events) {

  public RunSummary {
    if (endTimestamp < startTimestamp) {
      throw new IllegalArgumentException("end timestamp precedes start timestamp");
    }
    if (errorCount < 0 || warningCount < 0) {
      throw new IllegalArgumentException("counts must not be negative");
    }
    events = List.copyOf(events);
  }

  /** ミリ秒単位の実行時間。 */
  public long duration() {
    return endTimestamp - startTimestamp;
  }

  public RunStatus status() {
    return RunStatus.of(errorCount, warningCount);
  }
}
