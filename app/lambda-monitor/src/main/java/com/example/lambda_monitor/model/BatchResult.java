/*
 * どこで: Lambda Monitor ドメインモデル
 * 何を: 購読バッチ 1 件の処理結果
 * なぜ: 呼び出し元へ成功/失敗 run を区別して返すため
 */
package com.example.lambda_monitor.model;

import java.util.List;

public record BatchResult(
    String functionName,
    boolean skipped,
    List<PublishReceipt> receipts,
    List<RunFailure> failures) {

  public BatchResult {
    receipts = List.copyOf(receipts);
    failures = List.copyOf(failures);
  }

  public static BatchResult skippedBatch() {
    return new BatchResult(null, true, List.of(), List.of());
  }

  public boolean hasFailures() {
    return !failures.isEmpty();
  }
}
