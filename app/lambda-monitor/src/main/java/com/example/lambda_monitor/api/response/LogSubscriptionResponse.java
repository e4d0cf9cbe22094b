/*
 * どこで: Lambda Monitor API レスポンス
 * 何を: 購読バッチの処理結果(送信済み run/失敗 run)を返す
 * なぜ: 呼び出し元が部分失敗を判別できるようにするため
 */
package com.example.lambda_monitor.api.response;

import com.example.lambda_monitor.model.BatchResult;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record LogSubscriptionResponse(
    String functionName, String outcome, List<PublishedRun> published, List<FailedRun> failed) {

  public static final String OUTCOME_SKIPPED = "skipped";
  public static final String OUTCOME_PROCESSED = "processed";
  public static final String OUTCOME_PARTIAL = "partial";

  public static LogSubscriptionResponse from(BatchResult result) {
    final List<PublishedRun> published =
        result.receipts().stream()
            .map(
                receipt ->
                    new PublishedRun(
                        receipt.requestId(), receipt.messageId(), receipt.status().value()))
            .toList();
    final List<FailedRun> failed =
        result.failures().stream()
            .map(failure -> new FailedRun(failure.requestId(), failure.reason(), failure.message()))
            .toList();
    return new LogSubscriptionResponse(result.functionName(), outcomeOf(result), published, failed);
  }

  private static String outcomeOf(BatchResult result) {
    if (result.skipped()) {
      return OUTCOME_SKIPPED;
    }
    return result.hasFailures() ? OUTCOME_PARTIAL : OUTCOME_PROCESSED;
  }

  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  public record PublishedRun(String requestId, String messageId, String status) {}

  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  public record FailedRun(String requestId, String reason, String message) {}
}
