/*
 * どこで: Lambda Monitor ドメインモデル
 * 何を: 展開済みの CloudWatch Logs 購読ペイロード
 * なぜ: 購読通知のロググループ/ストリーム/イベントを型付きで扱うため
 */
package com.example.lambda_monitor.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record LogSubscriptionBatch(
    String messageType,
    String owner,
    String logGroup,
    String logStream,
    List<String> subscriptionFilters,
    List<LogEvent> logEvents) {

  public static final String CONTROL_MESSAGE = "CONTROL_MESSAGE";

  public LogSubscriptionBatch {
    subscriptionFilters = subscriptionFilters == null ? List.of() : List.copyOf(subscriptionFilters);
    logEvents = logEvents == null ? List.of() : List.copyOf(logEvents);
  }

  /** 購読作成時に CloudWatch が送る疎通確認メッセージかどうか。 */
  public boolean isControlMessage() {
    return CONTROL_MESSAGE.equals(messageType);
  }
}
