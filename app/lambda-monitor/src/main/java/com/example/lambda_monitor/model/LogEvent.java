/*
 * どこで: Lambda Monitor ドメインモデル
 * 何を: CloudWatch Logs の 1 行分のイベント
 * なぜ: 購読バッチと再取得結果を同一形状で扱うため
 */
package com.example.lambda_monitor.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

@JsonIgnoreProperties(ignoreUnknown = true)
public record LogEvent(long timestamp, String message, Map<String, String> extractedFields) {

  public LogEvent {
    message = message == null ? "" : message;
    // extractedFields は購読フィルタがパターン指定されている場合のみ付与される
    extractedFields =
        extractedFields == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(extractedFields));
  }

  public LogEvent(long timestamp, String message) {
    this(timestamp, message, Map.of());
  }
}
