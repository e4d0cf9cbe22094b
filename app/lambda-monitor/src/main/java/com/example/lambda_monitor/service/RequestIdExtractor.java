/*
 * どこで: Lambda Monitor サービス層
 * 何を: 購読バッチの END イベントから request id を抽出する
 * なぜ: 部分的/順不同なバッチでも終了済み run だけを確実に特定するため
 */
package com.example.lambda_monitor.service;

import com.example.lambda_monitor.model.LogEvent;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.springframework.stereotype.Component;

@Component
public class RequestIdExtractor {

  static final String FIELD_TYPE = "type";
  static final String FIELD_REQUEST_ID = "requestId";
  static final String TYPE_END = "END";

  /**
   * 役割: END 行として抽出済みのイベントから request id を到着順に返す。
   * 動作: END が 1 件もなければ NO_END_EVENTS、同一 id が重複すれば DUPLICATE_REQUEST_ID を送出する。
   * 前提: extractedFields は購読フィルタ {@code [type=END,dummy,requestId,...]} が付与したもの。
   */
  public List<String> extract(List<LogEvent> events) {
    final Set<String> requestIds = new LinkedHashSet<>();
    if (events != null) {
      for (LogEvent event : events) {
        final Map<String, String> fields = event.extractedFields();
        if (!TYPE_END.equals(fields.get(FIELD_TYPE))) {
          continue;
        }
        final String requestId = fields.get(FIELD_REQUEST_ID);
        if (requestId == null || requestId.isBlank()) {
          continue;
        }
        if (!requestIds.add(requestId)) {
          // 同じ完了通知が二重に届くのは購読設定の誤りを示す
          throw new RunCorrelationException(
              RunCorrelationException.Reason.DUPLICATE_REQUEST_ID,
              "duplicate request id found in subscription batch: " + requestId);
        }
      }
    }
    if (requestIds.isEmpty()) {
      throw new RunCorrelationException(
          RunCorrelationException.Reason.NO_END_EVENTS,
          "no END events found in subscription batch");
    }
    return new ArrayList<>(requestIds);
  }
}
