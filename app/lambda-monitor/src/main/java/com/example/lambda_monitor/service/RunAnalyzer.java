/*
 * どこで: Lambda Monitor サービス層
 * 何を: 1 run のイベント列から開始/終了時刻とエラー/警告数を集計する
 * なぜ: 通知に載せる RunSummary を不変条件付きで生成するため
 */
package com.example.lambda_monitor.service;

import com.example.lambda_monitor.model.LogEvent;
import com.example.lambda_monitor.model.RunSummary;
import java.util.List;
import org.springframework.stereotype.Component;

@Component
public class RunAnalyzer {

  static final String ERROR_PREFIX = "[ERROR]";
  static final String WARNING_PREFIX = "[WARNING]";

  public RunSummary analyze(String requestId, List<LogEvent> events) {
    if (events == null || events.isEmpty()) {
      throw new RunAnalysisException(
          RunAnalysisException.Reason.NO_EVENTS,
          requestId,
          "no events found for request " + requestId);
    }
    Long startTimestamp = null;
    Long endTimestamp = null;
    int errorCount = 0;
    int warningCount = 0;
    // 件数は行頭のリテラル一致のみで数える(描画側のタグ正規表現とは意図的に揃えない)
    for (LogEvent event : events) {
      final String message = event.message();
      if (message.startsWith(LogLineClassifier.START_MARKER)) {
        if (startTimestamp != null) {
          throw new RunAnalysisException(
              RunAnalysisException.Reason.DUPLICATE_START,
              requestId,
              "multiple START events found in request log trace " + requestId);
        }
        startTimestamp = event.timestamp();
      } else if (message.startsWith(LogLineClassifier.END_MARKER)) {
        if (endTimestamp != null) {
          throw new RunAnalysisException(
              RunAnalysisException.Reason.DUPLICATE_END,
              requestId,
              "multiple END events found in request log trace " + requestId);
        }
        endTimestamp = event.timestamp();
      } else if (message.startsWith(ERROR_PREFIX)) {
        errorCount++;
      } else if (message.startsWith(WARNING_PREFIX)) {
        warningCount++;
      }
    }
    if (startTimestamp == null) {
      throw new RunAnalysisException(
          RunAnalysisException.Reason.MISSING_START,
          requestId,
          "no START event found in request log trace " + requestId);
    }
    if (endTimestamp == null) {
      throw new RunAnalysisException(
          RunAnalysisException.Reason.MISSING_END,
          requestId,
          "no END event found in request log trace " + requestId);
    }
    if (endTimestamp < startTimestamp) {
      throw new RunAnalysisException(
          RunAnalysisException.Reason.END_BEFORE_START,
          requestId,
          "END event precedes START event in request log trace " + requestId);
    }
    return new RunSummary(
        requestId, startTimestamp, endTimestamp, errorCount, warningCount, events);
  }
}
