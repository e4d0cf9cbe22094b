/*
 * どこで: Lambda Monitor request id 抽出のユニットテスト
 * 何を: END イベントからの抽出順序と重複/空バッチの失敗を検証する
 * なぜ: 購読バッチの相関誤りを run 処理前に検出するため
 */
package com.example.lambda_monitor.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.example.lambda_monitor.model.LogEvent;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class RequestIdExtractorTest {

  private final RequestIdExtractor extractor = new RequestIdExtractor();

  @Test
  void extractsRequestIdsInArrivalOrder() {
    final List<String> requestIds =
        extractor.extract(
            List.of(endEvent("req-b"), plainEvent("noise"), endEvent("req-a")));

    assertThat(requestIds).containsExactly("req-b", "req-a");
  }

  @Test
  void ignoresEventsWithoutEndTypeOrRequestId() {
    final List<String> requestIds =
        extractor.extract(
            List.of(
                new LogEvent(1L, "START", Map.of("type", "START", "requestId", "req-x")),
                new LogEvent(2L, "END", Map.of("type", "END")),
                new LogEvent(3L, "END", nullRequestIdFields()),
                new LogEvent(4L, "END", Map.of("type", "END", "requestId", " ")),
                endEvent("req-y")));

    assertThat(requestIds).containsExactly("req-y");
  }

  @Test
  void throwsWhenRequestIdRepeats() {
    assertThatThrownBy(() -> extractor.extract(List.of(endEvent("req-a"), endEvent("req-a"))))
        .isInstanceOfSatisfying(
            RunCorrelationException.class,
            ex ->
                assertThat(ex.reason())
                    .isEqualTo(RunCorrelationException.Reason.DUPLICATE_REQUEST_ID))
        .hasMessageContaining("req-a");
  }

  @Test
  void throwsWhenNoEndEventIsPresent() {
    assertThatThrownBy(() -> extractor.extract(List.of(plainEvent("hello"))))
        .isInstanceOfSatisfying(
            RunCorrelationException.class,
            ex -> assertThat(ex.reason()).isEqualTo(RunCorrelationException.Reason.NO_END_EVENTS));
    assertThatThrownBy(() -> extractor.extract(List.of()))
        .isInstanceOf(RunCorrelationException.class);
  }

  private static LogEvent endEvent(String requestId) {
    return new LogEvent(
        1L,
        "END RequestId: " + requestId,
        Map.of("type", "END", "dummy", "RequestId:", "requestId", requestId));
  }

  private static Map<String, String> nullRequestIdFields() {
    final Map<String, String> fields = new HashMap<>();
    fields.put("type", "END");
    fields.put("requestId", null);
    return fields;
  }

  private static LogEvent plainEvent(String message) {
    return new LogEvent(1L, message);
  }
}
