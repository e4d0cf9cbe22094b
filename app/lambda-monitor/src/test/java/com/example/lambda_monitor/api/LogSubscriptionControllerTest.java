/*
 * どこで: Lambda Monitor 購読 API のテスト
 * 何を: 処理結果に応じたステータス/本文とエラー応答の対応を検証する
 * なぜ: 呼び出し元が部分失敗や入力不正を判別できるようにするため
 */
package com.example.lambda_monitor.api;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.example.lambda_monitor.model.BatchResult;
import com.example.lambda_monitor.model.LogSubscriptionBatch;
import com.example.lambda_monitor.model.PublishReceipt;
import com.example.lambda_monitor.model.RunFailure;
import com.example.lambda_monitor.model.RunStatus;
import com.example.lambda_monitor.service.LogSubscriptionProcessor;
import com.example.lambda_monitor.service.MonitorConfigurationException;
import com.example.lambda_monitor.service.RunCorrelationException;
import com.example.lambda_monitor.service.SubscriptionDecodeException;
import com.example.lambda_monitor.service.SubscriptionEnvelopeDecoder;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(
    controllers = {LogSubscriptionController.class, StatusController.class},
    properties = "monitor.reporting-topic-arn=arn:aws:sns:eu-west-1:123456789012:reports")
@AutoConfigureMockMvc(addFilters = false)
@Import(ApiExceptionHandler.class)
class LogSubscriptionControllerTest {

  private static final String ENVELOPE = "{\"awslogs\":{\"data\":\"H4sIAAAA\"}}";
  private static final LogSubscriptionBatch BATCH =
      new LogSubscriptionBatch(
          "DATA_MESSAGE", "123", "/aws/lambda/foo", "stream", List.of(), List.of());

  @Autowired private MockMvc mockMvc;

  @MockitoBean private SubscriptionEnvelopeDecoder decoder;
  @MockitoBean private LogSubscriptionProcessor processor;

  @Test
  void returnsOkWhenEveryRunWasPublished() throws Exception {
    when(decoder.decode("H4sIAAAA")).thenReturn(BATCH);
    when(processor.process(BATCH))
        .thenReturn(
            new BatchResult(
                "foo",
                false,
                List.of(new PublishReceipt("req-1", "msg-1", RunStatus.ERROR)),
                List.of()));

    mockMvc
        .perform(post("/v1/log-subscriptions").contentType(MediaType.APPLICATION_JSON).content(ENVELOPE))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.function_name").value("foo"))
        .andExpect(jsonPath("$.outcome").value("processed"))
        .andExpect(jsonPath("$.published[0].request_id").value("req-1"))
        .andExpect(jsonPath("$.published[0].message_id").value("msg-1"))
        .andExpect(jsonPath("$.published[0].status").value("error"));
  }

  @Test
  void returnsMultiStatusWhenSomeRunsFailed() throws Exception {
    when(decoder.decode("H4sIAAAA")).thenReturn(BATCH);
    when(processor.process(BATCH))
        .thenReturn(
            new BatchResult(
                "foo",
                false,
                List.of(),
                List.of(new RunFailure("req-2", "MISSING_START", "no START event"))));

    mockMvc
        .perform(post("/v1/log-subscriptions").contentType(MediaType.APPLICATION_JSON).content(ENVELOPE))
        .andExpect(status().isMultiStatus())
        .andExpect(jsonPath("$.outcome").value("partial"))
        .andExpect(jsonPath("$.failed[0].request_id").value("req-2"))
        .andExpect(jsonPath("$.failed[0].reason").value("MISSING_START"));
  }

  @Test
  void controlMessageIsReportedAsSkipped() throws Exception {
    when(decoder.decode("H4sIAAAA")).thenReturn(BATCH);
    when(processor.process(BATCH)).thenReturn(BatchResult.skippedBatch());

    mockMvc
        .perform(post("/v1/log-subscriptions").contentType(MediaType.APPLICATION_JSON).content(ENVELOPE))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.outcome").value("skipped"));
  }

  @Test
  void malformedEnvelopeReturns400() throws Exception {
    when(decoder.decode(any())).thenThrow(new SubscriptionDecodeException("subscription data is not valid gzip"));

    mockMvc
        .perform(post("/v1/log-subscriptions").contentType(MediaType.APPLICATION_JSON).content(ENVELOPE))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("MONITOR_BAD_ENVELOPE"))
        .andExpect(jsonPath("$.message").value("subscription data is not valid gzip"));
  }

  @Test
  void missingDataReturns400() throws Exception {
    mockMvc
        .perform(
            post("/v1/log-subscriptions")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"awslogs\":{}}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("MONITOR_VALIDATION_ERROR"));
    verifyNoInteractions(decoder, processor);
  }

  @Test
  void unreadableBodyReturns400() throws Exception {
    mockMvc
        .perform(post("/v1/log-subscriptions").contentType(MediaType.APPLICATION_JSON).content("{"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("MONITOR_VALIDATION_ERROR"));
  }

  @Test
  void badLogGroupReturns422() throws Exception {
    when(decoder.decode("H4sIAAAA")).thenReturn(BATCH);
    when(processor.process(BATCH))
        .thenThrow(new MonitorConfigurationException("log group /ecs/foo is not a lambda log group"));

    mockMvc
        .perform(post("/v1/log-subscriptions").contentType(MediaType.APPLICATION_JSON).content(ENVELOPE))
        .andExpect(status().isUnprocessableEntity())
        .andExpect(jsonPath("$.code").value("MONITOR_CONFIGURATION_ERROR"));
  }

  @Test
  void correlationFailureReturns422() throws Exception {
    when(decoder.decode("H4sIAAAA")).thenReturn(BATCH);
    when(processor.process(BATCH))
        .thenThrow(
            new RunCorrelationException(
                RunCorrelationException.Reason.NO_END_EVENTS,
                "no END events found in subscription batch"));

    mockMvc
        .perform(post("/v1/log-subscriptions").contentType(MediaType.APPLICATION_JSON).content(ENVELOPE))
        .andExpect(status().isUnprocessableEntity())
        .andExpect(jsonPath("$.code").value("MONITOR_CORRELATION_FAILED"));
  }

  @Test
  void unexpectedFailureReturns500() throws Exception {
    when(decoder.decode("H4sIAAAA")).thenReturn(BATCH);
    when(processor.process(BATCH)).thenThrow(new IllegalStateException("boom"));

    mockMvc
        .perform(post("/v1/log-subscriptions").contentType(MediaType.APPLICATION_JSON).content(ENVELOPE))
        .andExpect(status().isInternalServerError())
        .andExpect(jsonPath("$.code").value("MONITOR_INTERNAL_ERROR"));
  }

  @Test
  void statusEndpointAnswers() throws Exception {
    mockMvc
        .perform(get("/"))
        .andExpect(status().isOk())
        .andExpect(content().string("lambda-monitor: ok"));
  }
}
