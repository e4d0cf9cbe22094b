/*
 * どこで: Lambda Monitor API
 * 何を: CloudWatch Logs 購読通知を受け付けるエンドポイントを公開する
 * なぜ: 購読トリガーからバッチ処理への入口を提供するため
 */
package com.example.lambda_monitor.api;

import com.example.lambda_monitor.api.request.LogSubscriptionEnvelope;
import com.example.lambda_monitor.api.response.LogSubscriptionResponse;
import com.example.lambda_monitor.model.BatchResult;
import com.example.lambda_monitor.model.LogSubscriptionBatch;
import com.example.lambda_monitor.service.LogSubscriptionProcessor;
import com.example.lambda_monitor.service.SubscriptionEnvelopeDecoder;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/log-subscriptions")
@RequiredArgsConstructor
public class LogSubscriptionController {

  private final SubscriptionEnvelopeDecoder decoder;
  private final LogSubscriptionProcessor processor;

  @PostMapping
  public ResponseEntity<LogSubscriptionResponse> receive(
      @Valid @RequestBody LogSubscriptionEnvelope envelope) {
    final LogSubscriptionBatch batch = decoder.decode(envelope.awslogs().data());
    final BatchResult result = processor.process(batch);
    // 一部の run が失敗した場合は 207 で部分成功を示す
    final HttpStatus status = result.hasFailures() ? HttpStatus.MULTI_STATUS : HttpStatus.OK;
    return ResponseEntity.status(status).body(LogSubscriptionResponse.from(result));
  }
}
