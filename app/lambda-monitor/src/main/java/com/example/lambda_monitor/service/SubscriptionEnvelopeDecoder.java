/*
 * どこで: Lambda Monitor サービス層
 * 何を: CloudWatch Logs 購読の base64 + gzip ペイロードを展開する
 * なぜ: 受信形式の変換をコア処理から切り離すため
 */
package com.example.lambda_monitor.service;

import com.example.lambda_monitor.model.LogSubscriptionBatch;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.Base64;
import java.util.zip.GZIPInputStream;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class SubscriptionEnvelopeDecoder {

  private final ObjectMapper objectMapper;

  public LogSubscriptionBatch decode(String data) {
    if (data == null || data.isBlank()) {
      throw new SubscriptionDecodeException("subscription data is empty");
    }
    final byte[] compressed;
    try {
      compressed = Base64.getDecoder().decode(data.trim());
    } catch (IllegalArgumentException ex) {
      throw new SubscriptionDecodeException("subscription data is not valid base64", ex);
    }
    final byte[] json;
    try (InputStream in = new GZIPInputStream(new ByteArrayInputStream(compressed))) {
      json = in.readAllBytes();
    } catch (IOException ex) {
      throw new SubscriptionDecodeException("subscription data is not valid gzip", ex);
    }
    final LogSubscriptionBatch batch;
    try {
      batch = objectMapper.readValue(json, LogSubscriptionBatch.class);
    } catch (IOException ex) {
      throw new SubscriptionDecodeException("subscription payload is not valid json", ex);
    }
    if (batch == null) {
      throw new SubscriptionDecodeException("subscription payload is empty");
    }
    if (!batch.isControlMessage() && (isBlank(batch.logGroup()) || isBlank(batch.logStream()))) {
      throw new SubscriptionDecodeException("subscription payload lacks logGroup or logStream");
    }
    return batch;
  }

  private boolean isBlank(String value) {
    return value == null || value.isBlank();
  }
}
