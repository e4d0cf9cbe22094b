/*
 * どこで: Lambda Monitor ドメインモデル
 * 何を: 送信する通知(件名/本文/属性)
 * なぜ: 整形と送信の境界で受け渡す最終成果物とするため
 */
package com.example.lambda_monitor.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record Notification(
    String subject, String body, Map<String, NotificationAttribute> attributes) {

  public Notification {
    // 属性順をログ出力で安定させるため挿入順を保持する
    attributes = Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
  }
}
