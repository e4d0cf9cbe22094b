/*
 * どこで: Lambda Monitor サービス層
 * 何を: 通知送信を模擬する実装
 * なぜ: dry-run 時に外部送信せず内容だけを確認するため
 */
package com.example.lambda_monitor.service;

import com.example.lambda_monitor.model.Notification;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class LocalNotificationSender implements NotificationSender {

  private static final Logger logger = LoggerFactory.getLogger(LocalNotificationSender.class);

  static final String DRY_RUN_MESSAGE_ID = "12345";

  @Override
  public String send(Notification notification) {
    // 実送信は行わず、固定のメッセージ ID を返す
    logger.info("notification simulated send subject={}", notification.subject());
    return DRY_RUN_MESSAGE_ID;
  }
}
