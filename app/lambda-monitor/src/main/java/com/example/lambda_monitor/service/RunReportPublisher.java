/*
 * どこで: Lambda Monitor サービス層
 * 何を: 整形済み通知を dry-run 設定に応じて送信/模擬送信する
 * なぜ: 送信内容のログ出力と送信先の切り替えを一箇所にまとめるため
 */
package com.example.lambda_monitor.service;

import com.example.lambda_monitor.config.MonitorProperties;
import com.example.lambda_monitor.model.Notification;
import com.example.lambda_monitor.model.NotificationContext;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.event.Level;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

@Service
public class RunReportPublisher {

  private static final Logger logger = LoggerFactory.getLogger(RunReportPublisher.class);

  private final NotificationSender topicSender;
  private final NotificationSender localSender;
  private final MonitorProperties properties;
  private final ObjectMapper objectMapper;

  public RunReportPublisher(
      @Qualifier("snsNotificationSender") NotificationSender topicSender,
      @Qualifier("localNotificationSender") NotificationSender localSender,
      MonitorProperties properties,
      ObjectMapper objectMapper) {
    this.topicSender = topicSender;
    this.localSender = localSender;
    this.properties = properties;
    this.objectMapper = objectMapper;
  }

  /**
   * 役割: 通知を 1 件送信し、メッセージ ID を返す。
   * 動作: dry-run では外部送信せず固定 ID を返す。送信失敗は再試行せずに伝播させる。
   */
  public String publish(Notification notification, NotificationContext context) {
    // dry-run では内容確認が目的なので INFO、通常運用では DEBUG に落とす
    final Level level = context.dryRun() ? Level.INFO : Level.DEBUG;
    logger.atLevel(level).log("SUBJECT: {}", notification.subject());
    logger.atLevel(level).log("ATTRIBUTES:\n{}", describeAttributes(notification));
    logger.atLevel(level).log("BODY\n{}", notification.body());

    final NotificationSender sender = context.dryRun() ? localSender : topicSender;
    final String messageId = sender.send(notification);
    logger.info(
        "published message {} to target topic {} functionName={} dryRun={}",
        messageId,
        properties.reportingTopicArn(),
        context.functionName(),
        context.dryRun());
    return messageId;
  }

  private String describeAttributes(Notification notification) {
    try {
      return objectMapper.writeValueAsString(notification.attributes());
    } catch (JsonProcessingException ex) {
      logger.warn("notification attributes serialization failed", ex);
      return notification.attributes().toString();
    }
  }
}
