/*
 * どこで: Lambda Monitor AWS アダプタ
 * 何を: 通知を SNS トピックへ publish する Sender
 * なぜ: 購読者がメール等で run の結果を受け取れるようにするため
 */
package com.example.lambda_monitor.aws;

import com.example.lambda_monitor.config.MonitorProperties;
import com.example.lambda_monitor.model.Notification;
import com.example.lambda_monitor.model.NotificationAttribute;
import com.example.lambda_monitor.service.NotificationSender;
import com.google.common.annotations.VisibleForTesting;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.services.sns.SnsClient;
import software.amazon.awssdk.services.sns.model.MessageAttributeValue;
import software.amazon.awssdk.services.sns.model.PublishRequest;
import software.amazon.awssdk.services.sns.model.PublishResponse;

@Component
public class SnsNotificationSender implements NotificationSender {

  // SNS の Subject は 100 文字以内かつ制御文字不可
  static final int MAX_SUBJECT_LENGTH = 100;

  private final SnsClient snsClient;
  private final MonitorProperties properties;

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "SnsClient は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
  public SnsNotificationSender(SnsClient snsClient, MonitorProperties properties) {
    this.snsClient = snsClient;
    this.properties = properties;
  }

  @Override
  public String send(Notification notification) {
    final PublishRequest request =
        PublishRequest.builder()
            .topicArn(properties.reportingTopicArn())
            .subject(sanitizeSubject(notification.subject()))
            .message(notification.body())
            .messageAttributes(toMessageAttributes(notification.attributes()))
            .build();
    final PublishResponse response = snsClient.publish(request);
    return response.messageId();
  }

  @VisibleForTesting
  static String sanitizeSubject(String subject) {
    final String singleLine = subject.replaceAll("\\p{Cntrl}+", " ").trim();
    if (singleLine.length() <= MAX_SUBJECT_LENGTH) {
      return singleLine;
    }
    return singleLine.substring(0, MAX_SUBJECT_LENGTH);
  }

  private Map<String, MessageAttributeValue> toMessageAttributes(
      Map<String, NotificationAttribute> attributes) {
    final Map<String, MessageAttributeValue> converted = new LinkedHashMap<>();
    attributes.forEach(
        (name, attribute) ->
            converted.put(
                name,
                MessageAttributeValue.builder()
                    .dataType(attribute.dataType())
                    .stringValue(attribute.stringValue())
                    .build()));
    return converted;
  }
}
