/*
 * どこで: Lambda Monitor サービス層
 * 何を: 通知送信の抽象化インターフェース
 * なぜ: 実送信/dry-run/テスト差し替えを容易にするため
 */
package com.example.lambda_monitor.service;

import com.example.lambda_monitor.model.Notification;

public interface NotificationSender {

  /** 送信し、送信先が払い出したメッセージ ID を返す。 */
  String send(Notification notification);
}
