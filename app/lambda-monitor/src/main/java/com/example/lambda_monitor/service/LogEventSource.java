/*
 * どこで: Lambda Monitor サービス層
 * 何を: run 単位のログイベント取得を抽象化するインターフェース
 * なぜ: CloudWatch Logs 実装とテスト差し替えを容易にするため
 */
package com.example.lambda_monitor.service;

import com.example.lambda_monitor.model.LogEvent;
import com.example.lambda_monitor.model.LogSource;
import java.util.List;

public interface LogEventSource {

  /**
   * 役割: 指定 request id に属するログイベントを全件取得する。
   * 動作: ページングを内部で辿り、取得元が返した順序のまま連結して返す。
   * 前提: 取得元の失敗は変換せずに伝播させる。
   */
  List<LogEvent> fetchRunEvents(String requestId, LogSource source);
}
