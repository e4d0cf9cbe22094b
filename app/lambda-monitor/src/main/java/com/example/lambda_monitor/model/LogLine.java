/*
 * どこで: Lambda Monitor ドメインモデル
 * 何を: ログ行の分類結果を表す
 * なぜ: 描画ルールを分類ごとに切り替えるため
 */
package com.example.lambda_monitor.model;

public sealed interface LogLine
    permits LogLine.Start, LogLine.End, LogLine.Report, LogLine.Tagged, LogLine.Plain {

  /** Lambda ランタイムが出力する実行開始行。 */
  record Start() implements LogLine {}

  /** Lambda ランタイムが出力する実行終了行。 */
  record End() implements LogLine {}

  /** 課金/メモリ情報の REPORT 行。レポートには出力しない。 */
  record Report() implements LogLine {}

  /** {@code [LEVEL] origin timestamp detail} 形式のアプリケーションログ。 */
  record Tagged(String level, String detail) implements LogLine {}

  record Plain(String message) implements LogLine {}
}
