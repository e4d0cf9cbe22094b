/*
 * どこで: Lambda Monitor サービス層
 * 何を: ログメッセージ 1 行を LogLine に分類する
 * なぜ: レポート描画の分岐を純粋関数に閉じ込めるため
 */
package com.example.lambda_monitor.service;

import com.example.lambda_monitor.model.LogLine;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public final class LogLineClassifier {

  static final String START_MARKER = "START";
  static final String END_MARKER = "END";
  static final String REPORT_MARKER = "REPORT";

  // [LEVEL] <origin> <timestamp> <detail>。detail は改行を含み得る
  private static final Pattern TAGGED_LINE =
      Pattern.compile("\\s*\\[([A-Z]+)\\]\\s+\\S+\\s+\\S+\\s+(.+)", Pattern.DOTALL);

  private static final LogLine START = new LogLine.Start();
  private static final LogLine END = new LogLine.End();
  private static final LogLine REPORT = new LogLine.Report();

  private LogLineClassifier() {}

  public static LogLine classify(String message) {
    final String text = message == null ? "" : message;
    if (text.startsWith(START_MARKER)) {
      return START;
    }
    if (text.startsWith(END_MARKER)) {
      return END;
    }
    if (text.startsWith(REPORT_MARKER)) {
      return REPORT;
    }
    final Matcher matcher = TAGGED_LINE.matcher(text);
    if (matcher.matches()) {
      return new LogLine.Tagged(matcher.group(1), matcher.group(2));
    }
    return new LogLine.Plain(text);
  }
}
