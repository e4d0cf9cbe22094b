/*
 * どこで: Lambda Monitor サービス層
 * 何を: RunSummary を通知の件名/本文/属性へ整形する
 * なぜ: 同一入力から常に同一のテキストを得るため
 */
package com.example.lambda_monitor.service;

import com.example.lambda_monitor.model.LogEvent;
import com.example.lambda_monitor.model.LogLine;
import com.example.lambda_monitor.model.Notification;
import com.example.lambda_monitor.model.NotificationAttribute;
import com.example.lambda_monitor.model.NotificationContext;
import com.example.lambda_monitor.model.RunSummary;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * 実行ログの通知テキストを組み立てる。
 *
 * <p>時刻は注入された {@link Clock} のゾーンで描画する。ゾーン以外に環境依存はなく、同じゾーンで
 * 同じ RunSummary を整形すればバイト単位で同じ結果になる。
 */
@Component
public class RunReportFormatter {

  private static final Logger logger = LoggerFactory.getLogger(RunReportFormatter.class);

  static final String ATTRIBUTE_FUNCTION = "function";
  static final String ATTRIBUTE_STATUS = "status";
  static final String ATTRIBUTE_ERRORS = "errors";
  static final String ATTRIBUTE_WARNINGS = "warnings";

  private static final DateTimeFormatter TIME_OF_DAY = DateTimeFormatter.ofPattern("HH:mm:ss");
  private static final DateTimeFormatter STARTED_SECONDS =
      DateTimeFormatter.ofPattern("uuuu-MM-dd HH:mm:ss");
  private static final DateTimeFormatter STARTED_MICROS =
      DateTimeFormatter.ofPattern("uuuu-MM-dd HH:mm:ss.SSSSSS");

  private final ZoneId zone;

  public RunReportFormatter(Clock clock) {
    this.zone = clock.getZone();
  }

  public String createSubject(int errorCount, int warningCount, String displayName) {
    final String base = displayName + " request completed";
    if (errorCount > 0) {
      return base + " with ERRORS!";
    }
    if (warningCount > 0) {
      return base + " with WARNINGS!";
    }
    return base;
  }

  public String formatEvent(LogEvent event) {
    final String time = formatTimeOfDay(event.timestamp());
    final LogLine line = LogLineClassifier.classify(event.message());
    if (line instanceof LogLine.Start) {
      return marker(time, LogLineClassifier.START_MARKER);
    }
    if (line instanceof LogLine.End) {
      return marker(time, LogLineClassifier.END_MARKER);
    }
    if (line instanceof LogLine.Report) {
      return "";
    }
    if (line instanceof LogLine.Tagged tagged) {
      return withTrailingNewline(
          String.format(Locale.ROOT, "%s %-7s %s", time, tagged.level(), tagged.detail()));
    }
    final LogLine.Plain plain = (LogLine.Plain) line;
    return withTrailingNewline(time + " " + plain.message());
  }

  public String createBody(RunSummary summary, NotificationContext context) {
    logger.debug("formatting {} events requestId={}", summary.events().size(), summary.requestId());
    final StringBuilder body = new StringBuilder();
    body.append("Execution results for ").append(context.displayName()).append("\n\n");
    body.append(summary.errorCount()).append(" errors\n");
    body.append(summary.warningCount()).append(" warnings\n");
    body.append("\nExecution Log\n\n");
    for (LogEvent event : summary.events()) {
      body.append(formatEvent(event));
    }
    body.append("\nLambda Function: ").append(context.functionName()).append('\n');
    body.append("Request ID: ").append(summary.requestId()).append('\n');
    body.append("Started: ").append(formatStarted(summary.startTimestamp())).append('\n');
    body.append("Duration: ")
        .append(String.format(Locale.ROOT, "%f", summary.duration() / 1000.0d))
        .append(" seconds");
    return body.toString();
  }

  public Notification createNotification(RunSummary summary, NotificationContext context) {
    final String subject =
        createSubject(summary.errorCount(), summary.warningCount(), context.displayName());
    final Map<String, NotificationAttribute> attributes = new LinkedHashMap<>();
    attributes.put(ATTRIBUTE_FUNCTION, NotificationAttribute.string(context.functionName()));
    attributes.put(ATTRIBUTE_STATUS, NotificationAttribute.string(summary.status().value()));
    attributes.put(
        ATTRIBUTE_ERRORS, NotificationAttribute.string(String.valueOf(summary.errorCount())));
    attributes.put(
        ATTRIBUTE_WARNINGS, NotificationAttribute.string(String.valueOf(summary.warningCount())));
    return new Notification(subject, createBody(summary, context), attributes);
  }

  private String marker(String time, String marker) {
    return String.format(Locale.ROOT, "%s %-7s\n", time, marker);
  }

  private String withTrailingNewline(String text) {
    return text.endsWith("\n") ? text : text + "\n";
  }

  private String formatTimeOfDay(long epochMillis) {
    return Instant.ofEpochMilli(epochMillis).atZone(zone).format(TIME_OF_DAY);
  }

  private String formatStarted(long epochMillis) {
    final LocalDateTime started = Instant.ofEpochMilli(epochMillis).atZone(zone).toLocalDateTime();
    // 端数がなければ秒までで表記する
    if (started.getNano() == 0) {
      return started.format(STARTED_SECONDS);
    }
    return started.format(STARTED_MICROS);
  }
}
