/*
 * どこで: Lambda Monitor サービス層
 * 何を: 購読バッチ内の完了 run ごとに取得 → 解析 → 整形 → 送信を行う
 * なぜ: 1 件の不正な run が同一バッチの他の run の通知を妨げないようにするため
 */
package com.example.lambda_monitor.service;

import com.example.common.logging.MdcScope;
import com.example.lambda_monitor.config.MonitorProperties;
import com.example.lambda_monitor.model.BatchResult;
import com.example.lambda_monitor.model.LogEvent;
import com.example.lambda_monitor.model.LogSource;
import com.example.lambda_monitor.model.LogSubscriptionBatch;
import com.example.lambda_monitor.model.Notification;
import com.example.lambda_monitor.model.NotificationContext;
import com.example.lambda_monitor.model.PublishReceipt;
import com.example.lambda_monitor.model.RunFailure;
import com.example.lambda_monitor.model.RunSummary;
import com.google.common.annotations.VisibleForTesting;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class LogSubscriptionProcessor {

  private static final Logger logger = LoggerFactory.getLogger(LogSubscriptionProcessor.class);

  static final String RESULT_PUBLISHED = "published";
  static final String RESULT_ANALYSIS_FAILED = "analysis_failed";
  static final String RESULT_FETCH_FAILED = "fetch_failed";
  static final String RESULT_PUBLISH_FAILED = "publish_failed";
  static final String BATCH_PROCESSED = "processed";
  static final String BATCH_CONTROL_MESSAGE = "control_message";
  static final String BATCH_REJECTED = "rejected";

  private final RequestIdExtractor requestIdExtractor;
  private final LogEventSource logEventSource;
  private final RunAnalyzer runAnalyzer;
  private final RunReportFormatter formatter;
  private final RunReportPublisher publisher;
  private final FunctionDisplayNameLookup displayNameLookup;
  private final MonitorProperties properties;
  private final MonitorMetrics metrics;

  public BatchResult process(LogSubscriptionBatch batch) {
    if (batch.isControlMessage()) {
      logger.info("control message acknowledged owner={}", batch.owner());
      metrics.recordBatchResult(BATCH_CONTROL_MESSAGE);
      return BatchResult.skippedBatch();
    }
    try (MdcScope ignored =
        MdcScope.open()
            .put("trace_id", UUID.randomUUID().toString())
            .put("log_stream", batch.logStream())) {
      final NotificationContext context;
      final List<String> requestIds;
      try {
        context = buildContext(batch);
        requestIds = requestIdExtractor.extract(batch.logEvents());
      } catch (MonitorConfigurationException | RunCorrelationException ex) {
        logger.warn("subscription batch rejected logGroup={}", batch.logGroup(), ex);
        metrics.recordBatchResult(BATCH_REJECTED);
        throw ex;
      }
      logger.debug(
          "processing events for {} runs functionName={}",
          requestIds.size(),
          context.functionName());

      final List<PublishReceipt> receipts = new ArrayList<>();
      final List<RunFailure> failures = new ArrayList<>();
      for (String requestId : requestIds) {
        try (MdcScope runScope =
            MdcScope.open()
                .put("request_id", requestId)
                .put("function_name", context.functionName())) {
          processRun(requestId, context, receipts, failures);
        }
      }
      metrics.recordBatchResult(BATCH_PROCESSED);
      return new BatchResult(context.functionName(), false, receipts, failures);
    }
  }

  /**
   * 役割: ロググループ名から関数名を導出する。
   * 動作: 設定の接頭辞(既定 /aws/lambda/)で始まらない、または関数名が空なら設定エラーとする。
   */
  @VisibleForTesting
  String resolveFunctionName(String logGroupName) {
    final String prefix = properties.logGroupPrefix();
    if (logGroupName == null || !logGroupName.startsWith(prefix)) {
      throw new MonitorConfigurationException(
          "log group " + logGroupName + " is not a lambda log group");
    }
    final String functionName = logGroupName.substring(prefix.length());
    if (functionName.isBlank()) {
      throw new MonitorConfigurationException(
          "log group " + logGroupName + " does not name a function");
    }
    return functionName;
  }

  private NotificationContext buildContext(LogSubscriptionBatch batch) {
    final String functionName = resolveFunctionName(batch.logGroup());
    final String displayName =
        displayNameLookup.findDisplayName(functionName).orElse(functionName);
    return new NotificationContext(
        functionName,
        displayName,
        properties.dryRun(),
        new LogSource(batch.logGroup(), batch.logStream()));
  }

  private void processRun(
      String requestId,
      NotificationContext context,
      List<PublishReceipt> receipts,
      List<RunFailure> failures) {
    logger.debug(
        "processing log events functionName={} requestId={}", context.functionName(), requestId);
    final List<LogEvent> events;
    try {
      events = logEventSource.fetchRunEvents(requestId, context.source());
    } catch (RuntimeException ex) {
      recordFailure(requestId, context, RESULT_FETCH_FAILED, "FETCH_FAILED", ex, failures);
      return;
    }
    logger.debug("found {} events requestId={}", events.size(), requestId);

    final RunSummary summary;
    try {
      summary = runAnalyzer.analyze(requestId, events);
    } catch (RunAnalysisException ex) {
      recordFailure(
          requestId, context, RESULT_ANALYSIS_FAILED, ex.reason().name(), ex, failures);
      return;
    }
    metrics.recordRunSummary(summary);

    final Notification notification = formatter.createNotification(summary, context);
    final String messageId;
    try {
      messageId = publisher.publish(notification, context);
    } catch (RuntimeException ex) {
      recordFailure(requestId, context, RESULT_PUBLISH_FAILED, "PUBLISH_FAILED", ex, failures);
      return;
    }
    metrics.recordRunResult(RESULT_PUBLISHED);
    receipts.add(new PublishReceipt(requestId, messageId, summary.status()));
  }

  private void recordFailure(
      String requestId,
      NotificationContext context,
      String result,
      String reason,
      RuntimeException ex,
      List<RunFailure> failures) {
    logger.warn(
        "run processing failed functionName={} requestId={} reason={}",
        context.functionName(),
        requestId,
        reason,
        ex);
    metrics.recordRunResult(result);
    failures.add(new RunFailure(requestId, reason, ex.getMessage()));
  }
}
