/*
 * どこで: Lambda Monitor AWS アダプタ
 * 何を: CloudWatch Logs FilterLogEvents で run のログを全ページ取得する
 * なぜ: 購読バッチに含まれない行も含めて run の完全なイベント列を得るため
 */
package com.example.lambda_monitor.aws;

import com.example.lambda_monitor.model.LogEvent;
import com.example.lambda_monitor.model.LogSource;
import com.example.lambda_monitor.service.LogEventSource;
import com.google.common.annotations.VisibleForTesting;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.services.cloudwatchlogs.CloudWatchLogsClient;
import software.amazon.awssdk.services.cloudwatchlogs.model.FilterLogEventsRequest;
import software.amazon.awssdk.services.cloudwatchlogs.model.FilterLogEventsResponse;
import software.amazon.awssdk.services.cloudwatchlogs.model.FilteredLogEvent;

@Component
public class CloudWatchLogEventSource implements LogEventSource {

  private static final Logger logger = LoggerFactory.getLogger(CloudWatchLogEventSource.class);

  private final CloudWatchLogsClient logsClient;

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "CloudWatchLogsClient は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
  public CloudWatchLogEventSource(CloudWatchLogsClient logsClient) {
    this.logsClient = logsClient;
  }

  @Override
  public List<LogEvent> fetchRunEvents(String requestId, LogSource source) {
    final String filterPattern = filterPattern(requestId);
    final List<LogEvent> events = new ArrayList<>();
    String nextToken = null;
    int pages = 0;
    do {
      final FilterLogEventsRequest request =
          FilterLogEventsRequest.builder()
              .logGroupName(source.logGroupName())
              .logStreamNames(source.logStreamName())
              .filterPattern(filterPattern)
              .nextToken(nextToken)
              .build();
      // SdkException は再試行せずそのまま呼び出し元へ伝播させる
      final FilterLogEventsResponse response = logsClient.filterLogEvents(request);
      for (FilteredLogEvent event : response.events()) {
        events.add(toLogEvent(event));
      }
      pages++;
      nextToken = response.nextToken();
    } while (nextToken != null && !nextToken.isEmpty());
    logger.debug(
        "cloudwatch events fetched requestId={} logGroup={} pages={} events={}",
        requestId,
        source.logGroupName(),
        pages,
        events.size());
    return events;
  }

  /** Lambda 既定のログ書式 {@code <level> <timestamp> <requestId> ...} の 3 列目で絞り込む。 */
  @VisibleForTesting
  static String filterPattern(String requestId) {
    return "[level,ts,id=" + requestId + ",...]";
  }

  private LogEvent toLogEvent(FilteredLogEvent event) {
    final long timestamp = event.timestamp() == null ? 0L : event.timestamp();
    return new LogEvent(timestamp, event.message());
  }
}
