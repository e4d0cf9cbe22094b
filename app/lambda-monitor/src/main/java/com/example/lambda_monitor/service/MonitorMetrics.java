/*
 * どこで: Lambda Monitor サービス層
 * 何を: run/バッチの処理結果と実行時間のメトリクスを記録する
 * なぜ: 監視対象関数の失敗傾向を Micrometer から観測できるようにするため
 */
package com.example.lambda_monitor.service;

import com.example.lambda_monitor.model.RunSummary;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.springframework.stereotype.Component;

@Component
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "MeterRegistry は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
public class MonitorMetrics {

  private static final String METRIC_RUNS_TOTAL = "monitor.runs.total";
  private static final String METRIC_BATCHES_TOTAL = "monitor.batches.total";
  private static final String METRIC_RUN_DURATION = "monitor.run.duration";
  private static final String METRIC_RUN_ERRORS = "monitor.run.errors";
  private static final String METRIC_RUN_WARNINGS = "monitor.run.warnings";

  private final MeterRegistry meterRegistry;
  private final ConcurrentMap<String, Counter> runCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Counter> batchCounters = new ConcurrentHashMap<>();
  private final Timer runDurationTimer;
  private final DistributionSummary runErrors;
  private final DistributionSummary runWarnings;

  public MonitorMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
    this.runDurationTimer =
        Timer.builder(METRIC_RUN_DURATION)
            .description("Execution time of monitored runs from START to END")
            .register(meterRegistry);
    this.runErrors =
        DistributionSummary.builder(METRIC_RUN_ERRORS)
            .description("Number of [ERROR] lines per monitored run")
            .register(meterRegistry);
    this.runWarnings =
        DistributionSummary.builder(METRIC_RUN_WARNINGS)
            .description("Number of [WARNING] lines per monitored run")
            .register(meterRegistry);
  }

  public void recordRunResult(String result) {
    runCounters
        .computeIfAbsent(
            result,
            ignored ->
                Counter.builder(METRIC_RUNS_TOTAL)
                    .description("Monitored run processing outcomes")
                    .tags(Tags.of("result", result))
                    .register(meterRegistry))
        .increment();
  }

  public void recordBatchResult(String result) {
    batchCounters
        .computeIfAbsent(
            result,
            ignored ->
                Counter.builder(METRIC_BATCHES_TOTAL)
                    .description("Log subscription batch outcomes")
                    .tags(Tags.of("result", result))
                    .register(meterRegistry))
        .increment();
  }

  public void recordRunSummary(RunSummary summary) {
    runDurationTimer.record(Duration.ofMillis(summary.duration()));
    runErrors.record(summary.errorCount());
    runWarnings.record(summary.warningCount());
  }
}
