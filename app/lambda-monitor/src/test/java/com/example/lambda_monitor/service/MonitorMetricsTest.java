/*
 * どこで: Lambda Monitor メトリクステスト
 * 何を: run/バッチ結果カウンタと実行時間/件数の分布が記録されることを検証する
 * なぜ: 監視指標の計測回帰を防ぐため
 */
package com.example.lambda_monitor.service;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.lambda_monitor.model.LogEvent;
import com.example.lambda_monitor.model.RunSummary;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.List;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;

class MonitorMetricsTest {

  @Test
  void recordsRunAndBatchMetrics() {
    final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    final MonitorMetrics metrics = new MonitorMetrics(registry);

    metrics.recordRunResult("published");
    metrics.recordRunResult("published");
    metrics.recordRunResult("analysis_failed");
    metrics.recordBatchResult("processed");
    metrics.recordRunSummary(
        new RunSummary(
            "req-1",
            1_000L,
            1_250L,
            2,
            1,
            List.of(new LogEvent(1_000L, "START"), new LogEvent(1_250L, "END"))));

    final Counter published =
        registry.get("monitor.runs.total").tag("result", "published").counter();
    final Counter analysisFailed =
        registry.get("monitor.runs.total").tag("result", "analysis_failed").counter();
    final Counter processed =
        registry.get("monitor.batches.total").tag("result", "processed").counter();
    final Timer duration = registry.get("monitor.run.duration").timer();
    final DistributionSummary errors = registry.get("monitor.run.errors").summary();
    final DistributionSummary warnings = registry.get("monitor.run.warnings").summary();

    assertThat(published.count()).isEqualTo(2.0d);
    assertThat(analysisFailed.count()).isEqualTo(1.0d);
    assertThat(processed.count()).isEqualTo(1.0d);
    assertThat(duration.count()).isEqualTo(1L);
    assertThat(duration.totalTime(TimeUnit.MILLISECONDS)).isEqualTo(250.0d);
    assertThat(errors.totalAmount()).isEqualTo(2.0d);
    assertThat(warnings.totalAmount()).isEqualTo(1.0d);
  }
}
