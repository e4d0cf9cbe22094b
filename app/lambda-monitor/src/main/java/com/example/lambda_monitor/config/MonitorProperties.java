/*
 * どこで: Lambda Monitor の設定バインド
 * 何を: 通知先トピック/dry-run/ロググループ接頭辞/表示名タグの設定を保持する
 * なぜ: 必須設定の欠落を起動時に検出し、バッチ処理中に失敗させないため
 */
package com.example.lambda_monitor.config;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "monitor")
@Validated
public record MonitorProperties(
    @NotBlank String reportingTopicArn,
    boolean dryRun,
    @NotBlank String logGroupPrefix,
    @NotBlank String displayNameTag,
    boolean tagLookupEnabled) {

  public MonitorProperties {
    logGroupPrefix = logGroupPrefix == null ? "/aws/lambda/" : logGroupPrefix;
    displayNameTag = displayNameTag == null ? "DISPLAY_NAME" : displayNameTag;
  }

  @AssertTrue(message = "monitor.log-group-prefix must end with '/'")
  public boolean isLogGroupPrefixTerminated() {
    // 接頭辞の直後から関数名を切り出すため区切りで終わっている必要がある
    return logGroupPrefix == null || logGroupPrefix.endsWith("/");
  }
}
