/*
 * どこで: Lambda Monitor ドメインモデル
 * 何を: バッチ単位の通知文脈(関数名/表示名/dry-run/ログ所在)
 * なぜ: 同一バッチ内の全 run で読み取り専用に共有するため
 */
package com.example.lambda_monitor.model;

public record NotificationContext(
    String functionName, String displayName, boolean dryRun, LogSource source) {}
