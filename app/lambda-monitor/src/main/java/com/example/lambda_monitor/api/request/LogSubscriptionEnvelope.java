/*
 * どこで: Lambda Monitor API リクエスト
 * 何を: CloudWatch Logs 購読通知のエンベロープ {"awslogs":{"data":...}}
 * なぜ: Lambda 呼び出しと同じ形の入力をそのまま受け付けるため
 */
package com.example.lambda_monitor.api.request;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

public record LogSubscriptionEnvelope(@NotNull @Valid AwsLogs awslogs) {

  public record AwsLogs(@NotBlank String data) {}
}
