/*
 * どこで: Lambda Monitor サービス層
 * 何を: タグ参照無効時の表示名ルックアップ
 * なぜ: Lambda API 権限がない環境でも関数名をそのまま表示名に使うため
 */
package com.example.lambda_monitor.service;

import java.util.Optional;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(
    name = "monitor.tag-lookup-enabled",
    havingValue = "false",
    matchIfMissing = true)
public class NoopFunctionDisplayNameLookup implements FunctionDisplayNameLookup {

  @Override
  public Optional<String> findDisplayName(String functionName) {
    return Optional.empty();
  }
}
