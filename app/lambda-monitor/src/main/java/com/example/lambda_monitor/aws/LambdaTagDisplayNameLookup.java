/*
 * どこで: Lambda Monitor AWS アダプタ
 * 何を: Lambda 関数タグから通知用の表示名を引く
 * なぜ: 関数名より分かりやすい名前で通知件名を出せるようにするため
 */
package com.example.lambda_monitor.aws;

import com.example.lambda_monitor.config.MonitorProperties;
import com.example.lambda_monitor.service.FunctionDisplayNameLookup;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.lambda.LambdaClient;
import software.amazon.awssdk.services.lambda.model.GetFunctionRequest;

@Component
@ConditionalOnProperty(name = "monitor.tag-lookup-enabled", havingValue = "true")
public class LambdaTagDisplayNameLookup implements FunctionDisplayNameLookup {

  private static final Logger logger = LoggerFactory.getLogger(LambdaTagDisplayNameLookup.class);

  private final LambdaClient lambdaClient;
  private final MonitorProperties properties;

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "LambdaClient は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
  public LambdaTagDisplayNameLookup(LambdaClient lambdaClient, MonitorProperties properties) {
    this.lambdaClient = lambdaClient;
    this.properties = properties;
  }

  @Override
  public Optional<String> findDisplayName(String functionName) {
    final Map<String, String> tags;
    try {
      tags =
          lambdaClient
              .getFunction(GetFunctionRequest.builder().functionName(functionName).build())
              .tags();
    } catch (SdkException ex) {
      // 表示名は装飾情報のため、取得失敗時は関数名での通知に倒す
      logger.warn("lambda tag lookup failed functionName={}", functionName, ex);
      return Optional.empty();
    }
    final String displayName = tags == null ? null : tags.get(properties.displayNameTag());
    if (displayName == null || displayName.isBlank()) {
      return Optional.empty();
    }
    return Optional.of(displayName.trim());
  }
}
