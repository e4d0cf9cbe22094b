/*
 * どこで: Lambda Monitor のインフラ設定
 * 何を: CloudWatch Logs/SNS/Lambda の SDK クライアントを Spring 管理下に置く
 * なぜ: アダプタが同一クライアントを再利用し、終了時に確実に close するため
 */
package com.example.lambda_monitor.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.awscore.client.builder.AwsClientBuilder;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.cloudwatchlogs.CloudWatchLogsClient;
import software.amazon.awssdk.services.lambda.LambdaClient;
import software.amazon.awssdk.services.sns.SnsClient;

@Configuration
public class AwsClientConfig {

  @Bean(destroyMethod = "close")
  public CloudWatchLogsClient cloudWatchLogsClient(AwsClientProperties properties) {
    return applyRegion(CloudWatchLogsClient.builder(), properties).build();
  }

  @Bean(destroyMethod = "close")
  public SnsClient snsClient(AwsClientProperties properties) {
    return applyRegion(SnsClient.builder(), properties).build();
  }

  @Bean(destroyMethod = "close")
  @ConditionalOnProperty(name = "monitor.tag-lookup-enabled", havingValue = "true")
  public LambdaClient lambdaClient(AwsClientProperties properties) {
    return applyRegion(LambdaClient.builder(), properties).build();
  }

  private static <B extends AwsClientBuilder<B, ?>> B applyRegion(
      B builder, AwsClientProperties properties) {
    if (properties.hasRegion()) {
      return builder.region(Region.of(properties.region().trim()));
    }
    return builder;
  }
}
