package com.example.lambda_monitor.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/** AWS SDK クライアント共通設定。region 未指定時は SDK のデフォルト解決に任せる。 */
@ConfigurationProperties(prefix = "monitor.aws")
public record AwsClientProperties(String region) {

  public boolean hasRegion() {
    return region != null && !region.isBlank();
  }
}
