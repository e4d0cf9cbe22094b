/*
 * どこで: Common 共通設定
 * 何を: タイムゾーン付きの Clock を DI 可能にする
 * なぜ: 時刻の描画とテストの固定化を同じ Clock 経由で行うため
 */
package com.example.common.config;

import java.time.Clock;
import java.time.ZoneId;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class TimeConfig {

  @Bean
  public Clock clock(@Value("${app.time-zone:}") String timeZone) {
    return Clock.system(resolveZone(timeZone));
  }

  static ZoneId resolveZone(String timeZone) {
    // 未指定時はホストのタイムゾーンに従う
    if (timeZone == null || timeZone.isBlank()) {
      return ZoneId.systemDefault();
    }
    return ZoneId.of(timeZone.trim());
  }
}
