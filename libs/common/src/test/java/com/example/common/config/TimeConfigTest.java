/*
 * どこで: Common 共通設定のテスト
 * 何を: タイムゾーン指定の解釈を検証する
 * なぜ: 描画時刻のゾーンが設定通りになることを保証するため
 */
package com.example.common.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.ZoneId;
import org.junit.jupiter.api.Test;

class TimeConfigTest {

  private final TimeConfig config = new TimeConfig();

  @Test
  void blankZoneFallsBackToSystemDefault() {
    assertThat(TimeConfig.resolveZone(null)).isEqualTo(ZoneId.systemDefault());
    assertThat(TimeConfig.resolveZone("  ")).isEqualTo(ZoneId.systemDefault());
  }

  @Test
  void clockUsesConfiguredZone() {
    final Clock clock = config.clock(" Asia/Tokyo ");

    assertThat(clock.getZone()).isEqualTo(ZoneId.of("Asia/Tokyo"));
  }

  @Test
  void unknownZoneIsRejected() {
    assertThatThrownBy(() -> config.clock("Mars/Olympus"))
        .isInstanceOf(DateTimeException.class);
  }
}
