/*
 * どこで: Common ログ補助
 * 何を: MDC キーの登録と後始末をまとめて行う
 * なぜ: 処理単位ごとの文脈がスレッドに残留しないようにするため
 */
package com.example.common.logging;

import java.util.ArrayList;
import java.util.List;
import org.slf4j.MDC;

public final class MdcScope implements AutoCloseable {

  private final List<String> keys = new ArrayList<>();

  private MdcScope() {}

  public static MdcScope open() {
    return new MdcScope();
  }

  public MdcScope put(String key, String value) {
    if (value == null || value.isBlank()) {
      return this;
    }
    MDC.put(key, value);
    keys.add(key);
    return this;
  }

  @Override
  public void close() {
    for (String key : keys) {
      MDC.remove(key);
    }
    keys.clear();
  }
}
