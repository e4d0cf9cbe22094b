/*
 * どこで: Lambda Monitor API
 * 何を: ルートの簡易ヘルスレスポンスを返す
 * なぜ: デプロイ直後の疎通確認に使うため
 */
package com.example.lambda_monitor.api;

import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class StatusController {

  @GetMapping("/")
  public String home() {
    return "lambda-monitor: ok";
  }
}
