/*
 * どこで: Lambda Monitor アプリのエントリポイント
 * 何を: Spring Boot の起動と設定スキャンを行う
 * なぜ: 設定クラスと共通の時刻設定をまとめて有効化するため
 */
package com.example.lambda_monitor;

import com.example.common.config.TimeConfig;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.context.annotation.Import;

@SpringBootApplication
@ConfigurationPropertiesScan
@Import(TimeConfig.class)
public class LambdaMonitorApplication {

	public static void main(String[] args) {
		SpringApplication.run(LambdaMonitorApplication.class, args);
	}
}
