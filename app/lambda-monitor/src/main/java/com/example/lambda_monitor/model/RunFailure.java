/*
 * どこで: Lambda Monitor ドメインモデル
 * 何を: 個別 run の処理失敗を記録する
 * なぜ: 1 件の失敗で他の run を止めずに結果として報告するため
 */
package com.example.lambda_monitor.model;

public record RunFailure(String requestId, String reason, String message) {}
