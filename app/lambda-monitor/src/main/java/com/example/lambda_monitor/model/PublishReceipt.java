package com.example.lambda_monitor.model;

public record PublishReceipt(String requestId, String messageId, RunStatus status) {}
