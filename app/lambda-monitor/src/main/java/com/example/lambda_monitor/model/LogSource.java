package com.example.lambda_monitor.model;

public record LogSource(String logGroupName, String logStreamName) {}
