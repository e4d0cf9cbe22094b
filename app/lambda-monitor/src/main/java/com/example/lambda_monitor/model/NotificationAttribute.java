package com.example.lambda_monitor.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record NotificationAttribute(
    @JsonProperty("DataType") String dataType, @JsonProperty("StringValue") String stringValue) {

  private static final String STRING_TYPE = "String";

  public static NotificationAttribute string(String value) {
    return new NotificationAttribute(STRING_TYPE, value);
  }
}
