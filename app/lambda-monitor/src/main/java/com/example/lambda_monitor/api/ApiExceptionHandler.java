package com.example.lambda_monitor.api;

import com.example.lambda_monitor.service.MonitorConfigurationException;
import com.example.lambda_monitor.service.RunCorrelationException;
import com.example.lambda_monitor.service.SubscriptionDecodeException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class ApiExceptionHandler {

  private static final Logger logger = LoggerFactory.getLogger(ApiExceptionHandler.class);

  @ExceptionHandler(SubscriptionDecodeException.class)
  public ResponseEntity<ApiErrorResponse> handleDecode(SubscriptionDecodeException ex) {
    logger.warn("subscription envelope rejected", ex);
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(new ApiErrorResponse("MONITOR_BAD_ENVELOPE", ex.getMessage()));
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ApiErrorResponse> handleValidation(MethodArgumentNotValidException ex) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(new ApiErrorResponse("MONITOR_VALIDATION_ERROR", "request validation failed"));
  }

  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ResponseEntity<ApiErrorResponse> handleUnreadable(HttpMessageNotReadableException ex) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(new ApiErrorResponse("MONITOR_VALIDATION_ERROR", "request body is not readable"));
  }

  @ExceptionHandler(MonitorConfigurationException.class)
  public ResponseEntity<ApiErrorResponse> handleConfiguration(MonitorConfigurationException ex) {
    return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY)
        .body(new ApiErrorResponse("MONITOR_CONFIGURATION_ERROR", ex.getMessage()));
  }

  @ExceptionHandler(RunCorrelationException.class)
  public ResponseEntity<ApiErrorResponse> handleCorrelation(RunCorrelationException ex) {
    return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY)
        .body(new ApiErrorResponse("MONITOR_CORRELATION_FAILED", ex.getMessage()));
  }

  @ExceptionHandler(RuntimeException.class)
  public ResponseEntity<ApiErrorResponse> handleRuntime(RuntimeException ex) {
    logger.error("unexpected failure while handling subscription", ex);
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
        .body(new ApiErrorResponse("MONITOR_INTERNAL_ERROR", ex.getMessage()));
  }
}
