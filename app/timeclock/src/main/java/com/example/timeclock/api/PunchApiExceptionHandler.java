/*
 * どこで: Timeclock API
 * 何を: リクエスト不正とストレージ障害を HTTP 応答へ変換する
 * なぜ: キオスクと運用者に安定したエラーコードを返すため
 */
package com.example.timeclock.api;

import com.example.timeclock.service.OfflineQueueStorageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class PunchApiExceptionHandler {

  private static final Logger logger = LoggerFactory.getLogger(PunchApiExceptionHandler.class);

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ApiErrorResponse> handleValidation(MethodArgumentNotValidException ex) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(new ApiErrorResponse("PUNCH_VALIDATION_ERROR", "request validation failed"));
  }

  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ResponseEntity<ApiErrorResponse> handleUnreadable(HttpMessageNotReadableException ex) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(new ApiErrorResponse("PUNCH_BAD_REQUEST", "request body is not readable"));
  }

  @ExceptionHandler(OfflineQueueStorageException.class)
  public ResponseEntity<ApiErrorResponse> handleStorage(OfflineQueueStorageException ex) {
    logger.error("offline queue unavailable", ex);
    return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
        .body(new ApiErrorResponse("PUNCH_STORAGE_UNAVAILABLE", ex.getMessage()));
  }

  @ExceptionHandler(RuntimeException.class)
  public ResponseEntity<ApiErrorResponse> handleRuntime(RuntimeException ex) {
    logger.error("unexpected API failure", ex);
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
        .body(new ApiErrorResponse("PUNCH_INTERNAL_ERROR", ex.getMessage()));
  }
}
