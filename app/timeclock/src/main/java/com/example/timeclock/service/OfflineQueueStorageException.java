/*
 * どこで: Timeclock サービス層
 * 何を: オフラインキューが打刻を永続化/更新できなかったことを表す
 * なぜ: 保存できない打刻を黙って消さず運用者に見せるため
 */
package com.example.timeclock.service;

public class OfflineQueueStorageException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  public OfflineQueueStorageException(String message) {
    super(message);
  }

  public OfflineQueueStorageException(String message, Throwable cause) {
    super(message, cause);
  }
}
