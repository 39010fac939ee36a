/*
 * どこで: Timeclock ドメインモデル
 * 何を: 勤怠サービスのリクエスト単位のエラーコードを定義する
 * なぜ: 正常な応答で返るため接続障害とは区別するため
 */
package com.example.timeclock.model;

import java.util.Optional;

public enum SystemErrorCode {
  CONNECTION_NOT_SECURE(-1, "Connection not secure"),
  INPUT_PARAMETERS_NOT_FOUND(-2, "Input parameters not found"),
  CLIENT_NOT_AUTHORIZED(-3, "Client not authorized"),
  INVALID_INPUT_FORMAT(-4, "Invalid input parameter format"),
  TOO_FEW_PARAMETERS(-5, "Too few input parameters"),
  INVALID_DATE(-6, "Invalid date");

  private final int code;
  private final String message;

  SystemErrorCode(int code, String message) {
    this.code = code;
    this.message = message;
  }

  public int code() {
    return code;
  }

  public String message() {
    return message;
  }

  public static Optional<SystemErrorCode> fromCode(int code) {
    for (SystemErrorCode value : values()) {
      if (value.code == code) {
        return Optional.of(value);
      }
    }
    return Optional.empty();
  }
}
