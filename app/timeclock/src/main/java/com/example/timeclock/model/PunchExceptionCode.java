/*
 * どこで: Timeclock ドメインモデル
 * 何を: PunchException で返る業務ルールの識別子を定義する
 * なぜ: 拒否理由ごとに固定メッセージを従業員へ表示するため
 */
package com.example.timeclock.model;

public enum PunchExceptionCode {
  SHIFT_NOT_STARTED(1, "Shift not yet started. No punch recorded."),
  NOT_AUTHORIZED(2, "Not Authorized. No punch recorded."),
  SHIFT_FINISHED(3, "Shift has finished. No punch recorded.");

  private final int code;
  private final String message;

  PunchExceptionCode(int code, String message) {
    this.code = code;
    this.message = message;
  }

  public int code() {
    return code;
  }

  public String message() {
    return message;
  }

  /** 未知の非ゼロコードは未認可と同じ扱いで報告する。 */
  public static PunchExceptionCode fromCode(int code) {
    for (PunchExceptionCode value : values()) {
      if (value.code == code) {
        return value;
      }
    }
    return NOT_AUTHORIZED;
  }
}
