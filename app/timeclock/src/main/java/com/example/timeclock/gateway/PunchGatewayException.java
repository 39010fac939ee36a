/*
 * どこで: Timeclock ゲートウェイ層
 * 何を: リモート勤怠呼び出しの分類済み失敗を表す
 * なぜ: 呼び出し側が理由だけでキュー投入/再送/拒否を判断できるようにするため
 */
package com.example.timeclock.gateway;

public class PunchGatewayException extends RuntimeException {

  public enum Reason {
    NETWORK,
    TIMEOUT,
    INVALID_RESPONSE,
    SERVICE_FAULT
  }

  private final Reason reason;
  private final Integer exceptionCode;

  public PunchGatewayException(Reason reason, String message) {
    this(reason, message, null, null);
  }

  public PunchGatewayException(Reason reason, String message, Throwable cause) {
    this(reason, message, null, cause);
  }

  public PunchGatewayException(
      Reason reason, String message, Integer exceptionCode, Throwable cause) {
    super(message, cause);
    this.reason = reason;
    this.exceptionCode = exceptionCode;
  }

  public Reason reason() {
    return reason;
  }

  /** {@link Reason#SERVICE_FAULT} の業務ルールコード。それ以外は null。 */
  public Integer exceptionCode() {
    return exceptionCode;
  }

  public boolean isTransient() {
    return reason != Reason.SERVICE_FAULT;
  }
}
