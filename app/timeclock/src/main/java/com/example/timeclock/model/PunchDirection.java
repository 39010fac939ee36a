/*
 * どこで: Timeclock ドメインモデル
 * 何を: リモート側が出勤/退勤のどちらで記録したかを表す
 * なぜ: キオスクで出勤と退勤の表示を分けるため
 */
package com.example.timeclock.model;

import java.util.Locale;

public enum PunchDirection {
  CHECK_IN,
  CHECK_OUT,
  UNKNOWN;

  public static PunchDirection fromWire(String punchType) {
    if (punchType == null) {
      return UNKNOWN;
    }
    return switch (punchType.trim().toLowerCase(Locale.ROOT)) {
      case "checkin" -> CHECK_IN;
      case "checkout" -> CHECK_OUT;
      default -> UNKNOWN;
    };
  }
}
