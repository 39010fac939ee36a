/*
 * どこで: Timeclock ドメインモデル
 * 何を: 打刻 1 件のライフサイクル状態を定義する
 * なぜ: コーディネータ/キュー/同期で同じ検証済み状態遷移を共有するため
 */
package com.example.timeclock.model;

import java.util.EnumSet;
import java.util.Set;

public enum PunchStatus {
  RECEIVED,
  SUBMITTING,
  OFFLINE_QUEUED,
  SYNCING,
  SYNCED,
  REJECTED;

  public boolean isTerminal() {
    return this == SYNCED || this == REJECTED;
  }

  public boolean canTransitionTo(PunchStatus next) {
    return !isTerminal() && allowedNext().contains(next);
  }

  private Set<PunchStatus> allowedNext() {
    return switch (this) {
      case RECEIVED -> EnumSet.of(SUBMITTING);
      case SUBMITTING -> EnumSet.of(SYNCED, REJECTED, OFFLINE_QUEUED);
      case OFFLINE_QUEUED -> EnumSet.of(SYNCING, REJECTED);
      // 一時的な失敗では次の試行のためにキューへ戻す
      case SYNCING -> EnumSet.of(SYNCED, REJECTED, OFFLINE_QUEUED);
      case SYNCED, REJECTED -> EnumSet.noneOf(PunchStatus.class);
    };
  }
}
