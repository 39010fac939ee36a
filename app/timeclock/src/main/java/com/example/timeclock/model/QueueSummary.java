/*
 * どこで: Timeclock ドメインモデル
 * 何を: オフラインキューの集計値を表す
 * なぜ: キュー内の打刻は管理者向けのこの集計からしか見えないため
 */
package com.example.timeclock.model;

import java.time.Instant;

public record QueueSummary(int queued, int syncing, int rejected, Instant oldestPunchTimestamp) {

  public int active() {
    return queued + syncing;
  }
}
