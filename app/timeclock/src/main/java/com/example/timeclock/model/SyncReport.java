/*
 * どこで: Timeclock ドメインモデル
 * 何を: 1 回のキュー排出の件数を表す
 * なぜ: ワーカーのログと手動同期 API の応答に使うため
 */
package com.example.timeclock.model;

public record SyncReport(int examined, int synced, int failed, int rejected, int deferred) {

  public static SyncReport empty() {
    return new SyncReport(0, 0, 0, 0, 0);
  }
}
