/*
 * どこで: Timeclock クリーンアップワーカー
 * 何を: 打刻保持期間の掃除を定期実行する
 * なぜ: 手動対応なしで削除を自動化するため
 */
package com.example.timeclock.service;

import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "timeclock.retention.enabled", havingValue = "true")
public class PunchRetentionWorker {

  private final PunchRetentionService retentionService;

  @Scheduled(fixedDelayString = "${timeclock.retention.cleanup-interval}")
  public void run() {
    retentionService.cleanup();
  }
}
