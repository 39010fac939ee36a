/*
 * どこで: Timeclock 同期ワーカー
 * 何を: 定期実行と接続回復通知でキュー排出を開始する
 * なぜ: ネットワーク回復後 1 ポーリング間隔以内に待機中の打刻を送るため
 */
package com.example.timeclock.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.event.EventListener;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(name = "timeclock.sync.enabled", havingValue = "true", matchIfMissing = true)
public class SyncWorker {

  private static final Logger logger = LoggerFactory.getLogger(SyncWorker.class);

  private final SyncManager syncManager;
  private final TaskExecutor syncTaskExecutor;

  public SyncWorker(
      SyncManager syncManager, @Qualifier("syncTaskExecutor") TaskExecutor syncTaskExecutor) {
    this.syncManager = syncManager;
    this.syncTaskExecutor = syncTaskExecutor;
  }

  @Scheduled(fixedDelayString = "${timeclock.sync.poll-interval}")
  public void run() {
    syncManager.drain();
  }

  @EventListener
  public void onConnectivityRestored(ConnectivityRestoredEvent event) {
    logger.info(
        "punch sync requested source={} occurredAt={}", event.source(), event.occurredAt());
    try {
      syncTaskExecutor.execute(syncManager::drain);
    } catch (TaskRejectedException ex) {
      logger.info("punch sync request dropped, drains already pending source={}", event.source());
    }
  }
}
